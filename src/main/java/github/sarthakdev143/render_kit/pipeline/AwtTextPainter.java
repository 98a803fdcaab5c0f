package github.sarthakdev143.render_kit.pipeline;

import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;

/**
 * Renders text with Java2D into a gray coverage mask, then blends the mask onto the raster.
 */
@Component
public class AwtTextPainter implements TextPainter {

    private static final float GLYPH_TO_LINE_RATIO = 0.7f;

    @Override
    public void paint(FrameRaster raster, String text, int x, int top, int lineHeight, TextAlignment alignment) {
        if (text == null || text.isEmpty() || lineHeight <= 0) {
            return;
        }

        Font font = new Font(Font.SANS_SERIF, Font.PLAIN, Math.max(1, Math.round(lineHeight * GLYPH_TO_LINE_RATIO)));
        BufferedImage measureImage = new BufferedImage(1, 1, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D measureGraphics = measureImage.createGraphics();
        FontMetrics metrics;
        try {
            metrics = measureGraphics.getFontMetrics(font);
        } finally {
            measureGraphics.dispose();
        }

        int textWidth = Math.max(1, metrics.stringWidth(text));
        BufferedImage mask = new BufferedImage(textWidth, lineHeight, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D graphics = mask.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            graphics.setFont(font);
            graphics.setColor(Color.WHITE);
            int baseline = (lineHeight - metrics.getHeight()) / 2 + metrics.getAscent();
            graphics.drawString(text, 0, baseline);
        } finally {
            graphics.dispose();
        }

        int left = switch (alignment) {
            case LEFT -> x;
            case CENTER -> x - textWidth / 2;
            case RIGHT -> x - textWidth;
        };

        Raster coverage = mask.getRaster();
        for (int my = 0; my < lineHeight; my++) {
            for (int mx = 0; mx < textWidth; mx++) {
                int level = coverage.getSample(mx, my, 0);
                if (level > 0) {
                    raster.blend(left + mx, top + my, 1.0f, level / 255.0f);
                }
            }
        }
    }
}
