package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.model.BurnInOptions;
import github.sarthakdev143.render_kit.model.DecodedBuffer;

import java.util.Locale;

/**
 * Stamps frame number, layer name and frame rate into a darkened bar along the top of each frame.
 */
public class BurnInRenderer {

    static final double BAR_HEIGHT_FRACTION = 0.05;
    static final int MIN_BAR_HEIGHT = 18;

    private final TextPainter textPainter;
    private final BurnInOptions options;
    private final int frameDigits;
    private final String layerLabel;
    private final double frameRate;

    /**
     * @param frameDigits zero padding of the frame number, usually the sequence's padding width
     * @param layerLabel  layer name, or names joined with {@code /} for a contact sheet
     */
    public BurnInRenderer(
            TextPainter textPainter,
            BurnInOptions options,
            int frameDigits,
            String layerLabel,
            double frameRate) {
        this.textPainter = textPainter;
        this.options = options;
        this.frameDigits = Math.max(1, frameDigits);
        this.layerLabel = layerLabel == null || layerLabel.isEmpty() ? "default" : layerLabel;
        this.frameRate = frameRate;
    }

    public boolean enabled() {
        return options.enabled();
    }

    public DecodedBuffer apply(int frameIndex, DecodedBuffer frame) {
        if (!options.enabled()) {
            return frame;
        }

        FrameRaster raster = FrameRaster.copyOf(frame);
        int barHeight = barHeight(frame.height());
        raster.scaleRows(0, barHeight, (float) (1.0 - options.opacity()));

        int margin = Math.max(2, barHeight / 4);
        if (options.frameNumber()) {
            textPainter.paint(raster, frameText(frameIndex), margin, 0, barHeight, TextAlignment.LEFT);
        }
        if (options.layerName()) {
            textPainter.paint(raster, "Layer: " + layerLabel, frame.width() / 2, 0, barHeight, TextAlignment.CENTER);
        }
        if (options.frameRate()) {
            textPainter.paint(
                    raster,
                    String.format(Locale.ROOT, "FPS: %.2f", frameRate),
                    frame.width() - margin,
                    0,
                    barHeight,
                    TextAlignment.RIGHT);
        }
        return raster.toBuffer();
    }

    String frameText(int frameIndex) {
        return String.format(Locale.ROOT, "Frame: %0" + frameDigits + "d", frameIndex);
    }

    static int barHeight(int frameHeight) {
        int height = Math.max(MIN_BAR_HEIGHT, (int) Math.round(frameHeight * BAR_HEIGHT_FRACTION));
        return Math.min(frameHeight, height);
    }
}
