package github.sarthakdev143.render_kit.pipeline;

/**
 * Draws white text onto a raster. Used for contact sheet labels and burn-ins.
 */
public interface TextPainter {

    /**
     * @param x         anchor, interpreted according to {@code alignment}
     * @param top       top edge of the text line
     * @param lineHeight height of the text line in pixels; glyphs are sized to fit it
     */
    void paint(FrameRaster raster, String text, int x, int top, int lineHeight, TextAlignment alignment);
}
