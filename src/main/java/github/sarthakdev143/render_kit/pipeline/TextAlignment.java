package github.sarthakdev143.render_kit.pipeline;

/**
 * Which edge of the text the anchor x coordinate refers to.
 */
public enum TextAlignment {
    LEFT,
    CENTER,
    RIGHT
}
