package github.sarthakdev143.render_kit.model;

/**
 * Per-pixel color transform over normalized RGB values, applied in place.
 */
@FunctionalInterface
public interface PixelTransform {

    PixelTransform IDENTITY = rgb -> {
    };

    void apply(float[] rgb);
}
