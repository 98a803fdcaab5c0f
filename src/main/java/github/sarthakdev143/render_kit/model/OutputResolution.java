package github.sarthakdev143.render_kit.model;

public record OutputResolution(int width, int height) {

    public OutputResolution {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Output width and height must be greater than 0.");
        }
    }
}
