package github.sarthakdev143.render_kit.model;

public record BurnInOptions(boolean frameNumber, boolean layerName, boolean frameRate, double opacity) {

    public static final double DEFAULT_OPACITY = 0.3;

    public BurnInOptions {
        if (opacity < 0.0 || opacity > 1.0) {
            throw new IllegalArgumentException("Burn-in opacity must be between 0 and 1.");
        }
    }

    public static BurnInOptions none() {
        return new BurnInOptions(false, false, false, DEFAULT_OPACITY);
    }

    public boolean enabled() {
        return frameNumber || layerName || frameRate;
    }
}
