package github.sarthakdev143.render_kit.integration.image;

import java.util.Optional;

public record ImageMetadata(Double frameRateHint, String colorSpaceTag) {

    public static ImageMetadata empty() {
        return new ImageMetadata(null, null);
    }

    public Optional<Double> frameRate() {
        return Optional.ofNullable(frameRateHint);
    }

    public Optional<String> colorSpace() {
        return Optional.ofNullable(colorSpaceTag);
    }
}
