package github.sarthakdev143.render_kit.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

public record ConversionConfig(
        String inputPattern,
        Path outputPath,
        Double frameRate,
        OutputResolution outputResolution,
        ColorSpaceSelection colorSpace,
        String codec,
        int quality,
        Integer bitrateKbps,
        Integer startFrame,
        Integer endFrame,
        LayerSelector layers,
        ContactSheetLayout contactSheet,
        BurnInOptions burnIn,
        OverwritePolicy overwritePolicy,
        CancelledOutputPolicy cancelledOutputPolicy,
        Integer prefetchWorkers,
        Integer prefetchWindow) {

    public static final String DEFAULT_CODEC = "libx264";
    public static final int DEFAULT_QUALITY = 10;
    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 10;

    public ConversionConfig {
        if (inputPattern == null || inputPattern.isBlank()) {
            throw new IllegalArgumentException("Input pattern is required.");
        }
        Objects.requireNonNull(outputPath, "Output path is required.");
        if (frameRate != null && (frameRate.isNaN() || frameRate <= 0.0)) {
            throw new IllegalArgumentException("Frame rate must be greater than 0.");
        }
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new IllegalArgumentException("Quality must be between " + MIN_QUALITY + " and " + MAX_QUALITY + ".");
        }
        if (bitrateKbps != null && bitrateKbps <= 0) {
            throw new IllegalArgumentException("Bitrate must be greater than 0.");
        }
        if (startFrame != null && endFrame != null && startFrame > endFrame) {
            throw new IllegalArgumentException("Start frame must be <= end frame.");
        }
        if (prefetchWorkers != null && prefetchWorkers <= 0) {
            throw new IllegalArgumentException("Number of prefetch workers must be greater than 0.");
        }
        if (prefetchWindow != null && prefetchWindow <= 0) {
            throw new IllegalArgumentException("Prefetch window must be greater than 0.");
        }

        colorSpace = colorSpace == null ? ColorSpaceSelection.preset(ColorSpacePreset.LINEAR_TO_SRGB) : colorSpace;
        codec = codec == null || codec.isBlank() ? DEFAULT_CODEC : codec.trim();
        layers = layers == null ? LayerSelector.defaultLayer() : layers;
        if (contactSheet == null && layers.impliesContactSheet()) {
            contactSheet = ContactSheetLayout.defaults();
        }
        burnIn = burnIn == null ? BurnInOptions.none() : burnIn;
        overwritePolicy = overwritePolicy == null ? OverwritePolicy.REFUSE : overwritePolicy;
        cancelledOutputPolicy = cancelledOutputPolicy == null
                ? CancelledOutputPolicy.KEEP_PARTIAL
                : cancelledOutputPolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contactSheetMode() {
        return contactSheet != null;
    }

    public static final class Builder {

        private String inputPattern;
        private Path outputPath;
        private Double frameRate;
        private OutputResolution outputResolution;
        private ColorSpaceSelection colorSpace;
        private String codec;
        private int quality = DEFAULT_QUALITY;
        private Integer bitrateKbps;
        private Integer startFrame;
        private Integer endFrame;
        private LayerSelector layers;
        private ContactSheetLayout contactSheet;
        private BurnInOptions burnIn;
        private OverwritePolicy overwritePolicy;
        private CancelledOutputPolicy cancelledOutputPolicy;
        private Integer prefetchWorkers;
        private Integer prefetchWindow;

        private Builder() {
        }

        public Builder inputPattern(String inputPattern) {
            this.inputPattern = inputPattern;
            return this;
        }

        public Builder outputPath(Path outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder frameRate(Double frameRate) {
            this.frameRate = frameRate;
            return this;
        }

        public Builder resolution(int width, int height) {
            this.outputResolution = new OutputResolution(width, height);
            return this;
        }

        public Builder colorSpacePreset(ColorSpacePreset preset) {
            this.colorSpace = ColorSpaceSelection.preset(preset);
            return this;
        }

        public Builder explicitColorSpaces(String sourceSpace, String targetSpace) {
            this.colorSpace = ColorSpaceSelection.explicit(sourceSpace, targetSpace);
            return this;
        }

        public Builder colorSpace(ColorSpaceSelection colorSpace) {
            this.colorSpace = colorSpace;
            return this;
        }

        public Builder codec(String codec) {
            this.codec = codec;
            return this;
        }

        public Builder quality(int quality) {
            this.quality = quality;
            return this;
        }

        public Builder bitrateKbps(Integer bitrateKbps) {
            this.bitrateKbps = bitrateKbps;
            return this;
        }

        public Builder frameRange(Integer startFrame, Integer endFrame) {
            this.startFrame = startFrame;
            this.endFrame = endFrame;
            return this;
        }

        public Builder layers(String... layers) {
            this.layers = new LayerSelector(List.of(layers));
            return this;
        }

        public Builder layers(LayerSelector layers) {
            this.layers = layers;
            return this;
        }

        public Builder contactSheet(ContactSheetLayout contactSheet) {
            this.contactSheet = contactSheet;
            return this;
        }

        public Builder burnIn(BurnInOptions burnIn) {
            this.burnIn = burnIn;
            return this;
        }

        public Builder overwrite(boolean overwrite) {
            this.overwritePolicy = overwrite ? OverwritePolicy.OVERWRITE : OverwritePolicy.REFUSE;
            return this;
        }

        public Builder cancelledOutputPolicy(CancelledOutputPolicy cancelledOutputPolicy) {
            this.cancelledOutputPolicy = cancelledOutputPolicy;
            return this;
        }

        public Builder prefetch(Integer workers, Integer window) {
            this.prefetchWorkers = workers;
            this.prefetchWindow = window;
            return this;
        }

        public ConversionConfig build() {
            return new ConversionConfig(
                    inputPattern,
                    outputPath,
                    frameRate,
                    outputResolution,
                    colorSpace,
                    codec,
                    quality,
                    bitrateKbps,
                    startFrame,
                    endFrame,
                    layers,
                    contactSheet,
                    burnIn,
                    overwritePolicy,
                    cancelledOutputPolicy,
                    prefetchWorkers,
                    prefetchWindow);
        }
    }
}
