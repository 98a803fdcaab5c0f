package github.sarthakdev143.render_kit.integration.video;

import java.util.Objects;

/**
 * Stream parameters fixed when the encoder opens. Every frame written afterwards must be {@code width x height}.
 */
public record EncoderHeader(
        int width,
        int height,
        double frameRate,
        String pixelFormat,
        String codec,
        NativeQuality quality,
        Integer bitrateKbps) {

    public static final String RGB24 = "rgb24";

    public EncoderHeader {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Encoder frame size must be positive, got " + width + "x" + height + ".");
        }
        if (!(frameRate > 0.0)) {
            throw new IllegalArgumentException("Encoder frame rate must be greater than 0.");
        }
        Objects.requireNonNull(codec, "codec");
        pixelFormat = pixelFormat == null ? RGB24 : pixelFormat;
        quality = quality == null ? NativeQuality.none() : quality;
    }
}
