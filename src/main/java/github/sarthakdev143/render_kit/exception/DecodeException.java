package github.sarthakdev143.render_kit.exception;

import java.nio.file.Path;

/**
 * Decoding a single (file, layer) pair failed. Retryable: the decode cache never remembers a failure.
 */
public class DecodeException extends ConversionException {

    private final Path path;
    private final String layer;
    private final Integer frameIndex;

    public DecodeException(Path path, String layer, String message, Throwable cause) {
        this(path, layer, null, message, cause);
    }

    private DecodeException(Path path, String layer, Integer frameIndex, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.layer = layer;
        this.frameIndex = frameIndex;
    }

    public DecodeException forFrame(int frame) {
        return new DecodeException(
                path,
                layer,
                frame,
                "Failed to decode frame " + frame + " (" + describeLayer(layer) + ")"
                        + (path == null ? "" : " from " + path) + ": " + getMessage(),
                this);
    }

    public Path path() {
        return path;
    }

    public String layer() {
        return layer;
    }

    public Integer frameIndex() {
        return frameIndex;
    }

    private static String describeLayer(String layer) {
        return layer == null || layer.isEmpty() ? "default layer" : "layer " + layer;
    }
}
