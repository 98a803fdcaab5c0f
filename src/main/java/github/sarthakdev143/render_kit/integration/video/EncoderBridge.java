package github.sarthakdev143.render_kit.integration.video;

import github.sarthakdev143.render_kit.exception.EncoderUnavailableException;

import java.nio.file.Path;

/**
 * Seam between the pipeline and an external video encoder.
 */
public interface EncoderBridge {

    /**
     * Checks that {@code codec} (or an alias of it) can be encoded, falling back to a related encoder when the
     * requested one is missing.
     *
     * @return the encoder name that {@link #open} will use
     * @throws EncoderUnavailableException when the encoder binary is missing or no usable encoder is found
     */
    String probe(String codec);

    /**
     * Starts an encoder writing to {@code outputPath}.
     *
     * @throws EncoderUnavailableException when the encoder cannot be started
     */
    EncoderSession open(EncoderHeader header, Path outputPath);
}
