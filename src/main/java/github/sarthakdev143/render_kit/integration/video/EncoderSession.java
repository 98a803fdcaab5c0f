package github.sarthakdev143.render_kit.integration.video;

import github.sarthakdev143.render_kit.exception.EncoderStreamException;
import github.sarthakdev143.render_kit.model.DecodedBuffer;

/**
 * An open encoder stream. Owned by one thread; exactly one of {@link #finish()} or {@link #abort()} ends it.
 */
public interface EncoderSession {

    /**
     * @throws EncoderStreamException when the frame does not match the header or the encoder rejected it
     */
    void writeFrame(DecodedBuffer frame);

    /**
     * Closes the input and waits for the encoder to finalize the container.
     *
     * @throws EncoderStreamException when the encoder exits abnormally or times out
     */
    void finish();

    /**
     * Stops the encoder without finalizing. Never throws.
     */
    void abort();
}
