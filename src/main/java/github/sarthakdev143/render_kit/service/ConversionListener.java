package github.sarthakdev143.render_kit.service;

import github.sarthakdev143.render_kit.model.ConversionResult;

/**
 * Receives job events on the job's worker thread. Implementations must return quickly.
 */
public interface ConversionListener {

    ConversionListener NONE = new ConversionListener() {
    };

    /**
     * Called after each frame reaches the encoder; {@code completed} runs from 1 to {@code total}.
     */
    default void onProgress(int completed, int total) {
    }

    default void onFinished(ConversionResult result) {
    }
}
