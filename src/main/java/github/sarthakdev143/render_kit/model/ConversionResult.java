package github.sarthakdev143.render_kit.model;

import github.sarthakdev143.render_kit.exception.ConversionException;

import java.nio.file.Path;

/**
 * Terminal outcome of a job. {@code outputPath} is set on completion, and on cancellation when the partial
 * video was kept.
 */
public record ConversionResult(Outcome outcome, Path outputPath, ConversionException error) {

    public enum Outcome {
        COMPLETED,
        FAILED,
        CANCELLED
    }

    public static ConversionResult completed(Path outputPath) {
        return new ConversionResult(Outcome.COMPLETED, outputPath, null);
    }

    public static ConversionResult failed(ConversionException error) {
        return new ConversionResult(Outcome.FAILED, null, error);
    }

    public static ConversionResult cancelled(Path partialOutput) {
        return new ConversionResult(Outcome.CANCELLED, partialOutput, null);
    }

    public ConversionJobState state() {
        return switch (outcome) {
            case COMPLETED -> ConversionJobState.COMPLETED;
            case FAILED -> ConversionJobState.FAILED;
            case CANCELLED -> ConversionJobState.CANCELLED;
        };
    }
}
