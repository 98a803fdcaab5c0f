package github.sarthakdev143.render_kit.exception;

/**
 * Raised inside the pipeline when a thread waiting on frame data is interrupted; the job ends as cancelled.
 */
public class ConversionCancelledException extends ConversionException {

    public ConversionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
