package github.sarthakdev143.render_kit.exception;

/**
 * Base type for every failure a conversion job can report as its terminal error.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
