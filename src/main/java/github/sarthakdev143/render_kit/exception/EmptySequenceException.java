package github.sarthakdev143.render_kit.exception;

public class EmptySequenceException extends ConversionException {

    public EmptySequenceException(String message) {
        super(message);
    }

    public EmptySequenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
