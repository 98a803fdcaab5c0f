package github.sarthakdev143.render_kit.exception;

public class EncoderUnavailableException extends ConversionException {

    public EncoderUnavailableException(String message) {
        super(message);
    }

    public EncoderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
