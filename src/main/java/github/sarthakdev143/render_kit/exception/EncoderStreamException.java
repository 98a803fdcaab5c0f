package github.sarthakdev143.render_kit.exception;

public class EncoderStreamException extends ConversionException {

    public EncoderStreamException(String message) {
        super(message);
    }

    public EncoderStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
