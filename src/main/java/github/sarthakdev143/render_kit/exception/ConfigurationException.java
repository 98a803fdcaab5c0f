package github.sarthakdev143.render_kit.exception;

public class ConfigurationException extends ConversionException {

    public ConfigurationException(String message) {
        super(message);
    }
}
