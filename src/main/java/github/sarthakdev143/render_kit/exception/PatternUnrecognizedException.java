package github.sarthakdev143.render_kit.exception;

public class PatternUnrecognizedException extends ConversionException {

    private final String pattern;

    public PatternUnrecognizedException(String pattern) {
        super("No supported frame numbering scheme found in pattern: " + pattern);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
