package github.sarthakdev143.render_kit.exception;

public class UnsupportedColorSpaceException extends ConversionException {

    private final String sourceSpace;
    private final String targetSpace;

    public UnsupportedColorSpaceException(String sourceSpace, String targetSpace, String reason) {
        super("Cannot convert color space '" + sourceSpace + "' to '" + targetSpace + "': " + reason);
        this.sourceSpace = sourceSpace;
        this.targetSpace = targetSpace;
    }

    public String sourceSpace() {
        return sourceSpace;
    }

    public String targetSpace() {
        return targetSpace;
    }
}
