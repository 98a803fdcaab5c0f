package github.sarthakdev143.render_kit.exception;

public class FrameProcessingException extends ConversionException {

    private final int frameIndex;
    private final String stage;

    public FrameProcessingException(int frameIndex, String stage, Throwable cause) {
        super("Frame " + frameIndex + " failed during " + stage + ": " + cause.getMessage(), cause);
        this.frameIndex = frameIndex;
        this.stage = stage;
    }

    public int frameIndex() {
        return frameIndex;
    }

    public String stage() {
        return stage;
    }
}
