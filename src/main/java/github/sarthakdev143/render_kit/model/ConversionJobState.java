package github.sarthakdev143.render_kit.model;

public enum ConversionJobState {
    IDLE,
    RESOLVING,
    CONVERTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
