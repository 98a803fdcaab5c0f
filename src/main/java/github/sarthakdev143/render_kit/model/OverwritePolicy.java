package github.sarthakdev143.render_kit.model;

public enum OverwritePolicy {
    REFUSE,
    OVERWRITE
}
