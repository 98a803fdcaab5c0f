package github.sarthakdev143.render_kit.model;

/**
 * What happens to the frames already encoded when a job is cancelled.
 */
public enum CancelledOutputPolicy {
    KEEP_PARTIAL,
    DELETE_PARTIAL
}
