package github.sarthakdev143.render_kit.model;

import github.sarthakdev143.render_kit.exception.ConversionException;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime state of one conversion run. Written by the orchestrator thread; the cancellation flag may be raised
 * from any thread.
 */
public final class ConversionJob {

    private final String id;
    private final ConversionConfig config;
    private final AtomicReference<ConversionJobState> state = new AtomicReference<>(ConversionJobState.IDLE);
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final AtomicInteger completedFrames = new AtomicInteger();
    private final AtomicReference<ConversionException> firstError = new AtomicReference<>();
    private volatile int totalFrames;
    private volatile Integer currentFrame;

    public ConversionJob(String id, ConversionConfig config) {
        this.id = Objects.requireNonNull(id, "id");
        this.config = Objects.requireNonNull(config, "config");
    }

    public String id() {
        return id;
    }

    public ConversionConfig config() {
        return config;
    }

    public ConversionJobState state() {
        return state.get();
    }

    /**
     * Moves to {@code next} unless the job already reached a terminal state.
     */
    public boolean transitionTo(ConversionJobState next) {
        ConversionJobState current;
        do {
            current = state.get();
            if (current.isTerminal()) {
                return false;
            }
        } while (!state.compareAndSet(current, next));
        return true;
    }

    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public int completedFrames() {
        return completedFrames.get();
    }

    public int incrementCompleted() {
        return completedFrames.incrementAndGet();
    }

    public int totalFrames() {
        return totalFrames;
    }

    public void setTotalFrames(int totalFrames) {
        this.totalFrames = totalFrames;
    }

    public Integer currentFrame() {
        return currentFrame;
    }

    public void setCurrentFrame(Integer currentFrame) {
        this.currentFrame = currentFrame;
    }

    /**
     * Keeps the first error only; later ones are symptoms of the first.
     */
    public ConversionException recordError(ConversionException error) {
        firstError.compareAndSet(null, error);
        return firstError.get();
    }

    public ConversionException firstError() {
        return firstError.get();
    }
}
