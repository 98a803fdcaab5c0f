package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.exception.ConversionException;
import github.sarthakdev143.render_kit.exception.DecodeException;
import github.sarthakdev143.render_kit.exception.FrameProcessingException;
import github.sarthakdev143.render_kit.model.LayerBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Loads frames ahead of the consumer on a worker pool and hands them back strictly in sequence order.
 *
 * <p>At most {@code window} frames are outstanding; loads may finish in any order and wait in a reorder map
 * until their turn. Not thread-safe: one consumer thread calls {@link #next()}.</p>
 */
public class PrefetchScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PrefetchScheduler.class);

    private final List<Integer> frames;
    private final FrameLoader loader;
    private final ExecutorService workers;
    private final int window;
    private final Duration timeout;
    private final Map<Integer, Future<List<LayerBuffer>>> pending = new HashMap<>();
    private int issueIndex;
    private int deliverIndex;
    private boolean cancelled;

    /**
     * @param timeout longest wait for a single frame, or {@code null} to wait indefinitely
     */
    public PrefetchScheduler(
            List<Integer> frames,
            FrameLoader loader,
            ExecutorService workers,
            int window,
            Duration timeout) {
        if (window <= 0) {
            throw new IllegalArgumentException("Prefetch window must be greater than 0.");
        }
        this.frames = List.copyOf(frames);
        this.loader = loader;
        this.workers = workers;
        this.window = window;
        this.timeout = timeout;
    }

    public boolean hasNext() {
        return !cancelled && deliverIndex < frames.size();
    }

    /**
     * Blocks until the next frame in sequence order is loaded.
     *
     * @throws DecodeException      with the frame index attached when a layer of that frame failed to decode
     * @throws InterruptedException when interrupted while waiting
     */
    public LoadedFrame next() throws InterruptedException {
        if (!hasNext()) {
            throw new NoSuchElementException("No more frames to deliver.");
        }
        issue();

        int frame = frames.get(deliverIndex++);
        Future<List<LayerBuffer>> result = pending.remove(frame);
        List<LayerBuffer> layers = await(frame, result);
        issue();
        return new LoadedFrame(frame, layers);
    }

    /**
     * Abandons outstanding loads. Queued loads never start; running ones finish and are discarded.
     */
    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        int abandoned = pending.size();
        for (Future<List<LayerBuffer>> future : pending.values()) {
            future.cancel(false);
        }
        pending.clear();
        if (abandoned > 0) {
            logger.debug("Abandoned {} outstanding frame load(s)", abandoned);
        }
    }

    public int outstanding() {
        return pending.size();
    }

    @Override
    public void close() {
        cancel();
    }

    private void issue() {
        while (!cancelled && issueIndex < frames.size() && pending.size() < window) {
            int frame = frames.get(issueIndex++);
            pending.put(frame, workers.submit(() -> loader.load(frame)));
        }
    }

    private List<LayerBuffer> await(int frame, Future<List<LayerBuffer>> result) throws InterruptedException {
        try {
            if (timeout == null) {
                return result.get();
            }
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DecodeException decodeException) {
                throw decodeException.forFrame(frame);
            }
            if (cause instanceof InterruptedException) {
                throw new InterruptedException("Frame " + frame + " load was interrupted.");
            }
            if (cause instanceof ConversionException conversionException) {
                throw conversionException;
            }
            throw new FrameProcessingException(frame, "decode", cause);
        } catch (TimeoutException e) {
            result.cancel(true);
            throw new DecodeException(null, null, "Timed out after " + timeout.toMillis() + " ms", e).forFrame(frame);
        }
    }
}
