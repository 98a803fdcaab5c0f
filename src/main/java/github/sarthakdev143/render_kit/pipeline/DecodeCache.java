package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.exception.DecodeException;
import github.sarthakdev143.render_kit.integration.image.ImageReader;
import github.sarthakdev143.render_kit.model.CacheKey;
import github.sarthakdev143.render_kit.model.DecodedBuffer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, single-flight cache of decoded layers, keyed by (file, layer).
 *
 * <p>Concurrent fetches of one key share a single decode. Failures are delivered to every waiter of that decode
 * and are not remembered, so a later fetch retries. Before a new decode is admitted, least recently used entries
 * that are decoded and not being handed out are evicted until both the entry and byte limits hold; when nothing
 * can be evicted the caller waits. Decoding runs outside the lock.</p>
 */
public class DecodeCache {

    private static final Logger logger = LoggerFactory.getLogger(DecodeCache.class);

    private final ImageReader imageReader;
    private final int maxEntries;
    private final long maxBytes;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition capacityReleased = lock.newCondition();
    private final LinkedHashMap<CacheKey, Slot> slots = new LinkedHashMap<>(16, 0.75f, true);
    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter evictionCounter;
    private final Counter failureCounter;
    private long residentBytes;

    public DecodeCache(ImageReader imageReader, int maxEntries, long maxBytes, MeterRegistry meterRegistry) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Cache must hold at least one entry.");
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("Cache byte budget must be greater than 0.");
        }
        this.imageReader = imageReader;
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
        this.hitCounter = meterRegistry.counter("render_kit.cache.hits");
        this.missCounter = meterRegistry.counter("render_kit.cache.misses");
        this.evictionCounter = meterRegistry.counter("render_kit.cache.evictions");
        this.failureCounter = meterRegistry.counter("render_kit.cache.failures");
    }

    /**
     * Returns the decoded buffer for {@code key}, decoding it at most once across concurrent callers.
     *
     * @throws DecodeException       when the decode failed; every concurrent waiter receives the same instance
     * @throws InterruptedException  when interrupted while waiting for capacity or for another caller's decode
     */
    public DecodedBuffer fetch(CacheKey key) throws InterruptedException {
        Slot slot;
        boolean owner = false;

        lock.lockInterruptibly();
        try {
            while (true) {
                slot = slots.get(key);
                if (slot != null) {
                    hitCounter.increment();
                    break;
                }
                if (makeRoom()) {
                    slot = new Slot();
                    slots.put(key, slot);
                    owner = true;
                    missCounter.increment();
                    break;
                }
                logger.debug("Decode cache full ({} entries, {} bytes); waiting to admit {}", slots.size(), residentBytes, key);
                capacityReleased.await();
            }
            slot.references++;
        } finally {
            lock.unlock();
        }

        try {
            if (owner) {
                decodeInto(key, slot);
            }
            return await(slot);
        } finally {
            release(slot);
        }
    }

    /**
     * Drops every entry. Called when a job ends.
     */
    public void clear() {
        lock.lock();
        try {
            slots.clear();
            residentBytes = 0;
            capacityReleased.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return slots.size();
        } finally {
            lock.unlock();
        }
    }

    public long residentBytes() {
        lock.lock();
        try {
            return residentBytes;
        } finally {
            lock.unlock();
        }
    }

    private void decodeInto(CacheKey key, Slot slot) {
        DecodedBuffer buffer;
        try {
            buffer = imageReader.decode(key.path(), key.layer());
        } catch (DecodeException e) {
            fail(key, slot, e);
            return;
        } catch (RuntimeException e) {
            fail(key, slot, new DecodeException(key.path(), key.layer(), e.getMessage(), e));
            return;
        }

        lock.lock();
        try {
            slot.bytes = buffer.byteSize();
            slot.ready = true;
            if (slots.get(key) == slot) {
                residentBytes += slot.bytes;
            }
        } finally {
            lock.unlock();
        }
        slot.result.complete(buffer);
    }

    private void fail(CacheKey key, Slot slot, DecodeException error) {
        lock.lock();
        try {
            slots.remove(key, slot);
            failureCounter.increment();
            capacityReleased.signalAll();
        } finally {
            lock.unlock();
        }
        logger.debug("Decode of {} failed: {}", key, error.getMessage());
        slot.result.completeExceptionally(error);
    }

    private DecodedBuffer await(Slot slot) throws InterruptedException {
        try {
            return slot.result.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DecodeException decodeException) {
                throw decodeException;
            }
            throw new IllegalStateException("Unexpected decode failure", cause);
        }
    }

    private void release(Slot slot) {
        lock.lock();
        try {
            slot.references--;
            if (slot.references == 0) {
                capacityReleased.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evicts until one more entry fits. Caller holds the lock.
     *
     * @return false when the limits cannot be met because every remaining entry is in use
     */
    private boolean makeRoom() {
        Iterator<Map.Entry<CacheKey, Slot>> eldestFirst = slots.entrySet().iterator();
        while (slots.size() >= maxEntries || residentBytes >= maxBytes) {
            Map.Entry<CacheKey, Slot> candidate = null;
            while (eldestFirst.hasNext()) {
                Map.Entry<CacheKey, Slot> entry = eldestFirst.next();
                if (entry.getValue().ready && entry.getValue().references == 0) {
                    candidate = entry;
                    break;
                }
            }
            if (candidate == null) {
                return false;
            }
            residentBytes -= candidate.getValue().bytes;
            eldestFirst.remove();
            evictionCounter.increment();
            logger.debug("Evicted {} from decode cache", candidate.getKey());
        }
        return true;
    }

    private static final class Slot {

        private final CompletableFuture<DecodedBuffer> result = new CompletableFuture<>();
        private int references;
        private long bytes;
        private boolean ready;
    }
}
