package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.exception.DecodeException;
import github.sarthakdev143.render_kit.integration.image.ImageMetadata;
import github.sarthakdev143.render_kit.integration.image.ImageReader;
import github.sarthakdev143.render_kit.model.CacheKey;
import github.sarthakdev143.render_kit.model.DecodedBuffer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecodeCacheTest {

    private static final Path FRAME_1 = Path.of("frames/shot.0001.exr");
    private static final Path FRAME_2 = Path.of("frames/shot.0002.exr");
    private static final Path FRAME_3 = Path.of("frames/shot.0003.exr");

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void fetchDecodesOnceAndServesHitsFromCache() throws Exception {
        CountingReader reader = new CountingReader();
        DecodeCache cache = new DecodeCache(reader, 8, 1 << 20, meterRegistry);

        DecodedBuffer first = cache.fetch(new CacheKey(FRAME_1, "beauty"));
        DecodedBuffer second = cache.fetch(new CacheKey(FRAME_1, "beauty"));

        assertThat(second).isSameAs(first);
        assertThat(reader.calls(FRAME_1, "beauty")).isEqualTo(1);
        assertThat(meterRegistry.counter("render_kit.cache.hits").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("render_kit.cache.misses").count()).isEqualTo(1.0);
    }

    @Test
    void layersOfOneFileAreCachedSeparately() throws Exception {
        CountingReader reader = new CountingReader();
        DecodeCache cache = new DecodeCache(reader, 8, 1 << 20, meterRegistry);

        cache.fetch(new CacheKey(FRAME_1, "beauty"));
        cache.fetch(new CacheKey(FRAME_1, "diffuse"));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(reader.calls(FRAME_1, "beauty")).isEqualTo(1);
        assertThat(reader.calls(FRAME_1, "diffuse")).isEqualTo(1);
    }

    @Test
    void concurrentFetchesShareOneDecode() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountingReader reader = new CountingReader(release, null);
        DecodeCache cache = new DecodeCache(reader, 8, 1 << 20, meterRegistry);
        CacheKey key = new CacheKey(FRAME_1, "");

        Future<DecodedBuffer> first = executor.submit(() -> cache.fetch(key));
        Future<DecodedBuffer> second = executor.submit(() -> cache.fetch(key));
        awaitCount("render_kit.cache.hits", 1.0);
        release.countDown();

        assertThat(first.get(5, TimeUnit.SECONDS)).isSameAs(second.get(5, TimeUnit.SECONDS));
        assertThat(reader.calls(FRAME_1, "")).isEqualTo(1);
    }

    @Test
    void concurrentWaitersReceiveTheSameFailure() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountingReader reader = new CountingReader(release, FRAME_1);
        DecodeCache cache = new DecodeCache(reader, 8, 1 << 20, meterRegistry);
        CacheKey key = new CacheKey(FRAME_1, "");

        Future<DecodedBuffer> first = executor.submit(() -> cache.fetch(key));
        Future<DecodedBuffer> second = executor.submit(() -> cache.fetch(key));
        awaitCount("render_kit.cache.hits", 1.0);
        release.countDown();

        Throwable firstError = failureOf(first);
        Throwable secondError = failureOf(second);
        assertThat(firstError).isInstanceOf(DecodeException.class);
        assertThat(secondError).isSameAs(firstError);
        assertThat(cache.size()).isZero();
        assertThat(meterRegistry.counter("render_kit.cache.failures").count()).isEqualTo(1.0);
    }

    @Test
    void failedDecodeIsRetriedOnNextFetch() throws Exception {
        CountingReader reader = new CountingReader(null, FRAME_1);
        DecodeCache cache = new DecodeCache(reader, 8, 1 << 20, meterRegistry);
        CacheKey key = new CacheKey(FRAME_1, "");

        assertThatThrownBy(() -> cache.fetch(key)).isInstanceOf(DecodeException.class);
        reader.stopFailing();

        assertThat(cache.fetch(key).width()).isEqualTo(2);
        assertThat(reader.calls(FRAME_1, "")).isEqualTo(2);
    }

    @Test
    void unexpectedReaderErrorsAreReportedAsDecodeFailures() {
        ImageReader broken = new CountingReader() {
            @Override
            public DecodedBuffer decode(Path path, String layerName) {
                throw new IllegalStateException("codec crashed");
            }
        };
        DecodeCache cache = new DecodeCache(broken, 8, 1 << 20, meterRegistry);

        assertThatThrownBy(() -> cache.fetch(new CacheKey(FRAME_2, "")))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("codec crashed")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void leastRecentlyUsedEntryIsEvictedWhenEntryLimitIsReached() throws Exception {
        CountingReader reader = new CountingReader();
        DecodeCache cache = new DecodeCache(reader, 2, 1 << 20, meterRegistry);

        cache.fetch(new CacheKey(FRAME_1, ""));
        cache.fetch(new CacheKey(FRAME_2, ""));
        cache.fetch(new CacheKey(FRAME_1, ""));
        cache.fetch(new CacheKey(FRAME_3, ""));
        cache.fetch(new CacheKey(FRAME_1, ""));
        cache.fetch(new CacheKey(FRAME_2, ""));

        assertThat(cache.size()).isEqualTo(2);
        assertThat(reader.calls(FRAME_1, "")).isEqualTo(1);
        assertThat(reader.calls(FRAME_2, "")).isEqualTo(2);
        assertThat(meterRegistry.counter("render_kit.cache.evictions").count()).isEqualTo(2.0);
    }

    @Test
    void byteLimitBoundsResidentBuffers() throws Exception {
        CountingReader reader = new CountingReader();
        long oneBuffer = CountingReader.buffer().byteSize();
        DecodeCache cache = new DecodeCache(reader, 8, oneBuffer, meterRegistry);

        cache.fetch(new CacheKey(FRAME_1, ""));
        cache.fetch(new CacheKey(FRAME_2, ""));

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.residentBytes()).isEqualTo(oneBuffer);
    }

    @Test
    void clearDropsEveryEntry() throws Exception {
        DecodeCache cache = new DecodeCache(new CountingReader(), 8, 1 << 20, meterRegistry);
        cache.fetch(new CacheKey(FRAME_1, ""));
        cache.fetch(new CacheKey(FRAME_2, ""));

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.residentBytes()).isZero();
    }

    @Test
    void constructorRejectsEmptyLimits() {
        assertThatThrownBy(() -> new DecodeCache(new CountingReader(), 0, 10, meterRegistry))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DecodeCache(new CountingReader(), 1, 0, meterRegistry))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void awaitCount(String counter, double expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (meterRegistry.counter(counter).count() < expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Timed out waiting for " + counter + " to reach " + expected);
            }
            Thread.sleep(5);
        }
    }

    private Throwable failureOf(Future<DecodedBuffer> future) throws Exception {
        try {
            future.get(5, TimeUnit.SECONDS);
            throw new AssertionError("Expected the fetch to fail");
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    private static class CountingReader implements ImageReader {

        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        private final CountDownLatch release;
        private volatile Path failingPath;

        CountingReader() {
            this(null, null);
        }

        CountingReader(CountDownLatch release, Path failingPath) {
            this.release = release;
            this.failingPath = failingPath == null ? null : failingPath.toAbsolutePath().normalize();
        }

        static DecodedBuffer buffer() {
            return DecodedBuffer.rgb(2, 2, new float[12]);
        }

        @Override
        public DecodedBuffer decode(Path path, String layerName) {
            calls.computeIfAbsent(path + "#" + layerName, ignored -> new AtomicInteger()).incrementAndGet();
            if (release != null) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (path.equals(failingPath)) {
                throw new DecodeException(path, layerName, "corrupt header", null);
            }
            return buffer();
        }

        @Override
        public ImageMetadata readMetadata(Path path) {
            return ImageMetadata.empty();
        }

        @Override
        public List<String> listLayers(Path path) {
            return List.of();
        }

        int calls(Path path, String layerName) {
            AtomicInteger count = calls.get(path.toAbsolutePath().normalize() + "#" + layerName);
            return count == null ? 0 : count.get();
        }

        void stopFailing() {
            failingPath = null;
        }
    }
}
