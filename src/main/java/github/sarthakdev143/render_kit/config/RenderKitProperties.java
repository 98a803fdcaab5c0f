package github.sarthakdev143.render_kit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

@ConfigurationProperties(prefix = "render-kit")
public record RenderKitProperties(
        @DefaultValue Pipeline pipeline,
        @DefaultValue Encoder encoder,
        @DefaultValue Preflight preflight) {

    public record Pipeline(
            @DefaultValue("2") int prefetchWorkers,
            @DefaultValue("3") int prefetchWindow,
            @DefaultValue("32") int cacheMaxEntries,
            @DefaultValue("1GB") DataSize cacheMaxBytes,
            // unset waits for each frame without limit
            Duration decodeTimeout) {

        public Pipeline {
            if (prefetchWorkers <= 0) {
                throw new IllegalArgumentException("render-kit.pipeline.prefetch-workers must be greater than 0.");
            }
            if (prefetchWindow <= 0) {
                throw new IllegalArgumentException("render-kit.pipeline.prefetch-window must be greater than 0.");
            }
            if (cacheMaxEntries <= 0) {
                throw new IllegalArgumentException("render-kit.pipeline.cache-max-entries must be greater than 0.");
            }
            cacheMaxBytes = cacheMaxBytes == null ? DataSize.ofGigabytes(1) : cacheMaxBytes;
        }
    }

    public record Encoder(
            String ffmpegPath,
            @DefaultValue("10m") Duration finishTimeout,
            @DefaultValue("error") String logLevel) {

        public Encoder {
            finishTimeout = finishTimeout == null ? Duration.ofMinutes(10) : finishTimeout;
            logLevel = logLevel == null || logLevel.isBlank() ? "error" : logLevel.trim();
        }
    }

    public record Preflight(@DefaultValue("true") boolean enabled) {
    }
}
