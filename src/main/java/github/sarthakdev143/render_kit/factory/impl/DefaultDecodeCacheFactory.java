package github.sarthakdev143.render_kit.factory.impl;

import github.sarthakdev143.render_kit.config.RenderKitProperties;
import github.sarthakdev143.render_kit.factory.DecodeCacheFactory;
import github.sarthakdev143.render_kit.integration.image.ImageReader;
import github.sarthakdev143.render_kit.pipeline.DecodeCache;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class DefaultDecodeCacheFactory implements DecodeCacheFactory {

    private final RenderKitProperties properties;
    private final MeterRegistry meterRegistry;

    public DefaultDecodeCacheFactory(RenderKitProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public DecodeCache create(ImageReader imageReader) {
        RenderKitProperties.Pipeline pipeline = properties.pipeline();
        return new DecodeCache(
                imageReader,
                pipeline.cacheMaxEntries(),
                pipeline.cacheMaxBytes().toBytes(),
                meterRegistry);
    }
}
