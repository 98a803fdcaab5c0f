package github.sarthakdev143.render_kit.factory;

import github.sarthakdev143.render_kit.integration.image.ImageReader;
import github.sarthakdev143.render_kit.pipeline.DecodeCache;

public interface DecodeCacheFactory {

    DecodeCache create(ImageReader imageReader);
}
