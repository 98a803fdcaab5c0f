package github.sarthakdev143.render_kit.model;

import java.nio.file.Path;
import java.util.Objects;

public record CacheKey(Path path, String layer) {

    public CacheKey {
        Objects.requireNonNull(path, "path");
        path = path.toAbsolutePath().normalize();
        layer = layer == null ? LayerSelector.DEFAULT_LAYER : layer;
    }
}
