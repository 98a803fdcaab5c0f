package github.sarthakdev143.render_kit.model;

import java.util.Objects;

public record LayerBuffer(String layerName, DecodedBuffer buffer) {

    public LayerBuffer {
        layerName = layerName == null ? LayerSelector.DEFAULT_LAYER : layerName;
        Objects.requireNonNull(buffer, "buffer");
    }

    public LayerBuffer withBuffer(DecodedBuffer replacement) {
        return new LayerBuffer(layerName, replacement);
    }
}
