package github.sarthakdev143.render_kit.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record LayerSelector(List<String> layers) {

    public static final String DEFAULT_LAYER = "";

    public LayerSelector {
        Set<String> normalized = new LinkedHashSet<>();
        if (layers != null) {
            for (String layer : layers) {
                if (layer != null && !layer.isBlank()) {
                    normalized.add(layer.trim());
                }
            }
        }
        layers = List.copyOf(normalized);
    }

    public static LayerSelector defaultLayer() {
        return new LayerSelector(List.of());
    }

    public static LayerSelector of(String... layers) {
        return new LayerSelector(List.of(layers));
    }

    public boolean isDefault() {
        return layers.isEmpty();
    }

    public boolean impliesContactSheet() {
        return layers.size() > 1;
    }

    /**
     * Layer names as cache keys use them; the default selector yields a single empty name.
     */
    public List<String> effectiveLayers() {
        return layers.isEmpty() ? List.of(DEFAULT_LAYER) : layers;
    }
}
