package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.model.LayerBuffer;

import java.util.List;

public record LoadedFrame(int frameIndex, List<LayerBuffer> layers) {

    public LoadedFrame {
        layers = List.copyOf(layers);
    }
}
