package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.model.LayerBuffer;

import java.util.List;

/**
 * Loads every selected layer of one frame. Runs on a prefetch worker.
 */
@FunctionalInterface
public interface FrameLoader {

    List<LayerBuffer> load(int frameIndex) throws InterruptedException;
}
