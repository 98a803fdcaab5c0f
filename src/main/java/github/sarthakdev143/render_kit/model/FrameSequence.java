package github.sarthakdev143.render_kit.model;

import java.nio.file.Path;
import java.util.List;

public record FrameSequence(SequencePattern pattern, List<Integer> frames) {

    public FrameSequence {
        frames = frames == null ? List.of() : List.copyOf(frames);
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("A frame sequence must contain at least one frame.");
        }
    }

    public FrameIndexRange range() {
        return new FrameIndexRange(frames.get(0), frames.get(frames.size() - 1));
    }

    public int size() {
        return frames.size();
    }

    public int gapCount() {
        return range().length() - frames.size();
    }

    public Path pathFor(int frame) {
        return pattern.pathFor(frame);
    }
}
