package github.sarthakdev143.render_kit.model;

public record FrameIndexRange(int start, int end) {

    public FrameIndexRange {
        if (start > end) {
            throw new IllegalArgumentException("Frame range start " + start + " is after end " + end + ".");
        }
    }

    public boolean contains(int frame) {
        return frame >= start && frame <= end;
    }

    public int length() {
        return end - start + 1;
    }
}
