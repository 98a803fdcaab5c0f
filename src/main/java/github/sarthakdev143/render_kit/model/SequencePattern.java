package github.sarthakdev143.render_kit.model;

import java.nio.file.Path;

public record SequencePattern(
        String raw,
        NumberingScheme scheme,
        int width,
        Path directory,
        String prefix,
        String suffix) {

    public SequencePattern {
        if (width < 0) {
            throw new IllegalArgumentException("Padding width must not be negative.");
        }
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }

    public String fileNameFor(int frame) {
        return prefix + formatFrame(frame) + suffix;
    }

    public Path pathFor(int frame) {
        return directory.resolve(fileNameFor(frame));
    }

    public String formatFrame(int frame) {
        String digits = Integer.toString(frame);
        if (digits.length() >= width) {
            return digits;
        }
        return "0".repeat(width - digits.length()) + digits;
    }
}
