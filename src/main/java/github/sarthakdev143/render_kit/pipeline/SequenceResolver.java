package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.exception.EmptySequenceException;
import github.sarthakdev143.render_kit.exception.PatternUnrecognizedException;
import github.sarthakdev143.render_kit.model.FrameSequence;
import github.sarthakdev143.render_kit.model.NumberingScheme;
import github.sarthakdev143.render_kit.model.SequencePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Turns a frame pattern such as {@code shot.%04d.exr}, {@code shot.$F4.exr}, {@code shot.####.exr} or
 * {@code shot.0001.exr} into the frames present on disk.
 */
@Component
public class SequenceResolver {

    private static final Logger logger = LoggerFactory.getLogger(SequenceResolver.class);
    private static final int MAX_FRAME_DIGITS = 9;

    public FrameSequence resolve(String pattern, Integer startFrame, Integer endFrame) {
        SequencePattern parsed = parse(pattern);

        Path directory = parsed.directory();
        if (!Files.isDirectory(directory)) {
            throw new EmptySequenceException("Sequence directory does not exist: " + directory);
        }

        Pattern entryPattern = Pattern.compile(
                Pattern.quote(parsed.prefix()) + "(\\d+)" + Pattern.quote(parsed.suffix()));
        List<Integer> frames = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            entries.forEach(entry -> {
                Integer frame = matchFrame(parsed, entryPattern, entry.getFileName().toString());
                if (frame != null && inRange(frame, startFrame, endFrame) && Files.isRegularFile(entry)) {
                    frames.add(frame);
                }
            });
        } catch (IOException e) {
            throw new EmptySequenceException("Failed to list sequence directory " + directory, e);
        }

        if (frames.isEmpty()) {
            throw new EmptySequenceException(
                    "No frames found for pattern " + pattern + describeRange(startFrame, endFrame) + ".");
        }

        frames.sort(Integer::compareTo);
        FrameSequence sequence = new FrameSequence(parsed, frames);
        if (sequence.gapCount() > 0) {
            logger.warn(
                    "Sequence {} has {} missing frame(s) between {} and {}",
                    pattern,
                    sequence.gapCount(),
                    sequence.range().start(),
                    sequence.range().end());
        }
        logger.info(
                "Resolved {} ({}) to {} frame(s) in [{}, {}]",
                pattern,
                parsed.scheme(),
                sequence.size(),
                sequence.range().start(),
                sequence.range().end());
        return sequence;
    }

    /**
     * Detects the numbering scheme from the file name alone. Performs no I/O.
     */
    public SequencePattern parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new PatternUnrecognizedException(String.valueOf(pattern));
        }

        Path patternPath;
        try {
            patternPath = Path.of(pattern.trim());
        } catch (InvalidPathException e) {
            throw new PatternUnrecognizedException(pattern);
        }
        Path fileName = patternPath.getFileName();
        if (fileName == null) {
            throw new PatternUnrecognizedException(pattern);
        }
        Path parent = patternPath.toAbsolutePath().getParent();

        String name = fileName.toString();
        int extensionStart = name.lastIndexOf('.');
        int stemEnd = extensionStart > 0 ? extensionStart : name.length();
        for (NumberingScheme scheme : NumberingScheme.values()) {
            Matcher matcher = scheme.token().matcher(name);
            if (scheme == NumberingScheme.PLAIN_NUMERIC) {
                // digits in the extension (jp2, mp4) never count as the frame number
                matcher.region(0, stemEnd);
            }
            if (!matcher.find()) {
                continue;
            }
            return new SequencePattern(
                    pattern,
                    scheme,
                    paddingWidth(scheme, matcher),
                    parent,
                    name.substring(0, matcher.start()),
                    name.substring(matcher.end()));
        }
        throw new PatternUnrecognizedException(pattern);
    }

    private int paddingWidth(NumberingScheme scheme, Matcher matcher) {
        return switch (scheme) {
            case PRINTF, HOUDINI -> matcher.group(1).isEmpty() ? 0 : Integer.parseInt(matcher.group(1));
            case HASH -> matcher.group().length();
            case PLAIN_NUMERIC -> matcher.group(1).length();
        };
    }

    private Integer matchFrame(SequencePattern parsed, Pattern entryPattern, String fileName) {
        Matcher matcher = entryPattern.matcher(fileName);
        if (!matcher.matches()) {
            return null;
        }
        String digits = matcher.group(1);
        if (digits.length() > MAX_FRAME_DIGITS) {
            return null;
        }
        int frame = Integer.parseInt(digits);
        // 0007 and 12345 fit a width of 4, 007 does not
        return parsed.formatFrame(frame).equals(digits) ? frame : null;
    }

    private boolean inRange(int frame, Integer startFrame, Integer endFrame) {
        return (startFrame == null || frame >= startFrame) && (endFrame == null || frame <= endFrame);
    }

    private String describeRange(Integer startFrame, Integer endFrame) {
        if (startFrame == null && endFrame == null) {
            return "";
        }
        return " in range [" + (startFrame == null ? "*" : startFrame) + ", " + (endFrame == null ? "*" : endFrame) + "]";
    }
}
