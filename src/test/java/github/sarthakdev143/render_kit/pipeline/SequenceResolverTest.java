package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.exception.EmptySequenceException;
import github.sarthakdev143.render_kit.exception.PatternUnrecognizedException;
import github.sarthakdev143.render_kit.model.FrameSequence;
import github.sarthakdev143.render_kit.model.NumberingScheme;
import github.sarthakdev143.render_kit.model.SequencePattern;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SequenceResolverTest {

    private final SequenceResolver resolver = new SequenceResolver();

    @TempDir
    Path tempDir;

    @Test
    void parseDetectsPrintfPattern() {
        SequencePattern pattern = resolver.parse(tempDir.resolve("shot.%04d.exr").toString());

        assertThat(pattern.scheme()).isEqualTo(NumberingScheme.PRINTF);
        assertThat(pattern.width()).isEqualTo(4);
        assertThat(pattern.prefix()).isEqualTo("shot.");
        assertThat(pattern.suffix()).isEqualTo(".exr");
        assertThat(pattern.fileNameFor(7)).isEqualTo("shot.0007.exr");
    }

    @Test
    void parseDetectsHoudiniPattern() {
        SequencePattern pattern = resolver.parse(tempDir.resolve("render.$F3.png").toString());

        assertThat(pattern.scheme()).isEqualTo(NumberingScheme.HOUDINI);
        assertThat(pattern.width()).isEqualTo(3);
        assertThat(pattern.fileNameFor(12)).isEqualTo("render.012.png");
    }

    @Test
    void parseTreatsUnpaddedTokensAsWidthZero() {
        assertThat(resolver.parse("frames/f_%d.png").width()).isZero();
        assertThat(resolver.parse("frames/f_$F.png").width()).isZero();
        assertThat(resolver.parse("frames/f_%d.png").fileNameFor(123)).isEqualTo("f_123.png");
    }

    @Test
    void parseDetectsHashPattern() {
        SequencePattern pattern = resolver.parse(tempDir.resolve("beauty.####.tif").toString());

        assertThat(pattern.scheme()).isEqualTo(NumberingScheme.HASH);
        assertThat(pattern.width()).isEqualTo(4);
    }

    @Test
    void parseUsesLastDigitRunForPlainNumericNames() {
        SequencePattern pattern = resolver.parse(tempDir.resolve("v2_shot_0101.png").toString());

        assertThat(pattern.scheme()).isEqualTo(NumberingScheme.PLAIN_NUMERIC);
        assertThat(pattern.width()).isEqualTo(4);
        assertThat(pattern.prefix()).isEqualTo("v2_shot_");
        assertThat(pattern.suffix()).isEqualTo(".png");
    }

    @Test
    void parseIgnoresDigitsInTheExtension() {
        SequencePattern pattern = resolver.parse(tempDir.resolve("plate.0001.jp2").toString());

        assertThat(pattern.scheme()).isEqualTo(NumberingScheme.PLAIN_NUMERIC);
        assertThat(pattern.width()).isEqualTo(4);
        assertThat(pattern.prefix()).isEqualTo("plate.");
        assertThat(pattern.suffix()).isEqualTo(".jp2");
        assertThatThrownBy(() -> resolver.parse("frames/clip.mp4"))
                .isInstanceOf(PatternUnrecognizedException.class);
    }

    @Test
    void parseIgnoresDigitsInDirectoryNames() {
        SequencePattern pattern = resolver.parse(tempDir.resolve("take01").resolve("shot.%03d.png").toString());

        assertThat(pattern.scheme()).isEqualTo(NumberingScheme.PRINTF);
        assertThat(pattern.directory()).isEqualTo(tempDir.resolve("take01").toAbsolutePath());
    }

    @Test
    void parseRejectsPatternWithoutFrameToken() {
        assertThatThrownBy(() -> resolver.parse("frames/still.png"))
                .isInstanceOf(PatternUnrecognizedException.class)
                .hasMessageContaining("frames/still.png");
    }

    @Test
    void resolveReturnsSortedFramesAndSkipsGaps() throws IOException {
        touch("shot.0003.png", "shot.0001.png", "shot.0002.png", "shot.0005.png", "other.0004.png", "shot.0004.jpg");

        FrameSequence sequence = resolver.resolve(tempDir.resolve("shot.%04d.png").toString(), null, null);

        assertThat(sequence.frames()).containsExactly(1, 2, 3, 5);
        assertThat(sequence.gapCount()).isEqualTo(1);
        assertThat(sequence.pathFor(5)).isEqualTo(tempDir.resolve("shot.0005.png").toAbsolutePath());
    }

    @ParameterizedTest
    @ValueSource(strings = {"r.%04d.exr", "r.$F4.exr", "r.####.exr", "r.0001.exr"})
    void everyNumberingSchemeResolvesTheSameFrames(String pattern) throws IOException {
        for (int frame = 1; frame <= 10; frame++) {
            touch(String.format("r.%04d.exr", frame));
        }

        FrameSequence sequence = resolver.resolve(tempDir.resolve(pattern).toString(), null, null);

        assertThat(sequence.range().start()).isEqualTo(1);
        assertThat(sequence.range().end()).isEqualTo(10);
        assertThat(sequence.size()).isEqualTo(10);
        assertThat(sequence.gapCount()).isZero();
    }

    @Test
    void resolveFromFileNameWithDigitInExtension() throws IOException {
        touch("plate.0001.jp2", "plate.0002.jp2", "plate.0003.jp2");

        FrameSequence sequence = resolver.resolve(tempDir.resolve("plate.0001.jp2").toString(), null, null);

        assertThat(sequence.frames()).containsExactly(1, 2, 3);
    }

    @Test
    void resolveRejectsFilesWithWrongPadding() throws IOException {
        touch("shot.0001.png", "shot.002.png", "shot.00003.png", "shot.12345.png");

        FrameSequence sequence = resolver.resolve(tempDir.resolve("shot.####.png").toString(), null, null);

        assertThat(sequence.frames()).containsExactly(1, 12345);
    }

    @Test
    void resolveAppliesFrameRange() throws IOException {
        touch("f.1.png", "f.2.png", "f.3.png", "f.4.png", "f.10.png");

        FrameSequence sequence = resolver.resolve(tempDir.resolve("f.%d.png").toString(), 2, 4);

        assertThat(sequence.frames()).containsExactly(2, 3, 4);
    }

    @Test
    void resolveFromConcreteFileNameFindsSiblings() throws IOException {
        touch("plate_0100.png", "plate_0101.png", "plate_0102.png");

        FrameSequence sequence = resolver.resolve(tempDir.resolve("plate_0100.png").toString(), null, null);

        assertThat(sequence.frames()).containsExactly(100, 101, 102);
    }

    @Test
    void resolveFailsWhenNoFrameMatches() throws IOException {
        touch("shot.0001.png");

        assertThatThrownBy(() -> resolver.resolve(tempDir.resolve("shot.%04d.png").toString(), 10, 20))
                .isInstanceOf(EmptySequenceException.class)
                .hasMessageContaining("in range [10, 20]");
    }

    @Test
    void resolveFailsWhenDirectoryIsMissing() {
        assertThatThrownBy(() -> resolver.resolve(tempDir.resolve("missing/shot.%04d.png").toString(), null, null))
                .isInstanceOf(EmptySequenceException.class)
                .hasMessageContaining("does not exist");
    }

    private void touch(String... names) throws IOException {
        for (String name : names) {
            Files.writeString(tempDir.resolve(name), "x");
        }
    }
}
