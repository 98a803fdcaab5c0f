package github.sarthakdev143.render_kit.config;

import github.sarthakdev143.render_kit.integration.video.FfmpegBinaryLocator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StartupPreflightChecksTest {

    @Mock
    private FfmpegBinaryLocator binaryLocator;

    @TempDir
    Path tempDir;

    @Test
    void failsWhenExplicitBinaryIsMissing() {
        Path missing = tempDir.resolve("bin/ffmpeg");
        when(binaryLocator.resolveFfmpegBinary()).thenReturn(missing.toString());
        when(binaryLocator.isExplicit()).thenReturn(true);

        StartupPreflightChecks checks = new StartupPreflightChecks(binaryLocator);

        assertThatThrownBy(() -> checks.run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("FFmpeg binary not found at");
    }

    @Test
    void acceptsExplicitBinaryThatExists() throws Exception {
        Path binary = Files.createFile(tempDir.resolve("ffmpeg"));
        when(binaryLocator.resolveFfmpegBinary()).thenReturn(binary.toString());
        when(binaryLocator.isExplicit()).thenReturn(true);

        StartupPreflightChecks checks = new StartupPreflightChecks(binaryLocator);

        assertThatCode(() -> checks.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
    }

    @Test
    void failsWhenPathLookupCannotStartBinary() {
        when(binaryLocator.resolveFfmpegBinary()).thenReturn(tempDir.resolve("no-such-ffmpeg").toString());
        when(binaryLocator.isExplicit()).thenReturn(false);

        StartupPreflightChecks checks = new StartupPreflightChecks(binaryLocator);

        assertThatThrownBy(() -> checks.run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("FFmpeg is not available on PATH. Install FFmpeg or set FFMPEG_PATH.");
    }
}
