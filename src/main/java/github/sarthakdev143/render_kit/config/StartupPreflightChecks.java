package github.sarthakdev143.render_kit.config;

import github.sarthakdev143.render_kit.integration.video.FfmpegBinaryLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "render-kit.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final int FFMPEG_CHECK_TIMEOUT_SECONDS = 10;

    private final FfmpegBinaryLocator binaryLocator;

    public StartupPreflightChecks(FfmpegBinaryLocator binaryLocator) {
        this.binaryLocator = binaryLocator;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkFfmpegConfiguration();
    }

    private void checkFfmpegConfiguration() {
        String binary = binaryLocator.resolveFfmpegBinary();
        if (binaryLocator.isExplicit()) {
            Path ffmpegPath = Path.of(binary);
            if (!Files.isRegularFile(ffmpegPath)) {
                throw new IllegalStateException(
                        "FFmpeg binary not found at " + ffmpegPath.toAbsolutePath()
                                + ". Set render-kit.encoder.ffmpeg-path or FFMPEG_PATH to a valid ffmpeg executable.");
            }
            logger.info("Using FFmpeg binary at {}", ffmpegPath.toAbsolutePath());
            return;
        }

        try {
            Process process = new ProcessBuilder(binary, "-version")
                    .redirectErrorStream(true)
                    .start();
            boolean finished = process.waitFor(FFMPEG_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
            }
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        "FFmpeg is not available on PATH. Install FFmpeg or set FFMPEG_PATH.");
            }
            logger.info("FFmpeg found on PATH");
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    "FFmpeg is not available on PATH. Install FFmpeg or set FFMPEG_PATH.",
                    e);
        }
    }
}
