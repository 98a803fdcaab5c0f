package github.sarthakdev143.render_kit.integration.video;

import github.sarthakdev143.render_kit.config.RenderKitProperties;
import org.springframework.stereotype.Component;

@Component
public class FfmpegBinaryLocator {

    static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";

    private final RenderKitProperties properties;

    public FfmpegBinaryLocator(RenderKitProperties properties) {
        this.properties = properties;
    }

    public String resolveFfmpegBinary() {
        String configured = properties.encoder().ffmpegPath();
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }

        String environmentPath = System.getenv(FFMPEG_PATH_ENV);
        if (environmentPath != null && !environmentPath.isBlank()) {
            return environmentPath;
        }
        return DEFAULT_FFMPEG_BINARY;
    }

    /**
     * True when the binary was chosen explicitly, by property or environment, rather than looked up on PATH.
     */
    public boolean isExplicit() {
        return !DEFAULT_FFMPEG_BINARY.equals(resolveFfmpegBinary());
    }
}
