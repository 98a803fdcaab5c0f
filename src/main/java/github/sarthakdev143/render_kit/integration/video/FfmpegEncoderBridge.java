package github.sarthakdev143.render_kit.integration.video;

import github.sarthakdev143.render_kit.config.RenderKitProperties;
import github.sarthakdev143.render_kit.exception.EncoderUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Encodes by piping {@code rgb24} frames into an ffmpeg subprocess over stdin.
 */
@Component
public class FfmpegEncoderBridge implements EncoderBridge {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegEncoderBridge.class);
    private static final int ENCODER_LIST_TIMEOUT_SECONDS = 10;

    static final Map<String, List<String>> ENCODER_FALLBACKS = Map.of(
            CodecQualityTable.LIBX264, List.of(CodecQualityTable.LIBX265, CodecQualityTable.LIBAOM_AV1, CodecQualityTable.MPEG4),
            CodecQualityTable.LIBX265, List.of(CodecQualityTable.LIBAOM_AV1, CodecQualityTable.MPEG4),
            CodecQualityTable.LIBAOM_AV1, List.of(CodecQualityTable.LIBX265, CodecQualityTable.MPEG4),
            CodecQualityTable.MPEG4, List.of(CodecQualityTable.LIBX265, CodecQualityTable.LIBAOM_AV1));

    private final FfmpegBinaryLocator binaryLocator;
    private final RenderKitProperties properties;
    private volatile Set<String> availableEncoders;

    public FfmpegEncoderBridge(FfmpegBinaryLocator binaryLocator, RenderKitProperties properties) {
        this.binaryLocator = binaryLocator;
        this.properties = properties;
    }

    @Override
    public String probe(String codec) {
        String requested = CodecQualityTable.normalizeCodec(codec);
        String selected = selectAvailableEncoder(requested, availableEncoders());
        if (!selected.equals(requested)) {
            logger.warn("Encoder {} is not available in this ffmpeg build; falling back to {}", requested, selected);
        }
        return selected;
    }

    @Override
    public EncoderSession open(EncoderHeader header, Path outputPath) {
        List<String> command = buildCommand(header, outputPath);
        logger.info("Starting FFmpeg encoder: {}", String.join(" ", command));
        try {
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .start();
            return new FfmpegEncoderSession(process, header, outputPath, properties.encoder().finishTimeout());
        } catch (IOException e) {
            throw new EncoderUnavailableException(
                    "Failed to start FFmpeg at '" + binaryLocator.resolveFfmpegBinary()
                            + "'. Install FFmpeg or set " + FfmpegBinaryLocator.FFMPEG_PATH_ENV + ".",
                    e);
        }
    }

    List<String> buildCommand(EncoderHeader header, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(binaryLocator.resolveFfmpegBinary());
        command.add("-hide_banner");
        command.add("-loglevel");
        command.add(properties.encoder().logLevel());
        command.add("-y");
        command.add("-f");
        command.add("rawvideo");
        command.add("-pix_fmt");
        command.add(header.pixelFormat());
        command.add("-s");
        command.add(header.width() + "x" + header.height());
        command.add("-r");
        command.add(formatFrameRate(header.frameRate()));
        command.add("-i");
        command.add("-");
        command.add("-an");
        // yuv420p needs even dimensions
        command.add("-vf");
        command.add("pad=ceil(iw/2)*2:ceil(ih/2)*2");
        command.add("-c:v");
        command.add(header.codec());

        NativeQuality quality = header.quality();
        if (!quality.isNone()) {
            command.add(quality.flag());
            command.add(quality.value());
            command.addAll(quality.extraArgs());
        } else if (header.bitrateKbps() != null) {
            command.add("-b:v");
            command.add(header.bitrateKbps() + "k");
        }

        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-movflags");
        command.add("+faststart");
        command.add("-color_primaries");
        command.add("bt709");
        command.add("-color_trc");
        command.add("bt709");
        command.add("-colorspace");
        command.add("bt709");
        command.add(outputPath.toString());
        return command;
    }

    String selectAvailableEncoder(String requested, Set<String> available) {
        if (available.contains(requested)) {
            return requested;
        }
        for (String candidate : ENCODER_FALLBACKS.getOrDefault(requested, List.of())) {
            if (available.contains(candidate)) {
                return candidate;
            }
        }
        throw new EncoderUnavailableException(
                "Encoder '" + requested + "' is not available in this FFmpeg build and no fallback encoder was found.");
    }

    /**
     * Video encoder names from {@code ffmpeg -encoders} output. Capability lines start with a flag column whose
     * first letter is the media type.
     */
    static Set<String> parseEncoderList(String output) {
        Set<String> encoders = new LinkedHashSet<>();
        for (String line : output.split("\\R")) {
            String[] tokens = line.trim().split("\\s+");
            if (tokens.length < 2 || tokens[0].length() != 6 || !tokens[0].startsWith("V") || "=".equals(tokens[1])) {
                continue;
            }
            encoders.add(tokens[1]);
        }
        return encoders;
    }

    static String formatFrameRate(double fps) {
        if (Math.abs(fps - 29.97) < 0.01) {
            return "30000/1001";
        }
        if (Math.abs(fps - 23.976) < 0.01) {
            return "24000/1001";
        }
        if (Math.abs(fps - 59.94) < 0.01) {
            return "60000/1001";
        }
        long rounded = Math.round(fps);
        if (Math.abs(fps - rounded) < 0.01) {
            return Long.toString(rounded);
        }
        return String.format(Locale.ROOT, "%.3f", fps);
    }

    private Set<String> availableEncoders() {
        Set<String> cached = availableEncoders;
        if (cached != null) {
            return cached;
        }

        String ffmpeg = binaryLocator.resolveFfmpegBinary();
        try {
            Process process = new ProcessBuilder(ffmpeg, "-hide_banner", "-encoders")
                    .redirectErrorStream(true)
                    .start();

            StringBuilder output = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append(System.lineSeparator());
                }
            }

            boolean finished = process.waitFor(ENCODER_LIST_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new EncoderUnavailableException("FFmpeg at '" + ffmpeg + "' timed out listing encoders.");
            }
            if (process.exitValue() != 0) {
                throw new EncoderUnavailableException(
                        "FFmpeg at '" + ffmpeg + "' failed to list encoders with exit code " + process.exitValue() + ".");
            }

            cached = Set.copyOf(parseEncoderList(output.toString()));
            logger.debug("FFmpeg provides {} video encoders", cached.size());
            availableEncoders = cached;
            return cached;
        } catch (IOException e) {
            throw new EncoderUnavailableException(
                    "FFmpeg is not available at '" + ffmpeg + "'. Install FFmpeg or set "
                            + FfmpegBinaryLocator.FFMPEG_PATH_ENV + ".",
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EncoderUnavailableException("Interrupted while probing FFmpeg encoders.", e);
        }
    }
}
