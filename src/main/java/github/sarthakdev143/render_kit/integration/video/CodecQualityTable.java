package github.sarthakdev143.render_kit.integration.video;

import github.sarthakdev143.render_kit.model.ConversionConfig;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps codec aliases to ffmpeg encoder names and the 0-10 quality scale (10 is best) to each encoder's native
 * control. The arithmetic is integer and the table is part of the public interface.
 */
public final class CodecQualityTable {

    public static final String LIBX264 = "libx264";
    public static final String LIBX265 = "libx265";
    public static final String LIBAOM_AV1 = "libaom-av1";
    public static final String MPEG4 = "mpeg4";

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("avc1", LIBX264),
            Map.entry("h264", LIBX264),
            Map.entry("x264", LIBX264),
            Map.entry("hevc", LIBX265),
            Map.entry("h265", LIBX265),
            Map.entry("x265", LIBX265),
            Map.entry("av1", LIBAOM_AV1),
            Map.entry("mp4v", MPEG4),
            Map.entry("xvid", MPEG4));

    private static final List<QualityTableEntry> ENTRIES = List.of(
            new QualityTableEntry(LIBX264, List.of("avc1", "h264", "x264"), "-crf", "18 + (10 - q) * 17 / 10", List.of()),
            new QualityTableEntry(LIBX265, List.of("hevc", "h265", "x265"), "-crf", "18 + (10 - q) * 17 / 10", List.of()),
            new QualityTableEntry(LIBAOM_AV1, List.of("av1"), "-crf", "20 + (10 - q) * 3", List.of("-cpu-used", "6", "-b:v", "0")),
            new QualityTableEntry(MPEG4, List.of("mp4v", "xvid"), "-q:v", "2 + (10 - q) * 29 / 10", List.of()),
            new QualityTableEntry("*", List.of(), "-b:v", "configured bitrate in kbps, if any", List.of()));

    private CodecQualityTable() {
    }

    /**
     * Resolves aliases case-insensitively; unknown names pass through trimmed.
     */
    public static String normalizeCodec(String codec) {
        if (codec == null || codec.isBlank()) {
            return ConversionConfig.DEFAULT_CODEC;
        }
        String trimmed = codec.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        String alias = ALIASES.get(lower);
        if (alias != null) {
            return alias;
        }
        return switch (lower) {
            case LIBX264, LIBX265, LIBAOM_AV1, MPEG4 -> lower;
            default -> trimmed;
        };
    }

    public static NativeQuality nativeQuality(String encoder, int quality) {
        if (quality < ConversionConfig.MIN_QUALITY || quality > ConversionConfig.MAX_QUALITY) {
            throw new IllegalArgumentException("Quality must be between 0 and 10, got " + quality + ".");
        }
        int loss = ConversionConfig.MAX_QUALITY - quality;
        return switch (normalizeCodec(encoder)) {
            case LIBX264, LIBX265 -> new NativeQuality("-crf", Integer.toString(18 + loss * 17 / 10), List.of());
            case LIBAOM_AV1 -> new NativeQuality(
                    "-crf",
                    Integer.toString(20 + loss * 3),
                    List.of("-cpu-used", "6", "-b:v", "0"));
            case MPEG4 -> new NativeQuality("-q:v", Integer.toString(2 + loss * 29 / 10), List.of());
            default -> NativeQuality.none();
        };
    }

    public static List<QualityTableEntry> entries() {
        return ENTRIES;
    }
}
