package github.sarthakdev143.render_kit.model;

import java.util.Locale;

/**
 * Named conversions, each equivalent to a fixed (source, target) color space pair.
 */
public enum ColorSpacePreset {
    LINEAR_TO_SRGB(ColorSpaceNames.LINEAR, ColorSpaceNames.SRGB),
    LINEAR_TO_REC709(ColorSpaceNames.LINEAR, ColorSpaceNames.REC709),
    SRGB_TO_LINEAR(ColorSpaceNames.SRGB, ColorSpaceNames.LINEAR),
    NO_CONVERSION(ColorSpaceNames.RAW, ColorSpaceNames.RAW);

    private final String sourceSpace;
    private final String targetSpace;

    ColorSpacePreset(String sourceSpace, String targetSpace) {
        this.sourceSpace = sourceSpace;
        this.targetSpace = targetSpace;
    }

    public String sourceSpace() {
        return sourceSpace;
    }

    public String targetSpace() {
        return targetSpace;
    }

    public boolean matches(String source, String target) {
        if (this == NO_CONVERSION) {
            return source.equalsIgnoreCase(target);
        }
        return sourceSpace.equalsIgnoreCase(source) && targetSpace.equalsIgnoreCase(target);
    }

    public static ColorSpacePreset fromInput(String input) {
        if (input == null || input.isBlank()) {
            return LINEAR_TO_SRGB;
        }

        String normalized = input.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ColorSpacePreset.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "colorSpacePreset must be one of LINEAR_TO_SRGB, LINEAR_TO_REC709, SRGB_TO_LINEAR, NO_CONVERSION.");
        }
    }
}
