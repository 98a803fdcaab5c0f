package github.sarthakdev143.render_kit.model;

/**
 * Either a preset or an explicit (source, target) pair. The explicit pair wins when both are present.
 */
public record ColorSpaceSelection(ColorSpacePreset preset, String sourceSpace, String targetSpace) {

    public ColorSpaceSelection {
        sourceSpace = blankToNull(sourceSpace);
        targetSpace = blankToNull(targetSpace);
        if ((sourceSpace == null) != (targetSpace == null)) {
            throw new IllegalArgumentException("An explicit color space pair needs both a source and a target.");
        }
        preset = preset == null ? ColorSpacePreset.LINEAR_TO_SRGB : preset;
    }

    public static ColorSpaceSelection preset(ColorSpacePreset preset) {
        return new ColorSpaceSelection(preset, null, null);
    }

    public static ColorSpaceSelection explicit(String sourceSpace, String targetSpace) {
        return new ColorSpaceSelection(null, sourceSpace, targetSpace);
    }

    public boolean isExplicit() {
        return sourceSpace != null;
    }

    public String describe() {
        return isExplicit() ? sourceSpace + " -> " + targetSpace : preset.name();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
