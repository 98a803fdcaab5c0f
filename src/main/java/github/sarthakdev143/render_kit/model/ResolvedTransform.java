package github.sarthakdev143.render_kit.model;

import java.util.Objects;

/**
 * Outcome of color transform resolution: a built-in preset, or a function supplied by the color management
 * collaborator for an arbitrary pair.
 */
public record ResolvedTransform(
        Kind kind,
        ColorSpacePreset preset,
        String sourceSpace,
        String targetSpace,
        PixelTransform function) {

    public enum Kind {
        PRESET,
        EXTERNAL
    }

    public ResolvedTransform {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(function, "function");
        if (kind == Kind.PRESET && preset == null) {
            throw new IllegalArgumentException("A preset transform needs its preset.");
        }
    }

    public static ResolvedTransform preset(ColorSpacePreset preset, PixelTransform function) {
        return new ResolvedTransform(Kind.PRESET, preset, preset.sourceSpace(), preset.targetSpace(), function);
    }

    public static ResolvedTransform external(String sourceSpace, String targetSpace, PixelTransform function) {
        return new ResolvedTransform(Kind.EXTERNAL, null, sourceSpace, targetSpace, function);
    }

    public boolean isIdentity() {
        return kind == Kind.PRESET && preset == ColorSpacePreset.NO_CONVERSION;
    }

    public String describe() {
        return switch (kind) {
            case PRESET -> preset.name();
            case EXTERNAL -> sourceSpace + " -> " + targetSpace;
        };
    }
}
