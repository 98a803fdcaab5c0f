package github.sarthakdev143.render_kit.integration.color;

import github.sarthakdev143.render_kit.exception.UnsupportedColorSpaceException;
import github.sarthakdev143.render_kit.model.ColorSpaceNames;
import github.sarthakdev143.render_kit.model.PixelTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Color management without an external config. Every conversion goes through linear Rec.709 primaries:
 * the source is decoded (or its primaries converted for ACES), then encoded for the target. Scene-linear
 * sources are tone mapped before a display encoding.
 */
@Component
public class BuiltInColorManagement implements ColorManagement {

    private static final Logger logger = LoggerFactory.getLogger(BuiltInColorManagement.class);

    static final float[][] ACESCG_TO_REC709 = {
            {1.70505f, -0.62179f, -0.08326f},
            {-0.13026f, 1.14080f, -0.01055f},
            {-0.02400f, -0.12897f, 1.15297f}
    };

    static final float[][] ACES2065_TO_REC709 = {
            {2.52169f, -1.13413f, -0.38756f},
            {-0.27648f, 1.37272f, -0.09624f},
            {-0.01538f, -0.15298f, 1.16835f}
    };

    private static final List<String> SOURCES = List.of(
            ColorSpaceNames.LINEAR,
            ColorSpaceNames.SRGB,
            ColorSpaceNames.REC709,
            ColorSpaceNames.ACES_CG,
            ColorSpaceNames.ACES_2065_1,
            ColorSpaceNames.RAW);

    private static final Set<String> TARGETS = Set.of(
            ColorSpaceNames.LINEAR,
            ColorSpaceNames.SRGB,
            ColorSpaceNames.REC709,
            ColorSpaceNames.RAW);

    private static final Set<String> SCENE_LINEAR = Set.of(
            ColorSpaceNames.LINEAR,
            ColorSpaceNames.ACES_CG,
            ColorSpaceNames.ACES_2065_1);

    // Names commonly found in oiio:ColorSpace and OCIO configs.
    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("linear", ColorSpaceNames.LINEAR),
            Map.entry("scene_linear", ColorSpaceNames.LINEAR),
            Map.entry("lin_rec709", ColorSpaceNames.LINEAR),
            Map.entry("lin_srgb", ColorSpaceNames.LINEAR),
            Map.entry("srgb", ColorSpaceNames.SRGB),
            Map.entry("srgb_texture", ColorSpaceNames.SRGB),
            Map.entry("rec.709", ColorSpaceNames.REC709),
            Map.entry("rec709", ColorSpaceNames.REC709),
            Map.entry("acescg", ColorSpaceNames.ACES_CG),
            Map.entry("aces - acescg", ColorSpaceNames.ACES_CG),
            Map.entry("aces2065-1", ColorSpaceNames.ACES_2065_1),
            Map.entry("aces - aces2065-1", ColorSpaceNames.ACES_2065_1),
            Map.entry("raw", ColorSpaceNames.RAW),
            Map.entry("data", ColorSpaceNames.RAW));

    @Override
    public List<String> listColorSpaces() {
        return SOURCES;
    }

    @Override
    public boolean knows(String colorSpace) {
        return canonical(colorSpace) != null;
    }

    @Override
    public PixelTransform buildTransform(String sourceSpace, String targetSpace) {
        String source = canonical(sourceSpace);
        String target = canonical(targetSpace);
        if (source == null) {
            throw new UnsupportedColorSpaceException(sourceSpace, targetSpace, "unknown source color space");
        }
        if (target == null) {
            throw new UnsupportedColorSpaceException(sourceSpace, targetSpace, "unknown target color space");
        }
        if (!TARGETS.contains(target)) {
            throw new UnsupportedColorSpaceException(
                    sourceSpace, targetSpace, "only Linear, sRGB, Rec.709 and Raw are supported as targets");
        }
        if (source.equals(target) || ColorSpaceNames.RAW.equals(target)) {
            return PixelTransform.IDENTITY;
        }
        if (ColorSpaceNames.RAW.equals(source)) {
            throw new UnsupportedColorSpaceException(
                    sourceSpace, targetSpace, "Raw data has no defined encoding to convert from");
        }

        PixelTransform toLinear = decoder(source);
        PixelTransform toTarget = encoder(target, SCENE_LINEAR.contains(source));
        logger.debug("Built color transform {} -> {}", source, target);
        return rgb -> {
            toLinear.apply(rgb);
            toTarget.apply(rgb);
        };
    }

    private PixelTransform decoder(String source) {
        return switch (source) {
            case ColorSpaceNames.SRGB -> rgb -> {
                for (int c = 0; c < 3; c++) {
                    rgb[c] = TransferFunctions.srgbToLinear(rgb[c]);
                }
            };
            case ColorSpaceNames.REC709 -> rgb -> {
                for (int c = 0; c < 3; c++) {
                    rgb[c] = TransferFunctions.rec709ToLinear(rgb[c]);
                }
            };
            case ColorSpaceNames.ACES_CG -> rgb -> TransferFunctions.applyMatrix(ACESCG_TO_REC709, rgb);
            case ColorSpaceNames.ACES_2065_1 -> rgb -> TransferFunctions.applyMatrix(ACES2065_TO_REC709, rgb);
            default -> PixelTransform.IDENTITY;
        };
    }

    private PixelTransform encoder(String target, boolean toneMap) {
        return switch (target) {
            case ColorSpaceNames.SRGB -> rgb -> {
                for (int c = 0; c < 3; c++) {
                    float value = toneMap ? TransferFunctions.reinhard(rgb[c]) : rgb[c];
                    rgb[c] = TransferFunctions.linearToSrgb(value);
                }
            };
            case ColorSpaceNames.REC709 -> rgb -> {
                for (int c = 0; c < 3; c++) {
                    float value = toneMap ? TransferFunctions.reinhard(rgb[c]) : rgb[c];
                    rgb[c] = TransferFunctions.linearToRec709(value);
                }
            };
            default -> PixelTransform.IDENTITY;
        };
    }

    private String canonical(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return ALIASES.get(name.trim().toLowerCase(Locale.ROOT));
    }
}
