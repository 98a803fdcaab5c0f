package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.exception.UnsupportedColorSpaceException;
import github.sarthakdev143.render_kit.integration.color.ColorManagement;
import github.sarthakdev143.render_kit.integration.color.TransferFunctions;
import github.sarthakdev143.render_kit.model.ColorSpaceNames;
import github.sarthakdev143.render_kit.model.ColorSpacePreset;
import github.sarthakdev143.render_kit.model.ColorSpaceSelection;
import github.sarthakdev143.render_kit.model.DecodedBuffer;
import github.sarthakdev143.render_kit.model.PixelTransform;
import github.sarthakdev143.render_kit.model.ResolvedTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves color conversions to a {@link ResolvedTransform} and applies them to decoded buffers.
 *
 * <p>Presets are built in; any other pair is delegated to {@link ColorManagement}. Alpha is never touched.</p>
 */
@Component
public class ColorTransformEngine {

    private static final Logger logger = LoggerFactory.getLogger(ColorTransformEngine.class);

    private final ColorManagement colorManagement;

    public ColorTransformEngine(ColorManagement colorManagement) {
        this.colorManagement = colorManagement;
    }

    public ResolvedTransform resolve(ColorSpacePreset preset) {
        return ResolvedTransform.preset(preset, presetFunction(preset));
    }

    /**
     * @throws UnsupportedColorSpaceException when the pair is neither a preset nor convertible by color management
     */
    public ResolvedTransform resolve(String sourceSpace, String targetSpace) {
        if (sourceSpace == null || sourceSpace.isBlank() || targetSpace == null || targetSpace.isBlank()) {
            throw new UnsupportedColorSpaceException(sourceSpace, targetSpace, "both color spaces are required");
        }
        for (ColorSpacePreset preset : ColorSpacePreset.values()) {
            if (preset.matches(sourceSpace.trim(), targetSpace.trim())) {
                return resolve(preset);
            }
        }
        PixelTransform function = colorManagement.buildTransform(sourceSpace.trim(), targetSpace.trim());
        return ResolvedTransform.external(sourceSpace.trim(), targetSpace.trim(), function);
    }

    public ResolvedTransform resolve(ColorSpaceSelection selection) {
        if (selection.isExplicit()) {
            return resolve(selection.sourceSpace(), selection.targetSpace());
        }
        return resolve(selection.preset());
    }

    /**
     * Swaps the default preset for (tag to sRGB) when the first frame declares a color space color management
     * knows. Explicit choices are left alone.
     */
    public ColorSpaceSelection upgradeFromMetadata(ColorSpaceSelection selection, String colorSpaceTag) {
        if (selection.isExplicit()
                || selection.preset() != ColorSpacePreset.LINEAR_TO_SRGB
                || colorSpaceTag == null
                || colorSpaceTag.isBlank()
                || ColorSpaceNames.LINEAR.equalsIgnoreCase(colorSpaceTag.trim())
                || !colorManagement.knows(colorSpaceTag)) {
            return selection;
        }
        logger.warn("Using input color space '{}' from frame metadata instead of the Linear default", colorSpaceTag);
        return ColorSpaceSelection.explicit(colorSpaceTag.trim(), ColorSpaceNames.SRGB);
    }

    /**
     * Applies {@code transform} to the color channels of {@code buffer}. The identity returns {@code buffer} itself.
     */
    public DecodedBuffer apply(ResolvedTransform transform, DecodedBuffer buffer) {
        if (transform.isIdentity() || transform.function() == PixelTransform.IDENTITY) {
            return buffer;
        }

        PixelTransform function = transform.function();
        float[] samples = buffer.copySamples();
        int channels = buffer.channels();
        int colorChannels = buffer.colorChannels();
        float[] rgb = new float[3];
        int pixels = buffer.width() * buffer.height();
        for (int pixel = 0; pixel < pixels; pixel++) {
            int base = pixel * channels;
            if (colorChannels >= 3) {
                rgb[0] = samples[base];
                rgb[1] = samples[base + 1];
                rgb[2] = samples[base + 2];
                function.apply(rgb);
                samples[base] = rgb[0];
                samples[base + 1] = rgb[1];
                samples[base + 2] = rgb[2];
            } else {
                rgb[0] = samples[base];
                rgb[1] = samples[base];
                rgb[2] = samples[base];
                function.apply(rgb);
                samples[base] = (rgb[0] + rgb[1] + rgb[2]) / 3.0f;
            }
        }
        return buffer.withSamples(samples);
    }

    private PixelTransform presetFunction(ColorSpacePreset preset) {
        return switch (preset) {
            case LINEAR_TO_SRGB -> rgb -> {
                for (int c = 0; c < 3; c++) {
                    rgb[c] = TransferFunctions.linearToSrgb(TransferFunctions.reinhard(rgb[c]));
                }
            };
            case LINEAR_TO_REC709 -> rgb -> {
                for (int c = 0; c < 3; c++) {
                    rgb[c] = TransferFunctions.linearToRec709(TransferFunctions.reinhard(rgb[c]));
                }
            };
            case SRGB_TO_LINEAR -> rgb -> {
                for (int c = 0; c < 3; c++) {
                    rgb[c] = TransferFunctions.srgbToLinear(rgb[c]);
                }
            };
            case NO_CONVERSION -> PixelTransform.IDENTITY;
        };
    }
}
