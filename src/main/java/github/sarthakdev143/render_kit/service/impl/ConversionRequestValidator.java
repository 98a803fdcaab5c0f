package github.sarthakdev143.render_kit.service.impl;

import github.sarthakdev143.render_kit.dto.BurnInRequest;
import github.sarthakdev143.render_kit.dto.ContactSheetRequest;
import github.sarthakdev143.render_kit.dto.ConversionRequest;
import github.sarthakdev143.render_kit.model.BurnInOptions;
import github.sarthakdev143.render_kit.model.CancelledOutputPolicy;
import github.sarthakdev143.render_kit.model.ColorSpacePreset;
import github.sarthakdev143.render_kit.model.ColorSpaceSelection;
import github.sarthakdev143.render_kit.model.ContactSheetLayout;
import github.sarthakdev143.render_kit.model.ConversionConfig;
import github.sarthakdev143.render_kit.model.LayerSelector;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Checks a REST conversion request field by field and turns it into a {@link ConversionConfig}.
 */
@Component
public class ConversionRequestValidator {

    private static final double MAX_FPS = 1000.0;
    private static final int MAX_DIMENSION = 16384;
    private static final int MAX_LAYERS = 64;
    private static final int MAX_COLUMNS = 64;
    private static final int MAX_PADDING = 512;
    private static final int MAX_PREFETCH_WORKERS = 64;
    private static final int MAX_PREFETCH_WINDOW = 256;

    public ConversionConfig toConfig(ConversionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required.");
        }
        if (request.inputPattern() == null || request.inputPattern().isBlank()) {
            throw new IllegalArgumentException("inputPattern is required.");
        }

        Path outputPath = parseOutputPath(request.outputPath());
        validateFps(request.fps());
        validateResolution(request.width(), request.height());
        validateRange("quality", request.quality(), ConversionConfig.MIN_QUALITY, ConversionConfig.MAX_QUALITY);
        validatePositive("bitrateKbps", request.bitrateKbps());
        if (request.startFrame() != null && request.endFrame() != null && request.startFrame() > request.endFrame()) {
            throw new IllegalArgumentException("startFrame must be <= endFrame.");
        }
        validateRange("prefetchWorkers", request.prefetchWorkers(), 1, MAX_PREFETCH_WORKERS);
        validateRange("prefetchWindow", request.prefetchWindow(), 1, MAX_PREFETCH_WINDOW);

        LayerSelector layers = new LayerSelector(request.layers());
        if (layers.layers().size() > MAX_LAYERS) {
            throw new IllegalArgumentException("layers supports at most " + MAX_LAYERS + " entries.");
        }

        ConversionConfig.Builder builder = ConversionConfig.builder()
                .inputPattern(request.inputPattern().trim())
                .outputPath(outputPath)
                .frameRate(request.fps())
                .colorSpace(resolveColorSpace(request))
                .codec(request.codec())
                .quality(request.quality() == null ? ConversionConfig.DEFAULT_QUALITY : request.quality())
                .bitrateKbps(request.bitrateKbps())
                .frameRange(request.startFrame(), request.endFrame())
                .layers(layers)
                .contactSheet(resolveContactSheet(request.contactSheet()))
                .burnIn(resolveBurnIn(request.burnIn()))
                .overwrite(Boolean.TRUE.equals(request.overwrite()))
                .cancelledOutputPolicy(Boolean.FALSE.equals(request.keepPartialOnCancel())
                        ? CancelledOutputPolicy.DELETE_PARTIAL
                        : CancelledOutputPolicy.KEEP_PARTIAL)
                .prefetch(request.prefetchWorkers(), request.prefetchWindow());
        if (request.width() != null) {
            builder.resolution(request.width(), request.height());
        }
        return builder.build();
    }

    private Path parseOutputPath(String outputPath) {
        if (outputPath == null || outputPath.isBlank()) {
            throw new IllegalArgumentException("outputPath is required.");
        }
        try {
            Path path = Path.of(outputPath.trim());
            if (path.getFileName() == null) {
                throw new IllegalArgumentException("outputPath must name a file.");
            }
            return path;
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("outputPath is not a valid path.", e);
        }
    }

    private void validateFps(Double fps) {
        if (fps == null) {
            return;
        }
        if (fps.isNaN() || fps <= 0.0 || fps > MAX_FPS) {
            throw new IllegalArgumentException("fps must be greater than 0 and at most " + MAX_FPS + ".");
        }
    }

    private void validateResolution(Integer width, Integer height) {
        if (width == null && height == null) {
            return;
        }
        if (width == null || height == null) {
            throw new IllegalArgumentException("width and height must be given together.");
        }
        validateRange("width", width, 1, MAX_DIMENSION);
        validateRange("height", height, 1, MAX_DIMENSION);
    }

    private ColorSpaceSelection resolveColorSpace(ConversionRequest request) {
        boolean hasSource = request.inputColorSpace() != null && !request.inputColorSpace().isBlank();
        boolean hasTarget = request.outputColorSpace() != null && !request.outputColorSpace().isBlank();
        if (hasSource != hasTarget) {
            throw new IllegalArgumentException("inputColorSpace and outputColorSpace must be given together.");
        }
        ColorSpacePreset preset = ColorSpacePreset.fromInput(request.colorSpacePreset());
        return new ColorSpaceSelection(preset, request.inputColorSpace(), request.outputColorSpace());
    }

    private ContactSheetLayout resolveContactSheet(ContactSheetRequest contactSheet) {
        if (contactSheet == null || Boolean.FALSE.equals(contactSheet.enabled())) {
            return null;
        }
        validateRange("contactSheet.columns", contactSheet.columns(), 1, MAX_COLUMNS);
        validateRange("contactSheet.thumbnailWidth", contactSheet.thumbnailWidth(), 1, MAX_DIMENSION);
        validateRange("contactSheet.padding", contactSheet.padding(), 0, MAX_PADDING);
        return new ContactSheetLayout(
                contactSheet.columns() == null ? ContactSheetLayout.DEFAULT_COLUMNS : contactSheet.columns(),
                contactSheet.thumbnailWidth(),
                contactSheet.padding() == null ? ContactSheetLayout.DEFAULT_PADDING : contactSheet.padding(),
                !Boolean.FALSE.equals(contactSheet.showLabels()));
    }

    private BurnInOptions resolveBurnIn(BurnInRequest burnIn) {
        if (burnIn == null) {
            return BurnInOptions.none();
        }
        double opacity = burnIn.opacity() == null ? BurnInOptions.DEFAULT_OPACITY : burnIn.opacity();
        if (Double.isNaN(opacity) || opacity < 0.0 || opacity > 1.0) {
            throw new IllegalArgumentException("burnIn.opacity must be between 0 and 1.");
        }
        return new BurnInOptions(
                Boolean.TRUE.equals(burnIn.frameNumber()),
                Boolean.TRUE.equals(burnIn.layerName()),
                Boolean.TRUE.equals(burnIn.fps()),
                opacity);
    }

    private void validatePositive(String field, Integer value) {
        if (value != null && value <= 0) {
            throw new IllegalArgumentException(field + " must be greater than 0.");
        }
    }

    private void validateRange(String field, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            throw new IllegalArgumentException(field + " must be between " + min + " and " + max + ".");
        }
    }
}
