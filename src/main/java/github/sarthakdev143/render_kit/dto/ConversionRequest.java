package github.sarthakdev143.render_kit.dto;

import java.util.List;

public record ConversionRequest(
        String inputPattern,
        String outputPath,
        Double fps,
        Integer width,
        Integer height,
        String colorSpacePreset,
        String inputColorSpace,
        String outputColorSpace,
        String codec,
        Integer quality,
        Integer bitrateKbps,
        Integer startFrame,
        Integer endFrame,
        List<String> layers,
        ContactSheetRequest contactSheet,
        BurnInRequest burnIn,
        Boolean overwrite,
        Boolean keepPartialOnCancel,
        Integer prefetchWorkers,
        Integer prefetchWindow) {

    public ConversionRequest {
        layers = layers == null ? List.of() : List.copyOf(layers);
    }
}
