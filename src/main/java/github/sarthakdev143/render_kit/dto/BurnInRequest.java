package github.sarthakdev143.render_kit.dto;

public record BurnInRequest(
        Boolean frameNumber,
        Boolean layerName,
        Boolean fps,
        Double opacity) {
}
