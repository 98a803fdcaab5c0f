package github.sarthakdev143.render_kit.dto;

public record ContactSheetRequest(
        Boolean enabled,
        Integer columns,
        Integer thumbnailWidth,
        Integer padding,
        Boolean showLabels) {
}
