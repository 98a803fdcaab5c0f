package github.sarthakdev143.render_kit.model;

public record ContactSheetLayout(int columns, Integer thumbnailWidth, int padding, boolean showLabels) {

    public static final int DEFAULT_COLUMNS = 4;
    public static final int DEFAULT_PADDING = 4;
    public static final double LABEL_STRIP_FRACTION = 0.15;
    public static final int MIN_LABEL_STRIP_HEIGHT = 12;

    public ContactSheetLayout {
        if (columns < 1) {
            throw new IllegalArgumentException("Contact sheet columns must be at least 1.");
        }
        if (thumbnailWidth != null && thumbnailWidth < 1) {
            throw new IllegalArgumentException("Contact sheet thumbnail width must be at least 1.");
        }
        if (padding < 0) {
            throw new IllegalArgumentException("Contact sheet padding must not be negative.");
        }
    }

    public static ContactSheetLayout defaults() {
        return new ContactSheetLayout(DEFAULT_COLUMNS, null, DEFAULT_PADDING, true);
    }

    public int rows(int layerCount) {
        return Math.max(1, (layerCount + columns - 1) / columns);
    }

    public int labelStripHeight(int cellContentHeight) {
        if (!showLabels) {
            return 0;
        }
        return Math.max(MIN_LABEL_STRIP_HEIGHT, (int) Math.round(cellContentHeight * LABEL_STRIP_FRACTION));
    }
}
