package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.model.ContactSheetLayout;
import github.sarthakdev143.render_kit.model.DecodedBuffer;
import github.sarthakdev143.render_kit.model.LayerBuffer;
import github.sarthakdev143.render_kit.model.OutputResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the layers of one frame into a single buffer. One instance per job: the resolution of each layer and
 * the grid geometry are fixed by the first frame and reused for every later frame.
 */
public class Compositor {

    private static final Logger logger = LoggerFactory.getLogger(Compositor.class);

    private final ContactSheetLayout layout;
    private final TextPainter textPainter;
    private final Map<String, OutputResolution> layerResolutions = new HashMap<>();
    private Grid grid;

    /**
     * @param layout grid layout, or {@code null} to pass a single layer through unchanged
     */
    public Compositor(ContactSheetLayout layout, TextPainter textPainter) {
        this.layout = layout;
        this.textPainter = textPainter;
    }

    public DecodedBuffer composite(int frameIndex, List<LayerBuffer> layers) {
        if (layers.isEmpty()) {
            throw new IllegalArgumentException("Frame " + frameIndex + " has no layers to composite.");
        }

        List<LayerBuffer> normalized = new ArrayList<>(layers.size());
        for (LayerBuffer layer : layers) {
            normalized.add(layer.withBuffer(matchFirstResolution(frameIndex, layer)));
        }

        if (layout == null && normalized.size() == 1) {
            return normalized.get(0).buffer();
        }
        return compositeGrid(normalized);
    }

    private DecodedBuffer matchFirstResolution(int frameIndex, LayerBuffer layer) {
        DecodedBuffer buffer = layer.buffer();
        OutputResolution expected = layerResolutions.computeIfAbsent(
                layer.layerName(),
                ignored -> new OutputResolution(buffer.width(), buffer.height()));
        if (expected.width() == buffer.width() && expected.height() == buffer.height()) {
            return buffer;
        }

        logger.warn(
                "Dimension mismatch on frame {} layer '{}': {}x{} resized to {}x{}",
                frameIndex,
                layer.layerName(),
                buffer.width(),
                buffer.height(),
                expected.width(),
                expected.height());
        return FrameScaler.resize(buffer, expected.width(), expected.height());
    }

    private DecodedBuffer compositeGrid(List<LayerBuffer> layers) {
        ContactSheetLayout effective = layout == null ? ContactSheetLayout.defaults() : layout;
        if (grid == null) {
            grid = Grid.plan(effective, layers);
            logger.debug(
                    "Contact sheet grid {}x{} cells of {}x{} px, canvas {}x{}",
                    effective.columns(),
                    grid.rows(),
                    grid.cellWidth(),
                    grid.cellHeight(),
                    grid.canvasWidth(),
                    grid.canvasHeight());
        }

        FrameRaster canvas = FrameRaster.blank(grid.canvasWidth(), grid.canvasHeight());
        int padding = effective.padding();
        for (int index = 0; index < layers.size(); index++) {
            LayerBuffer layer = layers.get(index);
            int cellX = (index % effective.columns()) * grid.cellWidth();
            int cellY = (index / effective.columns()) * grid.cellHeight();
            if (cellY >= grid.canvasHeight()) {
                logger.warn("Layer '{}' does not fit the contact sheet grid and is skipped", layer.layerName());
                continue;
            }

            DecodedBuffer source = layer.buffer();
            int thumbnailHeight = thumbnailHeight(grid.thumbnailWidth(), source);
            DecodedBuffer thumbnail = FrameScaler.resize(source, grid.thumbnailWidth(), thumbnailHeight);
            int offsetY = (grid.cellContentHeight() - thumbnailHeight) / 2;
            canvas.paste(thumbnail, cellX + padding, cellY + padding + offsetY);

            if (grid.labelHeight() > 0) {
                textPainter.paint(
                        canvas,
                        layer.layerName(),
                        cellX + padding,
                        cellY + padding + grid.cellContentHeight(),
                        grid.labelHeight(),
                        TextAlignment.LEFT);
            }
        }
        return canvas.toBuffer();
    }

    static int thumbnailHeight(int thumbnailWidth, DecodedBuffer source) {
        return Math.max(1, (int) Math.round((double) thumbnailWidth * source.height() / source.width()));
    }

    private record Grid(
            int rows,
            int thumbnailWidth,
            int cellContentHeight,
            int labelHeight,
            int cellWidth,
            int cellHeight,
            int canvasWidth,
            int canvasHeight) {

        static Grid plan(ContactSheetLayout layout, List<LayerBuffer> layers) {
            int thumbnailWidth = layout.thumbnailWidth() != null
                    ? layout.thumbnailWidth()
                    : layers.get(0).buffer().width();
            int contentHeight = 1;
            for (LayerBuffer layer : layers) {
                contentHeight = Math.max(contentHeight, thumbnailHeight(thumbnailWidth, layer.buffer()));
            }
            int labelHeight = layout.labelStripHeight(contentHeight);
            int rows = layout.rows(layers.size());
            int cellWidth = thumbnailWidth + 2 * layout.padding();
            int cellHeight = contentHeight + 2 * layout.padding() + labelHeight;
            return new Grid(
                    rows,
                    thumbnailWidth,
                    contentHeight,
                    labelHeight,
                    cellWidth,
                    cellHeight,
                    cellWidth * layout.columns(),
                    cellHeight * rows);
        }
    }
}
