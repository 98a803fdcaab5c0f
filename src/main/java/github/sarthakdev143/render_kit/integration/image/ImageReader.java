package github.sarthakdev143.render_kit.integration.image;

import github.sarthakdev143.render_kit.exception.DecodeException;
import github.sarthakdev143.render_kit.model.DecodedBuffer;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns a frame file and a layer name into pixels. Implementations must be safe for concurrent use.
 */
public interface ImageReader {

    /**
     * @param layerName layer to extract, or the empty string for the default layer
     * @throws DecodeException when the file or the layer cannot be read
     */
    DecodedBuffer decode(Path path, String layerName);

    ImageMetadata readMetadata(Path path);

    /**
     * Layer names stored in the file, in file order. Empty when the file only has its default layer.
     */
    List<String> listLayers(Path path);
}
