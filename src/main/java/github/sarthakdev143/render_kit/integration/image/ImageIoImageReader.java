package github.sarthakdev143.render_kit.integration.image;

import github.sarthakdev143.render_kit.exception.DecodeException;
import github.sarthakdev143.render_kit.model.DecodedBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataFormatImpl;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link ImageReader} backed by {@code javax.imageio}: PNG, JPEG, TIFF, BMP and GIF frames.
 *
 * <p>These formats carry no named layers, so a layer name selects a channel subset instead, written as channel
 * letters ({@code R}, {@code G}, {@code B}, {@code A}, or {@code Y} for grayscale), e.g. {@code "RGB"} or
 * {@code "A"}. Frame rate and color space hints are read from text metadata entries under the keys renderers
 * commonly write.</p>
 */
@Component
public class ImageIoImageReader implements ImageReader {

    private static final Logger logger = LoggerFactory.getLogger(ImageIoImageReader.class);

    static final List<String> FPS_METADATA_KEYS = List.of(
            "framesPerSecond",
            "exr/FramesPerSecond",
            "fps",
            "arnold/fps",
            "rs/fps",
            "vray/fps",
            "mantra/fps",
            "karma/fps",
            "cap_fps");

    static final List<String> COLOR_SPACE_METADATA_KEYS = List.of(
            "exr/oiio:ColorSpace",
            "oiio:ColorSpace",
            "colorSpace",
            "interchange/color_space");

    @Override
    public DecodedBuffer decode(Path path, String layerName) {
        LoadedImage loaded = load(path, layerName, true);
        BufferedImage image = loaded.image();
        if (image.getColorModel() instanceof IndexColorModel) {
            image = expandIndexed(image);
        }
        if (image.isAlphaPremultiplied()) {
            image.coerceData(false);
        }

        ColorModel colorModel = image.getColorModel();
        Raster raster = image.getRaster();
        int bands = raster.getNumBands();
        boolean sourceAlpha = colorModel.hasAlpha();
        int[] selected = selectBands(path, layerName, bands, sourceAlpha);

        int width = image.getWidth();
        int height = image.getHeight();
        float[] raw = raster.getPixels(0, 0, width, height, (float[]) null);
        float[] scale = new float[bands];
        boolean floatData = raster.getDataBuffer().getDataType() == DataBuffer.TYPE_FLOAT
                || raster.getDataBuffer().getDataType() == DataBuffer.TYPE_DOUBLE;
        for (int band = 0; band < bands; band++) {
            int bits = colorModel.getComponentSize(Math.min(band, colorModel.getNumComponents() - 1));
            scale[band] = floatData ? 1.0f : 1.0f / ((1L << bits) - 1);
        }

        int channels = selected.length;
        float[] samples = new float[width * height * channels];
        int pixels = width * height;
        for (int pixel = 0; pixel < pixels; pixel++) {
            int sourceBase = pixel * bands;
            int targetBase = pixel * channels;
            for (int channel = 0; channel < channels; channel++) {
                int band = selected[channel];
                samples[targetBase + channel] = raw[sourceBase + band] * scale[band];
            }
        }

        boolean alpha = sourceAlpha
                && (channels == 2 || channels == 4)
                && selected[channels - 1] == bands - 1;
        int bitDepth = colorModel.getComponentSize(0);
        logger.debug("Decoded {} layer='{}' as {}x{}x{} ({}-bit)", path, layerName, width, height, channels, bitDepth);
        return new DecodedBuffer(width, height, channels, bitDepth, loaded.metadata().colorSpaceTag(), alpha, samples);
    }

    @Override
    public ImageMetadata readMetadata(Path path) {
        try {
            return load(path, "", false).metadata();
        } catch (DecodeException e) {
            logger.warn("Could not read metadata from {}: {}", path, e.getMessage());
            return ImageMetadata.empty();
        }
    }

    @Override
    public List<String> listLayers(Path path) {
        return List.of();
    }

    private LoadedImage load(Path path, String layerName, boolean readPixels) {
        if (!Files.isRegularFile(path)) {
            throw new DecodeException(path, layerName, "File does not exist: " + path, null);
        }

        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            if (input == null) {
                throw new DecodeException(path, layerName, "Cannot open image stream for " + path, null);
            }
            Iterator<javax.imageio.ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new DecodeException(path, layerName, "No image decoder available for " + path, null);
            }

            javax.imageio.ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, false);
                ImageMetadata metadata = parseMetadata(reader.getImageMetadata(0));
                BufferedImage image = readPixels ? reader.read(0) : null;
                return new LoadedImage(image, metadata);
            } finally {
                reader.dispose();
            }
        } catch (IIOException e) {
            throw new DecodeException(path, layerName, "Corrupt or unsupported image " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DecodeException(path, layerName, "Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private int[] selectBands(Path path, String layerName, int bands, boolean alpha) {
        if (layerName == null || layerName.isEmpty()) {
            int[] all = new int[bands];
            for (int band = 0; band < bands; band++) {
                all[band] = band;
            }
            return all;
        }

        Map<Character, Integer> available = new LinkedHashMap<>();
        int colorBands = alpha ? bands - 1 : bands;
        if (colorBands >= 3) {
            available.put('R', 0);
            available.put('G', 1);
            available.put('B', 2);
        } else {
            available.put('Y', 0);
        }
        if (alpha) {
            available.put('A', bands - 1);
        }

        String letters = layerName.trim().toUpperCase(Locale.ROOT);
        if (letters.isEmpty() || letters.length() > 4) {
            throw unknownLayer(path, layerName, available);
        }
        int[] selected = new int[letters.length()];
        for (int index = 0; index < letters.length(); index++) {
            Integer band = available.get(letters.charAt(index));
            if (band == null) {
                throw unknownLayer(path, layerName, available);
            }
            selected[index] = band;
        }
        return selected;
    }

    private DecodeException unknownLayer(Path path, String layerName, Map<Character, Integer> available) {
        StringBuilder names = new StringBuilder();
        for (Character letter : available.keySet()) {
            names.append(letter);
        }
        return new DecodeException(
                path,
                layerName,
                "Layer '" + layerName + "' not found; available channels: " + names,
                null);
    }

    private BufferedImage expandIndexed(BufferedImage indexed) {
        int type = indexed.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage expanded = new BufferedImage(indexed.getWidth(), indexed.getHeight(), type);
        expanded.getGraphics().drawImage(indexed, 0, 0, null);
        return expanded;
    }

    ImageMetadata parseMetadata(IIOMetadata metadata) {
        if (metadata == null || !metadata.isStandardMetadataFormatSupported()) {
            return ImageMetadata.empty();
        }

        Map<String, String> entries = new LinkedHashMap<>();
        Node root = metadata.getAsTree(IIOMetadataFormatImpl.standardMetadataFormatName);
        for (Node section = root.getFirstChild(); section != null; section = section.getNextSibling()) {
            if (!"Text".equals(section.getNodeName())) {
                continue;
            }
            for (Node entry = section.getFirstChild(); entry != null; entry = entry.getNextSibling()) {
                NamedNodeMap attributes = entry.getAttributes();
                if (attributes == null) {
                    continue;
                }
                Node keyword = attributes.getNamedItem("keyword");
                Node value = attributes.getNamedItem("value");
                if (keyword != null && value != null) {
                    entries.putIfAbsent(keyword.getNodeValue(), value.getNodeValue());
                }
            }
        }
        return metadataFromText(entries);
    }

    ImageMetadata metadataFromText(Map<String, String> entries) {
        Double fps = null;
        for (String key : FPS_METADATA_KEYS) {
            fps = parseFrameRate(entries.get(key));
            if (fps != null) {
                break;
            }
        }

        String colorSpace = null;
        for (String key : COLOR_SPACE_METADATA_KEYS) {
            String value = entries.get(key);
            if (value != null && !value.isBlank()) {
                colorSpace = value.trim();
                break;
            }
        }
        return new ImageMetadata(fps, colorSpace);
    }

    private Double parseFrameRate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            int slash = trimmed.indexOf('/');
            double fps = slash < 0
                    ? Double.parseDouble(trimmed)
                    : Double.parseDouble(trimmed.substring(0, slash)) / Double.parseDouble(trimmed.substring(slash + 1));
            return Double.isFinite(fps) && fps > 0.0 ? fps : null;
        } catch (NumberFormatException e) {
            logger.debug("Ignoring unparseable frame rate metadata value '{}'", trimmed);
            return null;
        }
    }

    private record LoadedImage(BufferedImage image, ImageMetadata metadata) {
    }
}
