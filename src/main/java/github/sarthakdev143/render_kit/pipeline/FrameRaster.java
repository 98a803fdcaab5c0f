package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.model.DecodedBuffer;

/**
 * Mutable pixel canvas used while composing a frame. Same interleaved layout as {@link DecodedBuffer}; drawing
 * operations touch color channels only.
 */
public final class FrameRaster {

    private final int width;
    private final int height;
    private final int channels;
    private final boolean alpha;
    private final int bitDepth;
    private final String colorSpaceTag;
    private final float[] samples;

    private FrameRaster(
            int width,
            int height,
            int channels,
            boolean alpha,
            int bitDepth,
            String colorSpaceTag,
            float[] samples) {
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.alpha = alpha;
        this.bitDepth = bitDepth;
        this.colorSpaceTag = colorSpaceTag;
        this.samples = samples;
    }

    /**
     * Black RGB canvas.
     */
    public static FrameRaster blank(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Canvas dimensions must be positive, got " + width + "x" + height + ".");
        }
        return new FrameRaster(width, height, 3, false, 32, null, new float[width * height * 3]);
    }

    public static FrameRaster copyOf(DecodedBuffer buffer) {
        return new FrameRaster(
                buffer.width(),
                buffer.height(),
                buffer.channels(),
                buffer.hasAlpha(),
                buffer.bitDepth(),
                buffer.colorSpaceTag(),
                buffer.copySamples());
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    private int colorChannels() {
        return alpha ? channels - 1 : channels;
    }

    /**
     * Copies the color of {@code source} with its top-left corner at ({@code x}, {@code y}), clipped to the canvas.
     * Gray sources are replicated into RGB canvases.
     */
    public void paste(DecodedBuffer source, int x, int y) {
        int targetColors = colorChannels();
        int sourceColors = source.colorChannels();
        for (int sy = 0; sy < source.height(); sy++) {
            int ty = y + sy;
            if (ty < 0 || ty >= height) {
                continue;
            }
            for (int sx = 0; sx < source.width(); sx++) {
                int tx = x + sx;
                if (tx < 0 || tx >= width) {
                    continue;
                }
                int base = (ty * width + tx) * channels;
                for (int c = 0; c < targetColors; c++) {
                    samples[base + c] = sourceColors >= 3
                            ? source.sample(sx, sy, Math.min(c, 2))
                            : source.sample(sx, sy, 0);
                }
            }
        }
    }

    /**
     * Multiplies the color of rows {@code [top, bottom)} by {@code factor}.
     */
    public void scaleRows(int top, int bottom, float factor) {
        int colors = colorChannels();
        for (int row = Math.max(0, top); row < Math.min(height, bottom); row++) {
            for (int column = 0; column < width; column++) {
                int base = (row * width + column) * channels;
                for (int c = 0; c < colors; c++) {
                    samples[base + c] *= factor;
                }
            }
        }
    }

    /**
     * Blends {@code value} (a gray level) over the pixel with the given coverage in {@code [0, 1]}.
     */
    public void blend(int x, int y, float value, float coverage) {
        if (x < 0 || y < 0 || x >= width || y >= height || coverage <= 0.0f) {
            return;
        }
        float weight = Math.min(1.0f, coverage);
        int base = (y * width + x) * channels;
        for (int c = 0; c < colorChannels(); c++) {
            samples[base + c] = samples[base + c] * (1.0f - weight) + value * weight;
        }
    }

    public float sample(int x, int y, int channel) {
        return samples[(y * width + x) * channels + channel];
    }

    public DecodedBuffer toBuffer() {
        return new DecodedBuffer(width, height, channels, bitDepth, colorSpaceTag, alpha, samples.clone());
    }
}
