package github.sarthakdev143.render_kit.model;

import java.util.Arrays;

/**
 * Decoded pixels of one layer of one frame.
 *
 * <p>Samples are interleaved floats where display white is {@code 1.0}; scene-linear sources may exceed it.
 * Instances are immutable and may be handed to several waiters at once, so the sample array is never exposed.
 * The constructor takes ownership of the array it is given.</p>
 */
public final class DecodedBuffer {

    private final int width;
    private final int height;
    private final int channels;
    private final int bitDepth;
    private final String colorSpaceTag;
    private final boolean alpha;
    private final float[] samples;

    public DecodedBuffer(
            int width,
            int height,
            int channels,
            int bitDepth,
            String colorSpaceTag,
            boolean alpha,
            float[] samples) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Buffer dimensions must be positive, got " + width + "x" + height + ".");
        }
        if (channels < 1 || channels > 4) {
            throw new IllegalArgumentException("Buffer channel count must be between 1 and 4, got " + channels + ".");
        }
        if (alpha && channels != 2 && channels != 4) {
            throw new IllegalArgumentException("Alpha requires 2 or 4 channels, got " + channels + ".");
        }
        if (samples == null || samples.length != width * height * channels) {
            throw new IllegalArgumentException("Sample array does not match " + width + "x" + height + "x" + channels + ".");
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.bitDepth = bitDepth;
        this.colorSpaceTag = colorSpaceTag;
        this.alpha = alpha;
        this.samples = samples;
    }

    public static DecodedBuffer rgb(int width, int height, float[] samples) {
        return new DecodedBuffer(width, height, 3, 32, null, false, samples);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int channels() {
        return channels;
    }

    public int bitDepth() {
        return bitDepth;
    }

    public String colorSpaceTag() {
        return colorSpaceTag;
    }

    public boolean hasAlpha() {
        return alpha;
    }

    /**
     * Number of color channels, alpha excluded.
     */
    public int colorChannels() {
        return alpha ? channels - 1 : channels;
    }

    public float sample(int x, int y, int channel) {
        return samples[(y * width + x) * channels + channel];
    }

    public float sampleAt(int index) {
        return samples[index];
    }

    public int sampleCount() {
        return samples.length;
    }

    public float[] copySamples() {
        return samples.clone();
    }

    public long byteSize() {
        return (long) samples.length * Float.BYTES;
    }

    public boolean sameSize(DecodedBuffer other) {
        return width == other.width && height == other.height;
    }

    public boolean samplesEqual(DecodedBuffer other) {
        return width == other.width
                && height == other.height
                && channels == other.channels
                && Arrays.equals(samples, other.samples);
    }

    /**
     * Same pixel metadata, new samples. Takes ownership of {@code replacement}.
     */
    public DecodedBuffer withSamples(float[] replacement) {
        return new DecodedBuffer(width, height, channels, bitDepth, colorSpaceTag, alpha, replacement);
    }

    @Override
    public String toString() {
        return "DecodedBuffer[" + width + "x" + height + "x" + channels
                + ", bitDepth=" + bitDepth
                + ", colorSpace=" + colorSpaceTag
                + ", alpha=" + alpha + "]";
    }
}
