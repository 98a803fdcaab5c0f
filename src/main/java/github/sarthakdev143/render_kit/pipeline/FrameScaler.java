package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.model.DecodedBuffer;

/**
 * Bilinear resampling with pixel-center alignment.
 */
public final class FrameScaler {

    private FrameScaler() {
    }

    /**
     * Returns {@code source} itself when it already has the requested size.
     */
    public static DecodedBuffer resize(DecodedBuffer source, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive, got " + width + "x" + height + ".");
        }
        if (source.width() == width && source.height() == height) {
            return source;
        }

        int channels = source.channels();
        float[] target = new float[width * height * channels];
        double scaleX = (double) source.width() / width;
        double scaleY = (double) source.height() / height;
        int maxX = source.width() - 1;
        int maxY = source.height() - 1;

        for (int y = 0; y < height; y++) {
            double sy = Math.max(0.0, Math.min(maxY, (y + 0.5) * scaleY - 0.5));
            int y0 = (int) Math.floor(sy);
            int y1 = Math.min(y0 + 1, maxY);
            float fy = (float) (sy - y0);
            for (int x = 0; x < width; x++) {
                double sx = Math.max(0.0, Math.min(maxX, (x + 0.5) * scaleX - 0.5));
                int x0 = (int) Math.floor(sx);
                int x1 = Math.min(x0 + 1, maxX);
                float fx = (float) (sx - x0);
                int base = (y * width + x) * channels;
                for (int c = 0; c < channels; c++) {
                    float top = lerp(source.sample(x0, y0, c), source.sample(x1, y0, c), fx);
                    float bottom = lerp(source.sample(x0, y1, c), source.sample(x1, y1, c), fx);
                    target[base + c] = lerp(top, bottom, fy);
                }
            }
        }
        return new DecodedBuffer(
                width,
                height,
                channels,
                source.bitDepth(),
                source.colorSpaceTag(),
                source.hasAlpha(),
                target);
    }

    private static float lerp(float a, float b, float t) {
        return a + (b - a) * t;
    }
}
