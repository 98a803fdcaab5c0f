package github.sarthakdev143.render_kit.integration.color;

/**
 * Scalar transfer curves shared by the presets and the built-in color management.
 */
public final class TransferFunctions {

    private TransferFunctions() {
    }

    /**
     * Reinhard tone mapping, {@code x / (1 + x)}. Negative input maps to 0.
     */
    public static float reinhard(float x) {
        float positive = Math.max(0.0f, x);
        return positive / (1.0f + positive);
    }

    public static float linearToSrgb(float x) {
        float value = clamp(x);
        if (value <= 0.0031308f) {
            return value * 12.92f;
        }
        return clamp((float) (1.055 * Math.pow(value, 1.0 / 2.4) - 0.055));
    }

    public static float srgbToLinear(float x) {
        float value = clamp(x);
        if (value <= 0.04045f) {
            return value / 12.92f;
        }
        return (float) Math.pow((value + 0.055) / 1.055, 2.4);
    }

    public static float linearToRec709(float x) {
        float value = clamp(x);
        if (value < 0.018f) {
            return value * 4.5f;
        }
        return clamp((float) (1.099 * Math.pow(value, 0.45) - 0.099));
    }

    public static float rec709ToLinear(float x) {
        float value = clamp(x);
        if (value < 0.081f) {
            return value / 4.5f;
        }
        return (float) Math.pow((value + 0.099) / 1.099, 1.0 / 0.45);
    }

    public static float clamp(float x) {
        if (Float.isNaN(x) || x < 0.0f) {
            return 0.0f;
        }
        return Math.min(1.0f, x);
    }

    /**
     * Multiplies an RGB triple by a row-major 3x3 matrix, in place.
     */
    public static void applyMatrix(float[][] matrix, float[] rgb) {
        float r = rgb[0];
        float g = rgb[1];
        float b = rgb[2];
        rgb[0] = matrix[0][0] * r + matrix[0][1] * g + matrix[0][2] * b;
        rgb[1] = matrix[1][0] * r + matrix[1][1] * g + matrix[1][2] * b;
        rgb[2] = matrix[2][0] * r + matrix[2][1] * g + matrix[2][2] * b;
    }
}
