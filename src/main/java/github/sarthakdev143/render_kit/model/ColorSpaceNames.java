package github.sarthakdev143.render_kit.model;

public final class ColorSpaceNames {

    public static final String LINEAR = "Linear";
    public static final String SRGB = "sRGB";
    public static final String REC709 = "Rec.709";
    public static final String ACES_CG = "ACEScg";
    public static final String ACES_2065_1 = "ACES2065-1";
    public static final String RAW = "Raw";

    private ColorSpaceNames() {
    }
}
