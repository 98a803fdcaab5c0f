package github.sarthakdev143.render_kit.integration.video;

import java.util.List;

/**
 * Codec-specific quality control derived from the 0-10 quality scale. An empty flag means the codec has no
 * quality control and a configured bitrate is used instead.
 */
public record NativeQuality(String flag, String value, List<String> extraArgs) {

    public NativeQuality {
        extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
    }

    public static NativeQuality none() {
        return new NativeQuality(null, null, List.of());
    }

    public boolean isNone() {
        return flag == null;
    }
}
