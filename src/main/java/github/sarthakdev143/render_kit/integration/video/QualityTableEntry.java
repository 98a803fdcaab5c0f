package github.sarthakdev143.render_kit.integration.video;

import java.util.List;

public record QualityTableEntry(
        String encoder,
        List<String> aliases,
        String control,
        String mapping,
        List<String> extraArgs) {
}
