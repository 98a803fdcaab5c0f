package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.integration.video.NativeQuality;
import github.sarthakdev143.render_kit.model.ContactSheetLayout;
import github.sarthakdev143.render_kit.model.ConversionConfig;
import github.sarthakdev143.render_kit.model.FrameSequence;
import github.sarthakdev143.render_kit.model.ResolvedTransform;

import java.util.List;

/**
 * Everything resolved before the first frame is read.
 *
 * @param layers layer names to read from every frame; the empty name is the default layer
 * @param layout grid layout, or {@code null} when a single layer passes through
 */
public record ConversionPlan(
        ConversionConfig config,
        FrameSequence sequence,
        double frameRate,
        List<String> layers,
        ContactSheetLayout layout,
        ResolvedTransform transform,
        String encoder,
        NativeQuality quality) {

    public ConversionPlan {
        layers = List.copyOf(layers);
    }

    public int totalFrames() {
        return sequence.size();
    }

    /**
     * Label for burn-ins: the layer name, or every name joined with {@code /}.
     */
    public String layerLabel() {
        return String.join("/", layers);
    }
}
