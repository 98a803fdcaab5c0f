package github.sarthakdev143.render_kit.dto;

import github.sarthakdev143.render_kit.model.ConversionJobState;

public record ConversionSubmissionResponse(
        String jobId,
        ConversionJobState state,
        int totalFrames,
        String message) {
}
