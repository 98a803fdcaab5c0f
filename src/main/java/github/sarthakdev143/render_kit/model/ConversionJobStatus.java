package github.sarthakdev143.render_kit.model;

import java.time.Instant;

public record ConversionJobStatus(
        String jobId,
        ConversionJobState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        int completedFrames,
        int totalFrames,
        Integer currentFrame,
        String outputPath,
        String errorType,
        String errorMessage) {
}
