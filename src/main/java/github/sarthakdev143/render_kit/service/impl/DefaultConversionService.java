package github.sarthakdev143.render_kit.service.impl;

import github.sarthakdev143.render_kit.exception.ConversionException;
import github.sarthakdev143.render_kit.model.ConversionConfig;
import github.sarthakdev143.render_kit.model.ConversionJob;
import github.sarthakdev143.render_kit.model.ConversionJobState;
import github.sarthakdev143.render_kit.model.ConversionJobStatus;
import github.sarthakdev143.render_kit.model.ConversionResult;
import github.sarthakdev143.render_kit.pipeline.ConversionOrchestrator;
import github.sarthakdev143.render_kit.pipeline.ConversionPlan;
import github.sarthakdev143.render_kit.service.ConversionListener;
import github.sarthakdev143.render_kit.service.ConversionService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class DefaultConversionService implements ConversionService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultConversionService.class);

    private final ConversionOrchestrator orchestrator;
    private final TaskExecutor taskExecutor;
    private final Map<String, ConversionJobStatus> jobs = new ConcurrentHashMap<>();
    private final Map<String, ConversionJob> activeJobs = new ConcurrentHashMap<>();
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter cancelledCounter;
    private final Counter rejectedCounter;

    public DefaultConversionService(
            ConversionOrchestrator orchestrator,
            TaskExecutor taskExecutor,
            MeterRegistry meterRegistry) {
        this.orchestrator = orchestrator;
        this.taskExecutor = taskExecutor;
        this.completedCounter = meterRegistry.counter("render_kit.jobs", "outcome", "completed");
        this.failedCounter = meterRegistry.counter("render_kit.jobs", "outcome", "failed");
        this.cancelledCounter = meterRegistry.counter("render_kit.jobs", "outcome", "cancelled");
        this.rejectedCounter = meterRegistry.counter("render_kit.jobs", "outcome", "rejected");
    }

    @Override
    public ConversionJobStatus submit(ConversionConfig config, ConversionListener listener) {
        String jobId = UUID.randomUUID().toString();
        ConversionJob job = new ConversionJob(jobId, config);
        job.transitionTo(ConversionJobState.RESOLVING);

        ConversionPlan plan;
        try {
            plan = orchestrator.prepare(config);
        } catch (ConversionException e) {
            rejectedCounter.increment();
            logger.warn("Rejected conversion of {}: {}", config.inputPattern(), e.getMessage());
            throw e;
        }

        Instant now = Instant.now();
        ConversionJobStatus status = new ConversionJobStatus(
                jobId,
                job.state(),
                "Job accepted; " + plan.totalFrames() + " frame(s) queued for conversion.",
                now,
                now,
                0,
                plan.totalFrames(),
                null,
                config.outputPath().toString(),
                null,
                null);
        jobs.put(jobId, status);
        activeJobs.put(jobId, job);

        logger.info(
                "Accepted conversion job {} input={} output={} frames={}",
                jobId,
                config.inputPattern(),
                config.outputPath(),
                plan.totalFrames());

        ConversionListener callerListener = listener == null ? ConversionListener.NONE : listener;
        try {
            taskExecutor.execute(() -> runJob(job, plan, callerListener));
        } catch (RuntimeException e) {
            jobs.remove(jobId);
            activeJobs.remove(jobId);
            rejectedCounter.increment();
            throw e;
        }
        return status;
    }

    @Override
    public Optional<ConversionJobStatus> getJobStatus(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public Optional<ConversionJobStatus> cancel(String jobId) {
        ConversionJob job = activeJobs.get(jobId);
        if (job != null && !job.state().isTerminal()) {
            job.requestCancel();
            updateMessage(jobId, "Cancellation requested.");
            logger.info("Cancellation requested for conversion job {}", jobId);
        }
        return getJobStatus(jobId);
    }

    private void runJob(ConversionJob job, ConversionPlan plan, ConversionListener callerListener) {
        String jobId = job.id();
        updateProgress(jobId, ConversionJobState.CONVERTING, "Converting frames.", 0, null);

        ConversionListener tracking = new ConversionListener() {
            @Override
            public void onProgress(int completed, int total) {
                updateProgress(jobId, ConversionJobState.CONVERTING, null, completed, job.currentFrame());
                callerListener.onProgress(completed, total);
            }

            @Override
            public void onFinished(ConversionResult result) {
                markFinished(job, result);
                callerListener.onFinished(result);
            }
        };

        try {
            orchestrator.execute(plan, job, tracking);
        } catch (RuntimeException e) {
            logger.error("Conversion job {} failed unexpectedly", jobId, e);
            job.transitionTo(ConversionJobState.FAILED);
            markFinished(job, ConversionResult.failed(new ConversionException("Conversion failed unexpectedly.", e)));
        } finally {
            activeJobs.remove(jobId);
        }
    }

    private void updateProgress(String jobId, ConversionJobState state, String message, int completed, Integer frame) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new ConversionJobStatus(
                current.jobId(),
                state,
                message == null ? current.message() : message,
                current.createdAt(),
                Instant.now(),
                completed,
                current.totalFrames(),
                frame,
                current.outputPath(),
                current.errorType(),
                current.errorMessage()));
    }

    private void updateMessage(String jobId, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new ConversionJobStatus(
                current.jobId(),
                current.state(),
                message,
                current.createdAt(),
                Instant.now(),
                current.completedFrames(),
                current.totalFrames(),
                current.currentFrame(),
                current.outputPath(),
                current.errorType(),
                current.errorMessage()));
    }

    private void markFinished(ConversionJob job, ConversionResult result) {
        String message;
        switch (result.outcome()) {
            case COMPLETED -> {
                completedCounter.increment();
                message = "Video written to " + result.outputPath() + ".";
            }
            case CANCELLED -> {
                cancelledCounter.increment();
                message = result.outputPath() == null
                        ? "Conversion cancelled; no output kept."
                        : "Conversion cancelled; partial video kept at " + result.outputPath() + ".";
            }
            default -> {
                failedCounter.increment();
                message = "Conversion failed: " + result.error().getMessage();
            }
        }

        jobs.computeIfPresent(job.id(), (ignored, current) -> new ConversionJobStatus(
                current.jobId(),
                result.state(),
                message,
                current.createdAt(),
                Instant.now(),
                job.completedFrames(),
                current.totalFrames(),
                job.currentFrame(),
                result.outputPath() == null ? null : result.outputPath().toString(),
                result.error() == null ? null : result.error().getClass().getSimpleName(),
                result.error() == null ? null : result.error().getMessage()));
    }
}
