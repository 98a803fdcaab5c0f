package github.sarthakdev143.render_kit.controller;

import github.sarthakdev143.render_kit.dto.ConversionRequest;
import github.sarthakdev143.render_kit.dto.ConversionSubmissionResponse;
import github.sarthakdev143.render_kit.exception.ConversionException;
import github.sarthakdev143.render_kit.exception.EncoderUnavailableException;
import github.sarthakdev143.render_kit.exception.OutputExistsException;
import github.sarthakdev143.render_kit.integration.video.CodecQualityTable;
import github.sarthakdev143.render_kit.integration.video.QualityTableEntry;
import github.sarthakdev143.render_kit.model.ConversionConfig;
import github.sarthakdev143.render_kit.model.ConversionJobStatus;
import github.sarthakdev143.render_kit.service.ConversionListener;
import github.sarthakdev143.render_kit.service.ConversionService;
import github.sarthakdev143.render_kit.service.impl.ConversionRequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/conversions")
public class ConversionController {

    private static final Logger logger = LoggerFactory.getLogger(ConversionController.class);

    private final ConversionService conversionService;
    private final ConversionRequestValidator requestValidator;

    public ConversionController(ConversionService conversionService, ConversionRequestValidator requestValidator) {
        this.conversionService = conversionService;
        this.requestValidator = requestValidator;
    }

    @PostMapping(consumes = "application/json")
    public ResponseEntity<?> submit(@RequestBody ConversionRequest request) {
        try {
            ConversionConfig config = requestValidator.toConfig(request);
            ConversionJobStatus status = conversionService.submit(config, ConversionListener.NONE);
            return ResponseEntity.accepted()
                    .body(new ConversionSubmissionResponse(
                            status.jobId(),
                            status.state(),
                            status.totalFrames(),
                            "Conversion job accepted. Poll /api/conversions/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (OutputExistsException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
        } catch (EncoderUnavailableException e) {
            logger.warn("Encoder unavailable: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(e.getMessage());
        } catch (TaskRejectedException e) {
            logger.warn("Conversion queue is full", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Conversion queue is full. Please try again later.");
        } catch (ConversionException e) {
            return ResponseEntity.badRequest().body("Cannot start conversion: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Conversion submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to start conversion. Please try again.");
        }
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        return conversionService.getJobStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String jobId) {
        return conversionService.cancel(jobId)
                .<ResponseEntity<?>>map(status -> ResponseEntity.accepted().body(status))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    @GetMapping("/quality-table")
    public List<QualityTableEntry> qualityTable() {
        return CodecQualityTable.entries();
    }
}
