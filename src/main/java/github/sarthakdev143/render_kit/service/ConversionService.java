package github.sarthakdev143.render_kit.service;

import github.sarthakdev143.render_kit.exception.ConversionException;
import github.sarthakdev143.render_kit.model.ConversionConfig;
import github.sarthakdev143.render_kit.model.ConversionJobStatus;

import java.util.Optional;

public interface ConversionService {

    /**
     * Resolves the job synchronously and queues it for conversion.
     *
     * @throws ConversionException when the sequence, output, frame rate, color transform or encoder cannot be
     *                             resolved; no job is registered in that case
     */
    ConversionJobStatus submit(ConversionConfig config, ConversionListener listener);

    Optional<ConversionJobStatus> getJobStatus(String jobId);

    /**
     * Requests cancellation. The job stops before its next frame; a job already finished is left as is.
     *
     * @return the job's status after the request, or empty for an unknown id
     */
    Optional<ConversionJobStatus> cancel(String jobId);
}
