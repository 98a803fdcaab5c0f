package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.config.RenderKitProperties;
import github.sarthakdev143.render_kit.exception.ConfigurationException;
import github.sarthakdev143.render_kit.exception.ConversionCancelledException;
import github.sarthakdev143.render_kit.exception.ConversionException;
import github.sarthakdev143.render_kit.exception.EncoderStreamException;
import github.sarthakdev143.render_kit.exception.FrameProcessingException;
import github.sarthakdev143.render_kit.exception.OutputExistsException;
import github.sarthakdev143.render_kit.factory.DecodeCacheFactory;
import github.sarthakdev143.render_kit.integration.image.ImageMetadata;
import github.sarthakdev143.render_kit.integration.image.ImageReader;
import github.sarthakdev143.render_kit.integration.video.CodecQualityTable;
import github.sarthakdev143.render_kit.integration.video.EncoderBridge;
import github.sarthakdev143.render_kit.integration.video.EncoderHeader;
import github.sarthakdev143.render_kit.integration.video.EncoderSession;
import github.sarthakdev143.render_kit.integration.video.NativeQuality;
import github.sarthakdev143.render_kit.model.CacheKey;
import github.sarthakdev143.render_kit.model.CancelledOutputPolicy;
import github.sarthakdev143.render_kit.model.ColorSpaceSelection;
import github.sarthakdev143.render_kit.model.ContactSheetLayout;
import github.sarthakdev143.render_kit.model.ConversionConfig;
import github.sarthakdev143.render_kit.model.ConversionJob;
import github.sarthakdev143.render_kit.model.ConversionJobState;
import github.sarthakdev143.render_kit.model.ConversionResult;
import github.sarthakdev143.render_kit.model.DecodedBuffer;
import github.sarthakdev143.render_kit.model.FrameSequence;
import github.sarthakdev143.render_kit.model.LayerBuffer;
import github.sarthakdev143.render_kit.model.OutputResolution;
import github.sarthakdev143.render_kit.model.OverwritePolicy;
import github.sarthakdev143.render_kit.model.ResolvedTransform;
import github.sarthakdev143.render_kit.service.ConversionListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Drives one job from a config to a finished video: resolve, then decode, transform, composite, burn in and
 * encode every frame in order.
 *
 * <p>{@link #prepare} fails fast on anything that can be checked before the first frame. {@link #execute} never
 * throws: every outcome is reported through the returned {@link ConversionResult} and the listener. The encoder
 * writes to a hidden staging file next to the output, which only becomes the output after a successful finish.</p>
 */
@Component
public class ConversionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ConversionOrchestrator.class);

    private final SequenceResolver sequenceResolver;
    private final ImageReader imageReader;
    private final ColorTransformEngine colorTransformEngine;
    private final EncoderBridge encoderBridge;
    private final TextPainter textPainter;
    private final DecodeCacheFactory decodeCacheFactory;
    private final RenderKitProperties properties;
    private final Counter framesEncodedCounter;

    public ConversionOrchestrator(
            SequenceResolver sequenceResolver,
            ImageReader imageReader,
            ColorTransformEngine colorTransformEngine,
            EncoderBridge encoderBridge,
            TextPainter textPainter,
            DecodeCacheFactory decodeCacheFactory,
            RenderKitProperties properties,
            MeterRegistry meterRegistry) {
        this.sequenceResolver = sequenceResolver;
        this.imageReader = imageReader;
        this.colorTransformEngine = colorTransformEngine;
        this.encoderBridge = encoderBridge;
        this.textPainter = textPainter;
        this.decodeCacheFactory = decodeCacheFactory;
        this.properties = properties;
        this.framesEncodedCounter = meterRegistry.counter("render_kit.frames.encoded");
    }

    /**
     * Resolves the sequence, frame rate, layers, color transform and encoder.
     *
     * @throws ConversionException when the job cannot start; nothing has been written at that point
     */
    public ConversionPlan prepare(ConversionConfig config) {
        FrameSequence sequence = sequenceResolver.resolve(config.inputPattern(), config.startFrame(), config.endFrame());
        checkOutput(config);

        Path firstFrame = sequence.pathFor(sequence.frames().get(0));
        ImageMetadata metadata = imageReader.readMetadata(firstFrame);

        double frameRate = resolveFrameRate(config, metadata);
        List<String> layers = resolveLayers(config, firstFrame);
        ContactSheetLayout layout = config.contactSheet();
        if (layout == null && layers.size() > 1) {
            layout = ContactSheetLayout.defaults();
        }

        ColorSpaceSelection selection = colorTransformEngine.upgradeFromMetadata(
                config.colorSpace(),
                metadata.colorSpaceTag());
        ResolvedTransform transform = colorTransformEngine.resolve(selection);

        String encoder = encoderBridge.probe(config.codec());
        NativeQuality quality = CodecQualityTable.nativeQuality(encoder, config.quality());

        logger.info(
                "Prepared conversion of {} frame(s) from {} to {}: fps={} layers={} color={} encoder={} contactSheet={}",
                sequence.size(),
                config.inputPattern(),
                config.outputPath(),
                frameRate,
                layers,
                transform.describe(),
                encoder,
                layout != null);
        return new ConversionPlan(config, sequence, frameRate, layers, layout, transform, encoder, quality);
    }

    /**
     * Converts every frame of {@code plan}. Runs on the calling thread until the job reaches a terminal state.
     */
    public ConversionResult execute(ConversionPlan plan, ConversionJob job, ConversionListener listener) {
        ConversionListener events = listener == null ? ConversionListener.NONE : listener;
        ConversionResult result = run(plan, job, events);
        job.transitionTo(result.state());
        logger.info("Conversion job {} finished as {}", job.id(), result.outcome());
        notifyFinished(events, result);
        return result;
    }

    private ConversionResult run(ConversionPlan plan, ConversionJob job, ConversionListener listener) {
        job.transitionTo(ConversionJobState.CONVERTING);
        job.setTotalFrames(plan.totalFrames());

        ConversionConfig config = plan.config();
        Path outputPath = config.outputPath();
        Path stagingPath = stagingPathFor(outputPath);
        int workerCount = config.prefetchWorkers() != null
                ? config.prefetchWorkers()
                : properties.pipeline().prefetchWorkers();
        int window = config.prefetchWindow() != null
                ? config.prefetchWindow()
                : properties.pipeline().prefetchWindow();

        ExecutorService workers = Executors.newFixedThreadPool(
                workerCount,
                new CustomizableThreadFactory("render-kit-decode-" + shortId(job.id()) + "-"));
        DecodeCache cache = decodeCacheFactory.create(imageReader);
        Compositor compositor = new Compositor(plan.layout(), textPainter);
        BurnInRenderer burnIn = new BurnInRenderer(
                textPainter,
                config.burnIn(),
                plan.sequence().pattern().width(),
                plan.layerLabel(),
                plan.frameRate());
        FrameLoader loader = frame -> loadLayers(plan, cache, frame);

        EncoderSession session = null;
        boolean failed = false;
        try (PrefetchScheduler scheduler = new PrefetchScheduler(
                plan.sequence().frames(),
                loader,
                workers,
                window,
                properties.pipeline().decodeTimeout())) {
            EncoderHeader header = null;
            while (scheduler.hasNext()) {
                if (job.isCancelRequested()) {
                    scheduler.cancel();
                    return cancel(job, session, stagingPath, config);
                }

                LoadedFrame loaded = scheduler.next();
                int frame = loaded.frameIndex();
                job.setCurrentFrame(frame);

                DecodedBuffer output = renderFrame(plan, compositor, burnIn, loaded);
                if (session == null) {
                    header = new EncoderHeader(
                            output.width(),
                            output.height(),
                            plan.frameRate(),
                            EncoderHeader.RGB24,
                            plan.encoder(),
                            plan.quality(),
                            config.bitrateKbps());
                    session = encoderBridge.open(header, stagingPath);
                }
                DecodedBuffer encoded = fitToHeader(frame, output, header);
                writeFrame(session, frame, encoded);
                framesEncodedCounter.increment();

                int completed = job.incrementCompleted();
                logger.debug("Job {} encoded frame {} ({}/{})", job.id(), frame, completed, plan.totalFrames());
                notifyProgress(listener, completed, plan.totalFrames());
            }

            session.finish();
            moveIntoPlace(stagingPath, outputPath, config.overwritePolicy());
            return ConversionResult.completed(outputPath);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Conversion job {} was interrupted", job.id());
            return cancel(job, session, stagingPath, config);
        } catch (ConversionCancelledException e) {
            logger.warn("Conversion job {} was cancelled while waiting for frame data", job.id());
            return cancel(job, session, stagingPath, config);
        } catch (ConversionException e) {
            failed = true;
            return fail(job, session, stagingPath, e);
        } catch (RuntimeException e) {
            failed = true;
            int frame = job.currentFrame() == null ? plan.sequence().frames().get(0) : job.currentFrame();
            return fail(job, session, stagingPath, new FrameProcessingException(frame, "conversion", e));
        } finally {
            // decodes already started on cancel run to completion and are discarded
            if (failed) {
                workers.shutdownNow();
            } else {
                workers.shutdown();
            }
            cache.clear();
        }
    }

    private List<LayerBuffer> loadLayers(ConversionPlan plan, DecodeCache cache, int frame) throws InterruptedException {
        Path path = plan.sequence().pathFor(frame);
        List<LayerBuffer> layers = new ArrayList<>(plan.layers().size());
        for (String layer : plan.layers()) {
            layers.add(new LayerBuffer(layer, cache.fetch(new CacheKey(path, layer))));
        }
        return layers;
    }

    private DecodedBuffer renderFrame(
            ConversionPlan plan,
            Compositor compositor,
            BurnInRenderer burnIn,
            LoadedFrame loaded) {
        int frame = loaded.frameIndex();
        List<LayerBuffer> transformed = stage(frame, "color transform", () -> {
            List<LayerBuffer> result = new ArrayList<>(loaded.layers().size());
            for (LayerBuffer layer : loaded.layers()) {
                result.add(layer.withBuffer(colorTransformEngine.apply(plan.transform(), layer.buffer())));
            }
            return result;
        });

        DecodedBuffer composed = stage(frame, "composite", () -> compositor.composite(frame, transformed));

        OutputResolution resolution = plan.config().outputResolution();
        DecodedBuffer scaled = resolution == null
                ? composed
                : stage(frame, "scale", () -> FrameScaler.resize(composed, resolution.width(), resolution.height()));

        return burnIn.enabled() ? stage(frame, "burn-in", () -> burnIn.apply(frame, scaled)) : scaled;
    }

    private DecodedBuffer fitToHeader(int frame, DecodedBuffer output, EncoderHeader header) {
        if (output.width() == header.width() && output.height() == header.height()) {
            return output;
        }
        logger.warn(
                "Frame {} is {}x{} but the stream is {}x{}; resizing",
                frame,
                output.width(),
                output.height(),
                header.width(),
                header.height());
        return stage(frame, "scale", () -> FrameScaler.resize(output, header.width(), header.height()));
    }

    private void writeFrame(EncoderSession session, int frame, DecodedBuffer buffer) {
        try {
            session.writeFrame(buffer);
        } catch (ConversionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FrameProcessingException(frame, "encode", e);
        }
    }

    private <T> T stage(int frame, String stage, Supplier<T> work) {
        try {
            return work.get();
        } catch (ConversionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FrameProcessingException(frame, stage, e);
        }
    }

    private ConversionResult cancel(
            ConversionJob job,
            EncoderSession session,
            Path stagingPath,
            ConversionConfig config) {
        logger.info("Cancelling conversion job {} after {} frame(s)", job.id(), job.completedFrames());
        if (session == null) {
            return ConversionResult.cancelled(null);
        }

        boolean interrupted = Thread.interrupted();
        try {
            session.finish();
            if (config.cancelledOutputPolicy() == CancelledOutputPolicy.KEEP_PARTIAL) {
                moveIntoPlace(stagingPath, config.outputPath(), config.overwritePolicy());
                return ConversionResult.cancelled(config.outputPath());
            }
            deleteStagingFile(stagingPath);
            return ConversionResult.cancelled(null);
        } catch (ConversionException e) {
            logger.warn("Could not finalize partial output of cancelled job {}: {}", job.id(), e.getMessage());
            deleteStagingFile(stagingPath);
            return ConversionResult.cancelled(null);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private ConversionResult fail(ConversionJob job, EncoderSession session, Path stagingPath, ConversionException error) {
        ConversionException firstError = job.recordError(error);
        logger.error("Conversion job {} failed", job.id(), firstError);
        if (session != null) {
            session.abort();
        }
        deleteStagingFile(stagingPath);
        return ConversionResult.failed(firstError);
    }

    private void checkOutput(ConversionConfig config) {
        Path outputPath = config.outputPath();
        if (Files.exists(outputPath) && config.overwritePolicy() == OverwritePolicy.REFUSE) {
            throw new OutputExistsException(outputPath);
        }
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            throw new ConfigurationException("Output directory does not exist: " + parent);
        }
    }

    private double resolveFrameRate(ConversionConfig config, ImageMetadata metadata) {
        if (config.frameRate() != null) {
            return config.frameRate();
        }
        return metadata.frameRate()
                .map(fps -> {
                    logger.info("Using frame rate {} from first frame metadata", fps);
                    return fps;
                })
                .orElseThrow(() -> new ConfigurationException(
                        "Frame rate was not given and could not be detected from the first frame's metadata."));
    }

    private List<String> resolveLayers(ConversionConfig config, Path firstFrame) {
        if (!config.contactSheetMode() || !config.layers().isDefault()) {
            return config.layers().effectiveLayers();
        }
        List<String> discovered = imageReader.listLayers(firstFrame);
        if (discovered.isEmpty()) {
            logger.info("No named layers in {}; contact sheet uses the default layer", firstFrame);
            return List.of("");
        }
        logger.info("Discovered {} layer(s) in {}: {}", discovered.size(), firstFrame, discovered);
        return discovered;
    }

    static Path stagingPathFor(Path outputPath) {
        Path absolute = outputPath.toAbsolutePath();
        String fileName = absolute.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        String token = UUID.randomUUID().toString().substring(0, 8);
        return absolute.resolveSibling("." + base + ".partial-" + token + extension);
    }

    /**
     * Under {@link OverwritePolicy#REFUSE} a file that appeared at the target after {@code prepare} is kept and the
     * job fails with {@link OutputExistsException}.
     */
    private void moveIntoPlace(Path stagingPath, Path outputPath, OverwritePolicy overwritePolicy) {
        if (overwritePolicy == OverwritePolicy.REFUSE) {
            try {
                Files.move(stagingPath, outputPath);
            } catch (FileAlreadyExistsException e) {
                throw new OutputExistsException(outputPath);
            } catch (IOException e) {
                throw new EncoderStreamException("Failed to move finished video into place at " + outputPath, e);
            }
            return;
        }
        try {
            try {
                Files.move(stagingPath, outputPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(stagingPath, outputPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new EncoderStreamException("Failed to move finished video into place at " + outputPath, e);
        }
    }

    private void deleteStagingFile(Path stagingPath) {
        try {
            Files.deleteIfExists(stagingPath);
        } catch (IOException e) {
            logger.warn("Could not delete staging file {}: {}", stagingPath, e.getMessage());
        }
    }

    private void notifyProgress(ConversionListener listener, int completed, int total) {
        try {
            listener.onProgress(completed, total);
        } catch (RuntimeException e) {
            logger.warn("Conversion listener failed on progress {}/{}", completed, total, e);
        }
    }

    private void notifyFinished(ConversionListener listener, ConversionResult result) {
        try {
            listener.onFinished(result);
        } catch (RuntimeException e) {
            logger.warn("Conversion listener failed on completion", e);
        }
    }

    private static String shortId(String jobId) {
        return jobId.length() > 8 ? jobId.substring(0, 8) : jobId;
    }
}
