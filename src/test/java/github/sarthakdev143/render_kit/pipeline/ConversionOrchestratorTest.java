package github.sarthakdev143.render_kit.pipeline;

import github.sarthakdev143.render_kit.config.RenderKitProperties;
import github.sarthakdev143.render_kit.exception.ConfigurationException;
import github.sarthakdev143.render_kit.exception.DecodeException;
import github.sarthakdev143.render_kit.exception.OutputExistsException;
import github.sarthakdev143.render_kit.factory.DecodeCacheFactory;
import github.sarthakdev143.render_kit.integration.color.BuiltInColorManagement;
import github.sarthakdev143.render_kit.integration.image.ImageMetadata;
import github.sarthakdev143.render_kit.integration.image.ImageReader;
import github.sarthakdev143.render_kit.integration.video.CodecQualityTable;
import github.sarthakdev143.render_kit.integration.video.EncoderBridge;
import github.sarthakdev143.render_kit.integration.video.EncoderHeader;
import github.sarthakdev143.render_kit.integration.video.EncoderSession;
import github.sarthakdev143.render_kit.model.BurnInOptions;
import github.sarthakdev143.render_kit.model.CancelledOutputPolicy;
import github.sarthakdev143.render_kit.model.ConversionConfig;
import github.sarthakdev143.render_kit.model.ConversionJob;
import github.sarthakdev143.render_kit.model.ConversionJobState;
import github.sarthakdev143.render_kit.model.ConversionResult;
import github.sarthakdev143.render_kit.model.DecodedBuffer;
import github.sarthakdev143.render_kit.service.ConversionListener;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversionOrchestratorTest {

    @TempDir
    Path tempDir;

    private Path framesDir;
    private Path outputDir;
    private FakeImageReader imageReader;
    private RecordingEncoderBridge encoderBridge;
    private SimpleMeterRegistry meterRegistry;
    private ConversionOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws IOException {
        framesDir = Files.createDirectories(tempDir.resolve("frames"));
        outputDir = Files.createDirectories(tempDir.resolve("out"));
        for (int frame = 1; frame <= 5; frame++) {
            Files.writeString(framesDir.resolve(String.format("shot.%04d.exr", frame)), "frame");
        }

        imageReader = new FakeImageReader();
        encoderBridge = new RecordingEncoderBridge();
        meterRegistry = new SimpleMeterRegistry();
        RenderKitProperties properties = new RenderKitProperties(
                new RenderKitProperties.Pipeline(2, 3, 32, DataSize.ofMegabytes(64), null),
                new RenderKitProperties.Encoder(null, Duration.ofMinutes(1), "error"),
                new RenderKitProperties.Preflight(false));
        DecodeCacheFactory cacheFactory = reader -> new DecodeCache(reader, 32, 1 << 20, meterRegistry);
        orchestrator = new ConversionOrchestrator(
                new SequenceResolver(),
                imageReader,
                new ColorTransformEngine(new BuiltInColorManagement()),
                encoderBridge,
                (raster, text, x, top, lineHeight, alignment) -> {
                },
                cacheFactory,
                properties,
                meterRegistry);
    }

    @Test
    void convertsEveryFrameAndReportsProgressInOrder() {
        ConversionConfig config = baseConfig().build();
        RecordingListener listener = new RecordingListener();
        ConversionJob job = new ConversionJob("job-complete", config);

        ConversionResult result = orchestrator.execute(orchestrator.prepare(config), job, listener);

        assertThat(result.outcome()).isEqualTo(ConversionResult.Outcome.COMPLETED);
        assertThat(result.outputPath()).isEqualTo(output());
        assertThat(job.state()).isEqualTo(ConversionJobState.COMPLETED);
        assertThat(listener.progress).containsExactly("1/5", "2/5", "3/5", "4/5", "5/5");
        assertThat(listener.finished).containsExactly(result);
        assertThat(Files.exists(output())).isTrue();
        assertThat(leftoverStagingFiles()).isEmpty();

        RecordingSession session = encoderBridge.session;
        assertThat(session.framesWritten).isEqualTo(5);
        assertThat(session.finished).isTrue();
        assertThat(session.aborted).isFalse();
        assertThat(encoderBridge.header.width()).isEqualTo(4);
        assertThat(encoderBridge.header.height()).isEqualTo(2);
        assertThat(encoderBridge.header.frameRate()).isEqualTo(24.0);
        assertThat(encoderBridge.header.codec()).isEqualTo(CodecQualityTable.LIBX264);
        assertThat(encoderBridge.header.quality().value()).isEqualTo("18");
        assertThat(meterRegistry.counter("render_kit.frames.encoded").count()).isEqualTo(5.0);
    }

    @Test
    void corruptFrameFailsTheJobAndDiscardsOutput() {
        imageReader.failOn(framesDir.resolve("shot.0003.exr"));
        ConversionConfig config = baseConfig().build();
        RecordingListener listener = new RecordingListener();
        ConversionJob job = new ConversionJob("job-corrupt", config);

        ConversionResult result = orchestrator.execute(orchestrator.prepare(config), job, listener);

        assertThat(result.outcome()).isEqualTo(ConversionResult.Outcome.FAILED);
        assertThat(result.error()).isInstanceOf(DecodeException.class);
        assertThat(((DecodeException) result.error()).frameIndex()).isEqualTo(3);
        assertThat(job.state()).isEqualTo(ConversionJobState.FAILED);
        assertThat(job.firstError()).isSameAs(result.error());
        assertThat(listener.progress).containsExactly("1/5", "2/5");
        assertThat(encoderBridge.session.finished).isFalse();
        assertThat(encoderBridge.session.aborted).isTrue();
        assertThat(Files.exists(output())).isFalse();
        assertThat(leftoverStagingFiles()).isEmpty();
    }

    @Test
    void cancelKeepsFinalizedPartialOutput() {
        ConversionConfig config = baseConfig().build();
        ConversionJob job = new ConversionJob("job-cancel", config);
        RecordingListener listener = new RecordingListener(job, 2);

        ConversionResult result = orchestrator.execute(orchestrator.prepare(config), job, listener);

        assertThat(result.outcome()).isEqualTo(ConversionResult.Outcome.CANCELLED);
        assertThat(result.outputPath()).isEqualTo(output());
        assertThat(job.state()).isEqualTo(ConversionJobState.CANCELLED);
        assertThat(listener.progress).containsExactly("1/5", "2/5");
        assertThat(encoderBridge.session.framesWritten).isEqualTo(2);
        assertThat(encoderBridge.session.finished).isTrue();
        assertThat(Files.exists(output())).isTrue();
    }

    @Test
    void cancelCanDiscardPartialOutput() {
        ConversionConfig config = baseConfig()
                .cancelledOutputPolicy(CancelledOutputPolicy.DELETE_PARTIAL)
                .build();
        ConversionJob job = new ConversionJob("job-cancel-delete", config);

        ConversionResult result = orchestrator.execute(orchestrator.prepare(config), job, new RecordingListener(job, 1));

        assertThat(result.outcome()).isEqualTo(ConversionResult.Outcome.CANCELLED);
        assertThat(result.outputPath()).isNull();
        assertThat(Files.exists(output())).isFalse();
        assertThat(leftoverStagingFiles()).isEmpty();
    }

    @Test
    void cancelBeforeFirstFrameOpensNoEncoder() {
        ConversionConfig config = baseConfig().build();
        ConversionJob job = new ConversionJob("job-cancel-early", config);
        job.requestCancel();

        ConversionResult result = orchestrator.execute(orchestrator.prepare(config), job, null);

        assertThat(result.outcome()).isEqualTo(ConversionResult.Outcome.CANCELLED);
        assertThat(result.outputPath()).isNull();
        assertThat(encoderBridge.session).isNull();
    }

    @Test
    void failingListenerDoesNotBreakTheJob() {
        ConversionConfig config = baseConfig().build();
        ConversionListener throwing = new ConversionListener() {
            @Override
            public void onProgress(int completed, int total) {
                throw new IllegalStateException("listener bug");
            }
        };

        ConversionResult result = orchestrator.execute(
                orchestrator.prepare(config), new ConversionJob("job-listener", config), throwing);

        assertThat(result.outcome()).isEqualTo(ConversionResult.Outcome.COMPLETED);
    }

    @Test
    void burnInIsAppliedBeforeEncoding() {
        ConversionConfig config = baseConfig()
                .burnIn(new BurnInOptions(true, false, false, 1.0))
                .build();

        orchestrator.execute(orchestrator.prepare(config), new ConversionJob("job-burn", config), null);

        // full opacity blackens the bar, which covers the whole 2 px frame
        assertThat(encoderBridge.session.maxSample).isZero();
    }

    @Test
    void prepareRefusesExistingOutputUnlessOverwriteIsSet() throws IOException {
        Files.writeString(output(), "previous");

        assertThatThrownBy(() -> orchestrator.prepare(baseConfig().build()))
                .isInstanceOf(OutputExistsException.class)
                .hasMessageContaining("already exists");
        assertThat(orchestrator.prepare(baseConfig().overwrite(true).build()).totalFrames()).isEqualTo(5);
    }

    @Test
    void outputWrittenByAnotherJobAfterPrepareIsNotReplaced() throws IOException {
        ConversionConfig config = baseConfig().build();
        ConversionPlan first = orchestrator.prepare(config);
        ConversionPlan second = orchestrator.prepare(config);

        ConversionResult firstResult = orchestrator.execute(first, new ConversionJob("job-first", config), null);
        Files.writeString(output(), "first job");
        ConversionJob secondJob = new ConversionJob("job-second", config);
        ConversionResult secondResult = orchestrator.execute(second, secondJob, null);

        assertThat(firstResult.outcome()).isEqualTo(ConversionResult.Outcome.COMPLETED);
        assertThat(secondResult.outcome()).isEqualTo(ConversionResult.Outcome.FAILED);
        assertThat(secondResult.error()).isInstanceOf(OutputExistsException.class);
        assertThat(secondJob.state()).isEqualTo(ConversionJobState.FAILED);
        assertThat(Files.readString(output())).isEqualTo("first job");
        assertThat(leftoverStagingFiles()).isEmpty();
    }

    @Test
    void overwriteReplacesOutputWrittenAfterPrepare() throws IOException {
        ConversionConfig config = baseConfig().overwrite(true).build();
        ConversionPlan plan = orchestrator.prepare(config);
        Files.writeString(output(), "previous");

        ConversionResult result = orchestrator.execute(plan, new ConversionJob("job-overwrite", config), null);

        assertThat(result.outcome()).isEqualTo(ConversionResult.Outcome.COMPLETED);
        assertThat(Files.readString(output())).isEqualTo("frames=5");
        assertThat(leftoverStagingFiles()).isEmpty();
    }

    @Test
    void keptPartialOutputDoesNotReplaceExistingFile() throws IOException {
        ConversionConfig config = baseConfig().build();
        ConversionPlan plan = orchestrator.prepare(config);
        Files.writeString(output(), "previous");
        ConversionJob job = new ConversionJob("job-cancel-existing", config);

        ConversionResult result = orchestrator.execute(plan, job, new RecordingListener(job, 2));

        assertThat(result.outcome()).isEqualTo(ConversionResult.Outcome.CANCELLED);
        assertThat(result.outputPath()).isNull();
        assertThat(Files.readString(output())).isEqualTo("previous");
        assertThat(leftoverStagingFiles()).isEmpty();
    }

    @Test
    void prepareRejectsMissingOutputDirectory() {
        ConversionConfig config = baseConfig().outputPath(tempDir.resolve("missing/out.mp4")).build();

        assertThatThrownBy(() -> orchestrator.prepare(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Output directory does not exist");
    }

    @Test
    void prepareUsesMetadataFrameRateOnlyWhenNoneIsConfigured() {
        imageReader.metadata = new ImageMetadata(29.97, null);

        assertThat(orchestrator.prepare(baseConfig().frameRate(null).build()).frameRate()).isEqualTo(29.97);
        assertThat(orchestrator.prepare(baseConfig().frameRate(12.0).build()).frameRate()).isEqualTo(12.0);
    }

    @Test
    void prepareFailsWithoutAnyFrameRate() {
        imageReader.metadata = ImageMetadata.empty();

        assertThatThrownBy(() -> orchestrator.prepare(baseConfig().frameRate(null).build()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Frame rate");
    }

    @Test
    void prepareUpgradesDefaultColorSpaceFromMetadata() {
        imageReader.metadata = new ImageMetadata(24.0, "ACEScg");

        ConversionPlan plan = orchestrator.prepare(baseConfig().build());

        assertThat(plan.transform().describe()).isEqualTo("ACEScg -> sRGB");
    }

    @Test
    void multipleLayersBuildAContactSheet() {
        ConversionConfig config = baseConfig().layers("R", "G").build();

        ConversionPlan plan = orchestrator.prepare(config);
        orchestrator.execute(plan, new ConversionJob("job-sheet", config), null);

        assertThat(plan.layers()).containsExactly("R", "G");
        assertThat(plan.layout()).isNotNull();
        assertThat(plan.layerLabel()).isEqualTo("R/G");
        // four columns of 4 px thumbnails with 4 px padding on both sides
        assertThat(encoderBridge.header.width()).isEqualTo(48);
        assertThat(imageReader.decodedLayers).contains("R", "G");
    }

    @Test
    void outputResolutionResizesFrames() {
        ConversionConfig config = baseConfig().resolution(8, 6).build();

        orchestrator.execute(orchestrator.prepare(config), new ConversionJob("job-scale", config), null);

        assertThat(encoderBridge.header.width()).isEqualTo(8);
        assertThat(encoderBridge.header.height()).isEqualTo(6);
    }

    @Test
    void stagingPathIsAHiddenSiblingWithTheSameExtension() {
        Path staging = ConversionOrchestrator.stagingPathFor(outputDir.resolve("movie.mp4"));

        assertThat(staging.getParent()).isEqualTo(outputDir.toAbsolutePath());
        assertThat(staging.getFileName().toString()).startsWith(".movie.partial-").endsWith(".mp4");
    }

    private ConversionConfig.Builder baseConfig() {
        return ConversionConfig.builder()
                .inputPattern(framesDir.resolve("shot.%04d.exr").toString())
                .outputPath(output())
                .frameRate(24.0);
    }

    private Path output() {
        return outputDir.resolve("out.mp4");
    }

    private List<Path> leftoverStagingFiles() {
        try (Stream<Path> files = Files.list(outputDir)) {
            return files.filter(path -> path.getFileName().toString().contains(".partial-")).toList();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static class FakeImageReader implements ImageReader {

        private final Map<Path, Boolean> failing = new ConcurrentHashMap<>();
        private final List<String> decodedLayers = Collections.synchronizedList(new ArrayList<>());
        private volatile ImageMetadata metadata = new ImageMetadata(24.0, null);

        void failOn(Path path) {
            failing.put(path.toAbsolutePath().normalize(), true);
        }

        @Override
        public DecodedBuffer decode(Path path, String layerName) {
            if (failing.containsKey(path)) {
                throw new DecodeException(path, layerName, "truncated scanline", null);
            }
            decodedLayers.add(layerName);
            float[] samples = new float[4 * 2 * 3];
            Arrays.fill(samples, 0.5f);
            return DecodedBuffer.rgb(4, 2, samples);
        }

        @Override
        public ImageMetadata readMetadata(Path path) {
            return metadata;
        }

        @Override
        public List<String> listLayers(Path path) {
            return List.of();
        }
    }

    private static class RecordingEncoderBridge implements EncoderBridge {

        private EncoderHeader header;
        private RecordingSession session;

        @Override
        public String probe(String codec) {
            return CodecQualityTable.normalizeCodec(codec);
        }

        @Override
        public EncoderSession open(EncoderHeader header, Path outputPath) {
            this.header = header;
            this.session = new RecordingSession(outputPath);
            return session;
        }
    }

    private static class RecordingSession implements EncoderSession {

        private final Path outputPath;
        private int framesWritten;
        private float maxSample;
        private boolean finished;
        private boolean aborted;

        RecordingSession(Path outputPath) {
            this.outputPath = outputPath;
            try {
                Files.writeString(outputPath, "");
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }

        @Override
        public void writeFrame(DecodedBuffer frame) {
            framesWritten++;
            for (int index = 0; index < frame.sampleCount(); index++) {
                maxSample = Math.max(maxSample, frame.sampleAt(index));
            }
        }

        @Override
        public void finish() {
            finished = true;
            try {
                Files.writeString(outputPath, "frames=" + framesWritten);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }

        @Override
        public void abort() {
            aborted = true;
        }
    }

    private static class RecordingListener implements ConversionListener {

        private final List<String> progress = new ArrayList<>();
        private final List<ConversionResult> finished = new ArrayList<>();
        private final ConversionJob cancelTarget;
        private final int cancelAfter;

        RecordingListener() {
            this(null, -1);
        }

        RecordingListener(ConversionJob cancelTarget, int cancelAfter) {
            this.cancelTarget = cancelTarget;
            this.cancelAfter = cancelAfter;
        }

        @Override
        public void onProgress(int completed, int total) {
            progress.add(completed + "/" + total);
            if (cancelTarget != null && completed == cancelAfter) {
                cancelTarget.requestCancel();
            }
        }

        @Override
        public void onFinished(ConversionResult result) {
            finished.add(result);
        }
    }
}
