package github.sarthakdev143.render_kit.integration.video;

import github.sarthakdev143.render_kit.exception.EncoderStreamException;
import github.sarthakdev143.render_kit.model.DecodedBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

class FfmpegEncoderSession implements EncoderSession {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegEncoderSession.class);
    private static final int OUTPUT_TAIL_LINES = 40;
    private static final long ABORT_WAIT_SECONDS = 5;

    private final Process process;
    private final EncoderHeader header;
    private final Path outputPath;
    private final Duration finishTimeout;
    private final OutputStream stdin;
    private final Deque<String> outputTail = new ArrayDeque<>();
    private final Thread outputDrainer;
    private final byte[] frameBytes;
    private boolean closed;

    FfmpegEncoderSession(Process process, EncoderHeader header, Path outputPath, Duration finishTimeout) {
        this.process = process;
        this.header = header;
        this.outputPath = outputPath;
        this.finishTimeout = finishTimeout;
        this.stdin = new BufferedOutputStream(process.getOutputStream(), 1 << 16);
        this.frameBytes = new byte[header.width() * header.height() * 3];
        this.outputDrainer = new Thread(this::drainOutput, "ffmpeg-output-" + outputPath.getFileName());
        this.outputDrainer.setDaemon(true);
        this.outputDrainer.start();
    }

    @Override
    public void writeFrame(DecodedBuffer frame) {
        if (closed) {
            throw new EncoderStreamException("Encoder stream for " + outputPath + " is already closed.");
        }
        if (frame.width() != header.width() || frame.height() != header.height()) {
            throw new EncoderStreamException(
                    "Frame size " + frame.width() + "x" + frame.height()
                            + " does not match encoder header " + header.width() + "x" + header.height() + ".");
        }
        if (!process.isAlive()) {
            throw new EncoderStreamException(
                    "FFmpeg exited early with code " + process.exitValue() + ". Output: " + outputTail());
        }

        toRgb24(frame, frameBytes);
        try {
            stdin.write(frameBytes);
        } catch (IOException e) {
            throw new EncoderStreamException("Failed to write frame to FFmpeg. Output: " + outputTail(), e);
        }
    }

    @Override
    public void finish() {
        if (closed) {
            return;
        }
        closed = true;

        try {
            stdin.close();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new EncoderStreamException("Failed to close FFmpeg input. Output: " + outputTail(), e);
        }

        try {
            boolean finished = process.waitFor(finishTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new EncoderStreamException("FFmpeg timed out finalizing " + outputPath + ".");
            }
            outputDrainer.join(TimeUnit.SECONDS.toMillis(ABORT_WAIT_SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new EncoderStreamException("Interrupted while FFmpeg was finalizing " + outputPath + ".", e);
        }

        if (process.exitValue() != 0) {
            throw new EncoderStreamException(
                    "FFmpeg failed with exit code " + process.exitValue() + ". Output: " + outputTail());
        }
        logger.debug("FFmpeg finalized {}", outputPath);
    }

    @Override
    public void abort() {
        if (closed) {
            return;
        }
        closed = true;

        try {
            stdin.close();
        } catch (IOException e) {
            logger.debug("Ignoring FFmpeg stdin close failure during abort: {}", e.getMessage());
        }
        process.destroyForcibly();
        try {
            process.waitFor(ABORT_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Aborted FFmpeg encoder for {}", outputPath);
    }

    /**
     * Packs normalized samples as 8-bit RGB. Gray is replicated and alpha dropped.
     */
    static void toRgb24(DecodedBuffer frame, byte[] target) {
        int channels = frame.channels();
        int colorChannels = frame.colorChannels();
        int pixels = frame.width() * frame.height();
        for (int pixel = 0; pixel < pixels; pixel++) {
            int source = pixel * channels;
            int destination = pixel * 3;
            for (int c = 0; c < 3; c++) {
                float value = frame.sampleAt(source + (colorChannels >= 3 ? c : 0));
                target[destination + c] = (byte) toByte(value);
            }
        }
    }

    private static int toByte(float value) {
        if (Float.isNaN(value) || value <= 0.0f) {
            return 0;
        }
        if (value >= 1.0f) {
            return 255;
        }
        return Math.round(value * 255.0f);
    }

    private void drainOutput() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logger.debug("ffmpeg: {}", line);
                synchronized (outputTail) {
                    if (outputTail.size() == OUTPUT_TAIL_LINES) {
                        outputTail.removeFirst();
                    }
                    outputTail.addLast(line);
                }
            }
        } catch (IOException e) {
            logger.debug("FFmpeg output stream closed: {}", e.getMessage());
        }
    }

    private String outputTail() {
        synchronized (outputTail) {
            return String.join(System.lineSeparator(), outputTail);
        }
    }
}
