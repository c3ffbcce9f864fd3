package com.distributed26.transcoding.processing.encoder;

import com.distributed26.transcoding.shared.jobs.Resolution;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import net.bramp.ffmpeg.FFmpeg;
import net.bramp.ffmpeg.FFmpegExecutor;
import net.bramp.ffmpeg.FFprobe;
import net.bramp.ffmpeg.builder.FFmpegBuilder;
import net.bramp.ffmpeg.job.FFmpegJob;
import net.bramp.ffmpeg.probe.FFmpegProbeResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link VideoEncoder} that shells out to FFmpeg: H.264/AAC, segmented VOD HLS output.
 */
public class FfmpegVideoEncoder implements VideoEncoder {
    private static final Logger LOGGER = LogManager.getLogger(FfmpegVideoEncoder.class);

    private final String ffmpegPath;
    private final OutputTailProcessFunction outputTail = new OutputTailProcessFunction();
    private final FFmpeg ffmpeg;
    private final FFprobe ffprobe;

    /**
     * Both binaries are checked ({@code -version}) here, so a missing FFmpeg fails at startup
     * rather than on the first job.
     */
    public FfmpegVideoEncoder(String ffmpegPath, String ffprobePath) throws IOException {
        this.ffmpegPath = Objects.requireNonNull(ffmpegPath, "ffmpegPath");
        this.ffmpeg = new FFmpeg(ffmpegPath, outputTail);
        this.ffprobe = new FFprobe(Objects.requireNonNull(ffprobePath, "ffprobePath"));
    }

    @Override
    public void encode(EncodeRequest request, EncodeListener listener) throws EncodeException {
        String label = request.getResolution().label();
        FFmpegBuilder builder = buildCommand(request);
        List<String> args = builder.build();
        long durationNs = probeDurationNs(request);

        listener.onStart(ffmpegPath + " " + String.join(" ", args));

        FFmpegJob job = new FFmpegExecutor(ffmpeg, ffprobe).createJob(builder, progress -> {
            if (durationNs > 0 && progress.out_time_ns > 0) {
                listener.onProgress(Math.min(100.0, progress.out_time_ns * 100.0 / durationNs));
            }
        });
        outputTail.reset();
        try {
            job.run();
        } catch (RuntimeException e) {
            throw new EncodeException("FFmpeg failed for " + label + ": " + diagnostic(e), e);
        }
        if (job.getState() != FFmpegJob.State.FINISHED) {
            throw new EncodeException("FFmpeg did not finish for " + label + " (state " + job.getState() + "): "
                    + String.join("\n", outputTail.lastOutput()));
        }
    }

    /** Command for one variant. Package-private so the argument list can be checked without a binary. */
    static FFmpegBuilder buildCommand(EncodeRequest request) {
        Resolution resolution = request.getResolution();
        return new FFmpegBuilder()
                .setInput(request.getInput().toString())
                .overrideOutputFiles(true)
                .addOutput(request.getPlaylist().toString())
                    .setFormat("hls")
                    .setVideoCodec("libx264")
                    .setAudioCodec("aac")
                    .setVideoResolution(resolution.getWidth(), resolution.getHeight())
                    .setVideoBitRate(resolution.bandwidth())
                    .setVideoFrameRate(resolution.getFps(), 1)
                    .addExtraArgs("-preset", "veryfast")
                    .addExtraArgs("-hls_time", String.valueOf(request.getSegmentSeconds()))
                    .addExtraArgs("-hls_playlist_type", "vod")
                    .addExtraArgs("-hls_segment_filename", request.getSegmentTemplate().toString())
                    .done();
    }

    /** Source duration for progress percentages; 0 when it cannot be read. */
    private long probeDurationNs(EncodeRequest request) {
        try {
            FFmpegProbeResult probe = ffprobe.probe(request.getInput().toString());
            double seconds = probe.getFormat().duration;
            return (long) (seconds * TimeUnit.SECONDS.toNanos(1));
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Could not probe {}; progress will not be reported: {}", request.getInput(), e.getMessage());
            return 0;
        }
    }

    /** The tail of FFmpeg's own output, or the innermost exception message when there is none. */
    private String diagnostic(Throwable t) {
        List<String> output = outputTail.lastOutput();
        if (!output.isEmpty()) {
            return String.join("\n", output);
        }
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
