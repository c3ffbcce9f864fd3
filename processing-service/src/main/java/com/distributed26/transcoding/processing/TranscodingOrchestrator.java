package com.distributed26.transcoding.processing;

import com.distributed26.transcoding.processing.encoder.EncodeException;
import com.distributed26.transcoding.processing.encoder.EncodeListener;
import com.distributed26.transcoding.processing.encoder.EncodeRequest;
import com.distributed26.transcoding.processing.encoder.VideoEncoder;
import com.distributed26.transcoding.shared.jobs.Resolution;
import com.distributed26.transcoding.shared.jobs.TranscodeJob;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns one {@link TranscodeJob} into an HLS package: one encode per requested resolution, run
 * concurrently on the encode pool, then a master playlist over all of them.
 *
 * <p>Output layout under {@code outputRoot}:
 * <pre>
 *   {jobId}/master.m3u8
 *   {jobId}/{height}p/index.m3u8
 *   {jobId}/{height}p/segment_000.ts ...
 * </pre>
 *
 * <p>The job succeeds only if every encode does. After the first failure no further encode is
 * started, but encodes already running are waited for, so a returned call never leaves work
 * behind. Partial output of a failed job is left on disk.
 */
public class TranscodingOrchestrator {
    private static final Logger LOGGER = LogManager.getLogger(TranscodingOrchestrator.class);

    private final VideoEncoder encoder;
    private final StatusReporter reporter;
    private final ExecutorService encodePool;
    private final Path uploadDir;
    private final Path outputRoot;
    private final Supplier<String> jobIdGenerator;

    public TranscodingOrchestrator(VideoEncoder encoder, StatusReporter reporter, ExecutorService encodePool,
                                   Path uploadDir, Path outputRoot) {
        this(encoder, reporter, encodePool, uploadDir, outputRoot, () -> UUID.randomUUID().toString());
    }

    TranscodingOrchestrator(VideoEncoder encoder, StatusReporter reporter, ExecutorService encodePool,
                            Path uploadDir, Path outputRoot, Supplier<String> jobIdGenerator) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.encodePool = Objects.requireNonNull(encodePool, "encodePool");
        this.uploadDir = Objects.requireNonNull(uploadDir, "uploadDir");
        this.outputRoot = Objects.requireNonNull(outputRoot, "outputRoot");
        this.jobIdGenerator = Objects.requireNonNull(jobIdGenerator, "jobIdGenerator");
    }

    /**
     * Runs the job to completion and returns the master playlist path.
     *
     * @throws TranscodingFailedException if any encode failed or the output could not be written;
     *         the task has been reported as errored by then
     */
    public Path transcode(TranscodeJob job) throws TranscodingFailedException {
        long taskId = job.getQueuedTaskId();
        JobRun run = new JobRun(taskId);

        Path input = resolveInput(job.getInputPath());
        if (!Files.isRegularFile(input)) {
            throw run.fail("Input file not found: " + input, null);
        }

        Path jobDir = outputRoot.resolve(jobIdGenerator.get());
        try {
            Files.createDirectories(jobDir);
        } catch (IOException e) {
            throw run.fail("Cannot create output directory " + jobDir + ": " + e.getMessage(), e);
        }
        LOGGER.info("Transcoding task={} input={} into {} ({} variant(s), hint={})",
                taskId, input, jobDir, job.getResolutions().size(), job.getOutputPath());

        List<CompletableFuture<VariantPlaylist>> encodes = new ArrayList<>();
        for (Resolution resolution : job.getResolutions()) {
            encodes.add(CompletableFuture.supplyAsync(() -> encodeVariant(run, input, jobDir, resolution), encodePool));
        }

        // allOf settles only once every encode has finished or been skipped.
        try {
            CompletableFuture.allOf(encodes.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            LOGGER.debug("At least one encode failed for task {}", taskId, e);
        }
        if (run.isFailed()) {
            throw new TranscodingFailedException(taskId, run.getFailureMessage(), run.getFailureCause());
        }

        List<VariantPlaylist> variants = new ArrayList<>(encodes.size());
        for (CompletableFuture<VariantPlaylist> encode : encodes) {
            variants.add(encode.join());
        }

        Path manifest;
        try {
            manifest = MasterPlaylistWriter.write(jobDir, variants);
        } catch (IOException e) {
            throw run.fail("Cannot write master playlist in " + jobDir + ": " + e.getMessage(), e);
        }
        LOGGER.info("Master playlist written for task={}: {}", taskId, manifest);

        reporter.videoCreated(taskId, manifest.toAbsolutePath().toString());
        reporter.completed(taskId);
        return manifest;
    }

    private VariantPlaylist encodeVariant(JobRun run, Path input, Path jobDir, Resolution resolution) {
        String label = resolution.label();
        if (run.isFailed()) {
            throw new CompletionException(new EncodeException("Skipped " + label + ": a sibling encode already failed"));
        }
        Path variantDir = jobDir.resolve(label);
        try {
            Files.createDirectories(variantDir);
            encoder.encode(new EncodeRequest(input, variantDir, resolution), new EncodeListener() {
                @Override
                public void onStart(String commandLine) {
                    LOGGER.info("Encoder started for task={} {}: {}", run.taskId, label, commandLine);
                    run.started();
                }

                @Override
                public void onProgress(double percent) {
                    LOGGER.debug("task={} {}: {}%", run.taskId, label, String.format("%.2f", percent));
                }
            });
        } catch (EncodeException | IOException | RuntimeException e) {
            LOGGER.error("Encode failed for task={} {}: {}", run.taskId, label, e.getMessage());
            run.fail(e.getMessage(), e);
            throw new CompletionException(e);
        }
        LOGGER.info("{} HLS stream complete for task={}", label, run.taskId);
        return VariantPlaylist.of(resolution, EncodeRequest.PLAYLIST_NAME);
    }

    private Path resolveInput(String inputPath) {
        Path path = Path.of(inputPath);
        return path.isAbsolute() ? path : uploadDir.resolve(path);
    }

    /**
     * Status of one job invocation, shared by its encodes. Reports go out under this object's lock
     * so that "Processing" can never be recorded after "Error".
     */
    private final class JobRun {
        private final long taskId;
        private boolean processingReported;
        private boolean failed;
        private String failureMessage;
        private Throwable failureCause;

        JobRun(long taskId) {
            this.taskId = taskId;
        }

        synchronized void started() {
            if (!failed && !processingReported) {
                processingReported = true;
                reporter.processing(taskId);
            }
        }

        /** Records the first failure and reports it; later failures are only logged by their caller. */
        synchronized TranscodingFailedException fail(String message, Throwable cause) {
            if (!failed) {
                failed = true;
                failureMessage = message;
                failureCause = cause;
                reporter.failed(taskId, message);
            }
            return new TranscodingFailedException(taskId, failureMessage, failureCause);
        }

        synchronized boolean isFailed() {
            return failed;
        }

        synchronized String getFailureMessage() {
            return failureMessage;
        }

        synchronized Throwable getFailureCause() {
            return failureCause;
        }
    }
}
