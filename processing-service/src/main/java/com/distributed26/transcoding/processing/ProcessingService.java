package com.distributed26.transcoding.processing;

import com.distributed26.transcoding.processing.encoder.VideoEncoder;
import com.distributed26.transcoding.shared.config.PipelineConfig;
import com.distributed26.transcoding.shared.jobs.Worker;
import com.distributed26.transcoding.shared.queue.JobQueue;
import com.distributed26.transcoding.shared.registry.TaskRegistry;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The scheduler and/or the consumer, wired to one queue and one registry. Which of the two run
 * is decided by {@link PipelineConfig.ServiceMode}; they only meet through the queue.
 */
public class ProcessingService implements AutoCloseable {
    private static final Logger LOGGER = LogManager.getLogger(ProcessingService.class);

    private final PipelineConfig config;
    private final JobQueue queue;
    private final PendingTaskScheduler scheduler;
    private final TranscodeJobConsumer consumer;
    private final ExecutorService encodePool;

    private ProcessingService(PipelineConfig config, JobQueue queue, PendingTaskScheduler scheduler,
                              TranscodeJobConsumer consumer, ExecutorService encodePool) {
        this.config = config;
        this.queue = queue;
        this.scheduler = scheduler;
        this.consumer = consumer;
        this.encodePool = encodePool;
    }

    /**
     * @param encoder required when the mode runs the consumer, ignored otherwise
     */
    public static ProcessingService create(PipelineConfig config, JobQueue queue, TaskRegistry registry,
                                           VideoEncoder encoder, Clock clock) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(queue, "queue");
        StatusReporter reporter = new StatusReporter(registry, clock);
        PipelineConfig.ServiceMode mode = config.getServiceMode();

        PendingTaskScheduler scheduler = null;
        if (mode.runsScheduler()) {
            scheduler = new PendingTaskScheduler(queue, config.getQueueName(), config.getMaxQueueCapacity(),
                    registry, reporter, new TranscodeJobFactory(clock), clock);
        }

        TranscodeJobConsumer consumer = null;
        ExecutorService encodePool = null;
        if (mode.runsConsumer()) {
            Objects.requireNonNull(encoder, "encoder is required when the consumer runs");
            encodePool = newEncodePool(config.getEncodeParallelism());
            TranscodingOrchestrator orchestrator = new TranscodingOrchestrator(encoder, reporter, encodePool,
                    config.getUploadDir(), config.getOutputDir());
            consumer = new TranscodeJobConsumer("consumer-0", queue, config.getQueueName(), orchestrator, reporter);
        }
        return new ProcessingService(config, queue, scheduler, consumer, encodePool);
    }

    public void start() {
        if (consumer != null) {
            consumer.start();
        }
        if (scheduler != null) {
            scheduler.start(config.getSchedulerInterval());
        }
        LOGGER.info("Processing service running in {} mode", config.getServiceMode());
    }

    public void stop() {
        if (scheduler != null) {
            scheduler.stop();
        }
        if (consumer != null) {
            consumer.stop();
        }
        if (encodePool != null) {
            encodePool.shutdown();
            try {
                if (!encodePool.awaitTermination(30, TimeUnit.SECONDS)) {
                    LOGGER.warn("Encodes still running at shutdown; abandoning them");
                    encodePool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                encodePool.shutdownNow();
            }
        }
        queue.close();
    }

    @Override
    public void close() {
        stop();
    }

    public PendingTaskScheduler getScheduler() {
        return scheduler;
    }

    public TranscodeJobConsumer getConsumer() {
        return consumer;
    }

    /** Snapshot for the status endpoint. */
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("mode", config.getServiceMode().name().toLowerCase(Locale.ROOT));
        status.put("queue", config.getQueueName());
        status.put("maxQueueCapacity", config.getMaxQueueCapacity());
        try {
            status.put("queueDepth", queue.depth(config.getQueueName()));
        } catch (RuntimeException e) {
            status.put("queueDepth", null);
            status.put("queueError", e.getMessage());
        }
        if (consumer != null) {
            Worker w = consumer.getWorker();
            Map<String, Object> worker = new LinkedHashMap<>();
            worker.put("id", w.getId());
            worker.put("status", w.getStatus().name());
            worker.put("currentTaskId", w.getCurrentTaskId());
            worker.put("completedJobs", w.getCompletedJobs());
            worker.put("failedJobs", w.getFailedJobs());
            worker.put("lastHeartbeatAt", w.getLastHeartbeatAt().toString());
            status.put("consumer", worker);
        }
        if (scheduler != null) {
            SchedulerCycleResult last = scheduler.getLastResult();
            status.put("lastCycle", last == null ? null : last.toMap());
        }
        return status;
    }

    private static ExecutorService newEncodePool(int size) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "encode-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }
}
