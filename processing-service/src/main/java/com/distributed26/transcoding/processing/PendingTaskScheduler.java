package com.distributed26.transcoding.processing;

import com.distributed26.transcoding.shared.jobs.JobMessageCodec;
import com.distributed26.transcoding.shared.jobs.TranscodeJob;
import com.distributed26.transcoding.shared.queue.JobQueue;
import com.distributed26.transcoding.shared.registry.PendingTask;
import com.distributed26.transcoding.shared.registry.TaskRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Periodically moves pending registry tasks onto the work queue, never more than the queue has
 * room for.
 *
 * <p>Each cycle reads the queue depth, asks the registry for at most
 * {@code maxQueueCapacity - depth} pending tasks and publishes one job per task. A full queue ends
 * the cycle before the registry is contacted. Cycles run on one thread with a fixed delay and
 * never overlap.
 */
public class PendingTaskScheduler implements AutoCloseable {
    private static final Logger LOGGER = LogManager.getLogger(PendingTaskScheduler.class);

    private final JobQueue queue;
    private final String queueName;
    private final int maxQueueCapacity;
    private final TaskRegistry registry;
    private final StatusReporter reporter;
    private final TranscodeJobFactory jobFactory;
    private final Clock clock;
    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private volatile SchedulerCycleResult lastResult;
    private ScheduledExecutorService executor;

    public PendingTaskScheduler(JobQueue queue, String queueName, int maxQueueCapacity, TaskRegistry registry,
                                StatusReporter reporter, TranscodeJobFactory jobFactory, Clock clock) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.queueName = Objects.requireNonNull(queueName, "queueName");
        if (maxQueueCapacity <= 0) throw new IllegalArgumentException("maxQueueCapacity must be > 0");
        this.maxQueueCapacity = maxQueueCapacity;
        this.registry = Objects.requireNonNull(registry, "registry");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.jobFactory = Objects.requireNonNull(jobFactory, "jobFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void start(Duration interval) {
        if (executor != null) {
            throw new IllegalStateException("Scheduler already started");
        }
        long millis = interval.toMillis();
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "PendingTaskScheduler");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::runCycle, millis, millis, TimeUnit.MILLISECONDS);
        LOGGER.info("Pending-task scheduler started: every {} ms, queue={}, capacity={}",
                millis, queueName, maxQueueCapacity);
    }

    public synchronized void stop() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
            LOGGER.info("Pending-task scheduler stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }

    public SchedulerCycleResult getLastResult() {
        return lastResult;
    }

    /**
     * Runs one admission cycle on the calling thread. Never throws; if another cycle is in
     * progress this returns at once with {@link SchedulerCycleResult.Outcome#SKIPPED_OVERLAP}.
     */
    public SchedulerCycleResult runCycle() {
        Instant startedAt = clock.instant();
        if (!cycleRunning.compareAndSet(false, true)) {
            LOGGER.warn("[Scheduler] Previous cycle still running. Skipping this tick.");
            return SchedulerCycleResult.overlapped(startedAt);
        }
        try {
            SchedulerCycleResult result = admit(startedAt);
            lastResult = result;
            return result;
        } finally {
            cycleRunning.set(false);
        }
    }

    private SchedulerCycleResult admit(Instant startedAt) {
        int depth = -1;
        int available = -1;
        List<PendingTask> pending;
        try {
            depth = queue.depth(queueName);
            available = maxQueueCapacity - depth;
            if (available <= 0) {
                LOGGER.info("[Scheduler] Queue is full ({}/{}). Skipping this cycle.", depth, maxQueueCapacity);
                return SchedulerCycleResult.queueFull(startedAt, depth, available);
            }
            pending = registry.fetchPending(available);
        } catch (RuntimeException e) {
            LOGGER.error("[Scheduler] Cycle aborted (depth={}, available={}): {}", depth, available, e.getMessage(), e);
            return SchedulerCycleResult.aborted(startedAt, depth, available, e.getMessage());
        }

        if (pending.isEmpty()) {
            LOGGER.info("[Scheduler] No pending tasks to process.");
            return new SchedulerCycleResult(SchedulerCycleResult.Outcome.NO_TASKS, startedAt, depth, available,
                    0, 0, 0, 0, null);
        }

        int published = 0;
        int failed = 0;
        int skipped = 0;
        for (PendingTask task : pending) {
            if (published + failed >= available) {
                // The registry returned more than it was asked for; the rest waits for a later cycle.
                skipped++;
                continue;
            }
            if (!task.isPending()) {
                LOGGER.warn("[Scheduler] Task {} is '{}', not pending. Not publishing.", task.getId(), task.getStatus());
                skipped++;
                continue;
            }
            if (dispatch(task)) {
                published++;
            } else {
                failed++;
            }
        }
        LOGGER.info("[Scheduler] Cycle done: depth={} available={} fetched={} published={} failed={} skipped={}",
                depth, available, pending.size(), published, failed, skipped);
        return new SchedulerCycleResult(SchedulerCycleResult.Outcome.DISPATCHED, startedAt, depth, available,
                pending.size(), published, failed, skipped, null);
    }

    /** Publishes one task's job. Failures stay with this task: reported as errored, never rethrown. */
    private boolean dispatch(PendingTask task) {
        long taskId = task.getId();
        try {
            TranscodeJob job = jobFactory.create(task);
            queue.publish(queueName, JobMessageCodec.encode(job));
            LOGGER.info("[Scheduler] Published job for task {} ({} resolution(s))", taskId, job.getResolutions().size());
        } catch (RuntimeException e) {
            LOGGER.error("[Scheduler] Could not publish task {}: {}", taskId, e.getMessage());
            reporter.rejected(taskId, e.getMessage());
            return false;
        }
        reporter.queued(taskId);
        return true;
    }
}
