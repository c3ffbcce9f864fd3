package com.distributed26.transcoding.processing;

import com.distributed26.transcoding.shared.jobs.InvalidJobException;
import com.distributed26.transcoding.shared.jobs.JobMessageCodec;
import com.distributed26.transcoding.shared.jobs.TranscodeJob;
import com.distributed26.transcoding.shared.jobs.Worker;
import com.distributed26.transcoding.shared.jobs.WorkerStatus;
import com.distributed26.transcoding.shared.queue.JobQueue;
import com.distributed26.transcoding.shared.queue.QueueDelivery;
import java.time.Instant;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Takes jobs off the work queue one at a time and runs them through the orchestrator.
 *
 * <p>The subscription uses prefetch 1 and the orchestrator runs on the delivery thread, so the
 * next job is not delivered until this one is settled. Success acks; any failure rejects without
 * requeue, because a half-run transcode has already touched files and the registry.
 */
public class TranscodeJobConsumer implements AutoCloseable {
    private static final Logger LOGGER = LogManager.getLogger(TranscodeJobConsumer.class);

    static final int PREFETCH = 1;

    private final JobQueue queue;
    private final String queueName;
    private final TranscodingOrchestrator orchestrator;
    private final StatusReporter reporter;
    private final Worker worker;
    private String consumerTag;

    public TranscodeJobConsumer(String id, JobQueue queue, String queueName,
                                TranscodingOrchestrator orchestrator, StatusReporter reporter) {
        this.worker = new Worker(id, Instant.now());
        this.queue = Objects.requireNonNull(queue, "queue");
        this.queueName = Objects.requireNonNull(queueName, "queueName");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public Worker getWorker() {
        return worker;
    }

    public synchronized void start() {
        if (consumerTag != null) {
            throw new IllegalStateException("Consumer " + worker.getId() + " already started");
        }
        consumerTag = queue.consume(queueName, PREFETCH, this::onDelivery);
        worker.setStatus(WorkerStatus.IDLE);
        LOGGER.info("Consumer {} subscribed to {}", worker.getId(), queueName);
    }

    public synchronized void stop() {
        if (consumerTag != null) {
            try {
                queue.cancel(consumerTag);
            } catch (RuntimeException e) {
                LOGGER.warn("Could not cancel consumer {}: {}", consumerTag, e.getMessage());
            }
            consumerTag = null;
        }
        worker.setStatus(WorkerStatus.OFFLINE);
        LOGGER.info("Consumer stopped: {}", worker.getId());
    }

    @Override
    public void close() {
        stop();
    }

    void onDelivery(QueueDelivery delivery) {
        TranscodeJob job;
        try {
            job = JobMessageCodec.decode(delivery.body());
        } catch (InvalidJobException e) {
            LOGGER.error("Rejecting undeliverable job message: {}", e.getMessage());
            if (e.getQueuedTaskId() != null) {
                reporter.rejected(e.getQueuedTaskId(), e.getMessage());
            }
            delivery.reject(false);
            worker.finishJob(false);
            return;
        }

        worker.startJob(job.getQueuedTaskId());
        LOGGER.info("Consumer {} picked up {}", worker.getId(), job);
        boolean succeeded = false;
        try {
            orchestrator.transcode(job);
            succeeded = true;
        } catch (TranscodingFailedException e) {
            LOGGER.error("Task {} failed: {}", e.getQueuedTaskId(), e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("Task {} failed unexpectedly", job.getQueuedTaskId(), e);
            reporter.failed(job.getQueuedTaskId(), e.toString());
        }

        if (succeeded) {
            delivery.ack();
            LOGGER.info("Task {} completed; message acknowledged", job.getQueuedTaskId());
        } else {
            delivery.reject(false);
            LOGGER.info("Task {} message rejected without requeue", job.getQueuedTaskId());
        }
        worker.finishJob(succeeded);
    }
}
