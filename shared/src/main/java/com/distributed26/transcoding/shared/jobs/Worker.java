package com.distributed26.transcoding.shared.jobs;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runtime view of one job consumer: what it is doing and how many jobs it has settled.
 */
public class Worker {
    private final String id;
    private volatile WorkerStatus status;
    private final Instant registeredAt;
    private volatile Instant lastHeartbeatAt;
    private volatile Long currentTaskId;
    private final AtomicLong completedJobs = new AtomicLong();
    private final AtomicLong failedJobs = new AtomicLong();

    public Worker(String id, Instant registeredAt) {
        this.id = Objects.requireNonNull(id, "id is null");
        this.registeredAt = Objects.requireNonNull(registeredAt, "registeredAt");

        this.status = WorkerStatus.IDLE;
        this.lastHeartbeatAt = registeredAt;
    }

    public String getId() {
        return id;
    }

    public WorkerStatus getStatus() {
        return status;
    }

    public void setStatus(WorkerStatus status) {
        this.status = Objects.requireNonNull(status, "status is null");
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public Instant getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public void heartbeat() {
        this.lastHeartbeatAt = Instant.now();
    }

    public Long getCurrentTaskId() {
        return currentTaskId;
    }

    public void startJob(long taskId) {
        this.currentTaskId = taskId;
        setStatus(WorkerStatus.BUSY);
        heartbeat();
    }

    public void finishJob(boolean succeeded) {
        if (succeeded) {
            completedJobs.incrementAndGet();
        } else {
            failedJobs.incrementAndGet();
        }
        this.currentTaskId = null;
        if (status == WorkerStatus.BUSY) {
            setStatus(WorkerStatus.IDLE);
        }
        heartbeat();
    }

    public long getCompletedJobs() {
        return completedJobs.get();
    }

    public long getFailedJobs() {
        return failedJobs.get();
    }
}
