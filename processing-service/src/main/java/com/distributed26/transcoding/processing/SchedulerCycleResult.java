package com.distributed26.transcoding.processing;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What one scheduler cycle saw and did.
 */
public class SchedulerCycleResult {

    public enum Outcome {
        /** No capacity left in the work queue; the registry was not asked. */
        QUEUE_FULL,
        /** Capacity was available but the registry had nothing pending. */
        NO_TASKS,
        /** Pending tasks were fetched and each was published or reported as failed. */
        DISPATCHED,
        /** Reading the queue depth or fetching the pending list failed. */
        ABORTED,
        /** A previous cycle was still running. */
        SKIPPED_OVERLAP
    }

    private final Outcome outcome;
    private final Instant startedAt;
    private final int depth;
    private final int available;
    private final int fetched;
    private final int published;
    private final int failed;
    private final int skipped;
    private final String error;

    SchedulerCycleResult(Outcome outcome, Instant startedAt, int depth, int available,
                         int fetched, int published, int failed, int skipped, String error) {
        this.outcome = outcome;
        this.startedAt = startedAt;
        this.depth = depth;
        this.available = available;
        this.fetched = fetched;
        this.published = published;
        this.failed = failed;
        this.skipped = skipped;
        this.error = error;
    }

    static SchedulerCycleResult queueFull(Instant startedAt, int depth, int available) {
        return new SchedulerCycleResult(Outcome.QUEUE_FULL, startedAt, depth, available, 0, 0, 0, 0, null);
    }

    static SchedulerCycleResult aborted(Instant startedAt, int depth, int available, String error) {
        return new SchedulerCycleResult(Outcome.ABORTED, startedAt, depth, available, 0, 0, 0, 0, error);
    }

    static SchedulerCycleResult overlapped(Instant startedAt) {
        return new SchedulerCycleResult(Outcome.SKIPPED_OVERLAP, startedAt, -1, -1, 0, 0, 0, 0, null);
    }

    public Outcome getOutcome() { return outcome; }
    public Instant getStartedAt() { return startedAt; }
    public int getDepth() { return depth; }
    public int getAvailable() { return available; }
    public int getFetched() { return fetched; }
    public int getPublished() { return published; }
    public int getFailed() { return failed; }
    public int getSkipped() { return skipped; }
    public String getError() { return error; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("outcome", outcome.name());
        map.put("startedAt", startedAt.toString());
        map.put("depth", depth);
        map.put("available", available);
        map.put("fetched", fetched);
        map.put("published", published);
        map.put("failed", failed);
        map.put("skipped", skipped);
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }

    @Override
    public String toString() {
        return "SchedulerCycleResult" + toMap();
    }
}
