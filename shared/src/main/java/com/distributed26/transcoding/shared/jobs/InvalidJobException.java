package com.distributed26.transcoding.shared.jobs;

/**
 * A job message that cannot be turned into work. Carries the task id when it could be read.
 */
public class InvalidJobException extends RuntimeException {
    private final Long queuedTaskId;

    public InvalidJobException(String message, Long queuedTaskId, Throwable cause) {
        super(message, cause);
        this.queuedTaskId = queuedTaskId;
    }

    public InvalidJobException(String message, Long queuedTaskId) {
        this(message, queuedTaskId, null);
    }

    /** Task id from the payload, or {@code null} when the payload was unreadable. */
    public Long getQueuedTaskId() {
        return queuedTaskId;
    }
}
