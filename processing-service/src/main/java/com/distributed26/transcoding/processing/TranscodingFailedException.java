package com.distributed26.transcoding.processing;

/**
 * A job could not be turned into a complete HLS package. No master playlist was written.
 */
public class TranscodingFailedException extends Exception {
    private final long queuedTaskId;

    public TranscodingFailedException(long queuedTaskId, String message, Throwable cause) {
        super(message, cause);
        this.queuedTaskId = queuedTaskId;
    }

    public long getQueuedTaskId() {
        return queuedTaskId;
    }
}
