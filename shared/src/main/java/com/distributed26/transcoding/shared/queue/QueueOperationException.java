package com.distributed26.transcoding.shared.queue;

/**
 * A broker call on an established channel failed.
 */
public class QueueOperationException extends RuntimeException {
    public QueueOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
