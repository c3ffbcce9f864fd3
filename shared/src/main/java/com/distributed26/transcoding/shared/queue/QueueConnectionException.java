package com.distributed26.transcoding.shared.queue;

public class QueueConnectionException extends RuntimeException {
    public QueueConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
