package com.distributed26.transcoding.shared.queue;

public class QueueNotInitializedException extends IllegalStateException {
    public QueueNotInitializedException(String message) {
        super(message);
    }
}
