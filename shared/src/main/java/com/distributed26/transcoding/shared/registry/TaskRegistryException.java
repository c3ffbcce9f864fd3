package com.distributed26.transcoding.shared.registry;

public class TaskRegistryException extends RuntimeException {
    private final int statusCode;

    public TaskRegistryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TaskRegistryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed call, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
