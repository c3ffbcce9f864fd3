package com.distributed26.transcoding.shared.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle values understood by the task registry. The wire spelling is the registry's.
 */
public enum TaskStatus {
    PENDING("Pending"),
    QUEUED("Queued"),
    PROCESSING("Processing"),
    COMPLETED("Completed"),
    ERROR("Error");

    private final String wireValue;

    TaskStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static TaskStatus fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        for (TaskStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
