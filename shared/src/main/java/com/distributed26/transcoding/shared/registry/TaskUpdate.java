package com.distributed26.transcoding.shared.registry;

import com.distributed26.transcoding.shared.jobs.TaskStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * Body of {@code PUT queued-tasks/update/{id}}. Unset fields are left out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskUpdate {
    private final TaskStatus status;
    private final String startTime;
    private final String endTime;
    private final String errorMessage;

    private TaskUpdate(TaskStatus status, Instant startTime, Instant endTime, String errorMessage) {
        this.status = Objects.requireNonNull(status, "status is null");
        this.startTime = startTime == null ? null : startTime.toString();
        this.endTime = endTime == null ? null : endTime.toString();
        this.errorMessage = errorMessage;
    }

    public static TaskUpdate processing(Instant startTime) {
        return new TaskUpdate(TaskStatus.PROCESSING, Objects.requireNonNull(startTime, "startTime"), null, null);
    }

    public static TaskUpdate completed(Instant endTime) {
        return new TaskUpdate(TaskStatus.COMPLETED, null, Objects.requireNonNull(endTime, "endTime"), null);
    }

    public static TaskUpdate error(String errorMessage, Instant endTime) {
        return new TaskUpdate(TaskStatus.ERROR, null, endTime, errorMessage);
    }

    @JsonProperty("status")
    public TaskStatus getStatus() {
        return status;
    }

    @JsonProperty("start_time")
    public String getStartTime() {
        return startTime;
    }

    @JsonProperty("end_time")
    public String getEndTime() {
        return endTime;
    }

    @JsonProperty("error_message")
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return "TaskUpdate{status=" + status + ", start=" + startTime + ", end=" + endTime
                + ", error='" + errorMessage + "'}";
    }
}
