package com.distributed26.transcoding.processing;

import com.distributed26.transcoding.shared.jobs.InvalidJobException;
import com.distributed26.transcoding.shared.jobs.Resolution;
import com.distributed26.transcoding.shared.jobs.TranscodeJob;
import com.distributed26.transcoding.shared.registry.PendingTask;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Builds the queue message for a pending registry task.
 */
public class TranscodeJobFactory {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<List<Resolution>> RESOLUTION_LIST = new TypeReference<>() {};

    private final Clock clock;

    public TranscodeJobFactory(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws InvalidJobException if the task does not name a source file and at least one valid resolution
     */
    public TranscodeJob create(PendingTask task) {
        long taskId = task.getId();
        PendingTask.VideoUpload upload = task.getVideoUpload();
        if (upload == null) {
            throw new InvalidJobException("Task " + taskId + " has no video upload", taskId);
        }
        if (upload.getPath() == null || upload.getPath().isBlank()) {
            throw new InvalidJobException("Task " + taskId + " has no source path", taskId);
        }
        List<Resolution> resolutions = parseResolutions(taskId, upload.getResolution());
        return new TranscodeJob(upload.getPath(), outputHint(upload.getTitle()), resolutions, taskId);
    }

    /** {@code transcoded/<epochMillis>-<title>} */
    String outputHint(String title) {
        String safeTitle = (title == null || title.isBlank())
                ? "untitled"
                : title.trim().replaceAll("[^A-Za-z0-9._-]+", "_");
        return "transcoded/" + clock.millis() + "-" + safeTitle;
    }

    private static List<Resolution> parseResolutions(long taskId, JsonNode node) {
        if (node == null || node.isNull() || !node.isArray() || node.isEmpty()) {
            throw new InvalidJobException("Task " + taskId + " requests no resolutions", taskId);
        }
        List<Resolution> resolutions;
        try {
            resolutions = objectMapper.convertValue(node, RESOLUTION_LIST);
        } catch (IllegalArgumentException e) {
            throw new InvalidJobException("Task " + taskId + " has an invalid resolution list: " + e.getMessage(), taskId, e);
        }
        if (resolutions.contains(null)) {
            throw new InvalidJobException("Task " + taskId + " has a null resolution", taskId);
        }
        return resolutions;
    }
}
