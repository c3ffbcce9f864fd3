package com.distributed26.transcoding.shared.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;

/**
 * JSON encoding of {@link TranscodeJob} queue payloads.
 */
public final class JobMessageCodec {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JobMessageCodec() {}

    public static byte[] encode(TranscodeJob job) {
        Objects.requireNonNull(job, "job is null");
        try {
            return objectMapper.writeValueAsBytes(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job for task " + job.getQueuedTaskId(), e);
        }
    }

    /**
     * Parses and validates a payload. Throws {@link InvalidJobException} for unreadable JSON
     * (no task id) and for well-formed JSON that does not describe runnable work (task id set).
     */
    public static TranscodeJob decode(byte[] body) {
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new InvalidJobException("Malformed job payload: " + e.getMessage(), null, e);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidJobException("Job payload is not a JSON object", null);
        }

        JsonNode idNode = node.get("queuedTaskId");
        if (idNode == null || !idNode.canConvertToLong()) {
            throw new InvalidJobException("Job payload has no numeric queuedTaskId", null);
        }
        Long taskId = idNode.asLong();

        TranscodeJob job;
        try {
            job = objectMapper.treeToValue(node, TranscodeJob.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidJobException("Invalid job for task " + taskId + ": " + rootMessage(e), taskId, e);
        }
        if (job.getInputPath().isBlank()) {
            throw new InvalidJobException("Job for task " + taskId + " has a blank inputPath", taskId);
        }
        if (job.getResolutions().isEmpty()) {
            throw new InvalidJobException("Job for task " + taskId + " requests no resolutions", taskId);
        }
        if (job.getResolutions().contains(null)) {
            throw new InvalidJobException("Job for task " + taskId + " has a null resolution", taskId);
        }
        return job;
    }

    private static String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
