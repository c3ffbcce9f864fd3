package com.distributed26.transcoding.processing;

import com.distributed26.transcoding.shared.registry.PendingTask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Pending-task fixtures shaped like the registry's pending list entries. */
final class TestTasks {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final String RES_360 = "{\"width\":640,\"height\":360,\"bitrate\":800,\"fps\":25}";
    static final String RES_720 = "{\"width\":1280,\"height\":720,\"bitrate\":2500,\"fps\":30}";
    static final String RES_1080 = "{\"width\":1920,\"height\":1080,\"bitrate\":5000,\"fps\":30}";

    private TestTasks() {}

    static PendingTask pending(long id, String path, String... resolutions) {
        return task(id, "Pending", path, resolutions);
    }

    static PendingTask task(long id, String status, String path, String... resolutions) {
        String json = "{\"id\":" + id + ",\"status\":\"" + status + "\",\"videoUpload\":{"
                + "\"path\":\"" + path + "\",\"title\":\"Video " + id + "\","
                + "\"resolution\":[" + String.join(",", resolutions) + "]}}";
        try {
            return objectMapper.readValue(json, PendingTask.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(json, e);
        }
    }
}
