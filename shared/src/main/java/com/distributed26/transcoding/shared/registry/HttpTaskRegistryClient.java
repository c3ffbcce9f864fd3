package com.distributed26.transcoding.shared.registry;

import com.distributed26.transcoding.shared.jobs.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link TaskRegistry} over the registry's REST API.
 */
public class HttpTaskRegistryClient implements TaskRegistry {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final Logger logger = LogManager.getLogger(HttpTaskRegistryClient.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;

    public HttpTaskRegistryClient(String baseUrl, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), baseUrl, timeout);
    }

    public HttpTaskRegistryClient(HttpClient httpClient, String baseUrl, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is null");
        String url = Objects.requireNonNull(baseUrl, "baseUrl is null").trim();
        this.baseUrl = url.endsWith("/") ? url : url + "/";
        this.timeout = Objects.requireNonNull(timeout, "timeout is null");
    }

    @Override
    public List<PendingTask> fetchPending(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        HttpRequest request = request("queued-tasks/pendingList?limit=" + limit).GET().build();
        String body = send(request, "fetch pending tasks");

        JsonNode data;
        try {
            data = objectMapper.readTree(body).path("data");
        } catch (JsonProcessingException e) {
            throw new TaskRegistryException("Pending list response is not JSON", e);
        }
        if (data.isMissingNode() || data.isNull()) {
            return List.of();
        }
        if (!data.isArray()) {
            throw new TaskRegistryException("Pending list 'data' is not an array", -1);
        }

        List<PendingTask> tasks = new ArrayList<>(data.size());
        for (JsonNode node : data) {
            try {
                tasks.add(objectMapper.treeToValue(node, PendingTask.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                logger.warn("Skipping unreadable pending task entry {}: {}", node, e.getMessage());
            }
        }
        return tasks;
    }

    @Override
    public void updateTask(long taskId, TaskUpdate update) {
        Objects.requireNonNull(update, "update is null");
        HttpRequest request = request("queued-tasks/update/" + taskId)
                .header("Content-Type", "application/json")
                .PUT(json(update))
                .build();
        send(request, "update task " + taskId);
    }

    @Override
    public void updateStatus(long taskId, TaskStatus status, String errorMessage) {
        Objects.requireNonNull(status, "status is null");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status.getWireValue());
        if (status == TaskStatus.ERROR) {
            payload.put("error_message", errorMessage == null ? "Unknown error" : errorMessage);
        }
        HttpRequest request = request("queued-tasks/updateStatus/" + taskId)
                .header("Content-Type", "application/json")
                .method("PATCH", json(payload))
                .build();
        send(request, "update status of task " + taskId);
    }

    @Override
    public void createVideo(long taskId, String videoUrl) {
        Objects.requireNonNull(videoUrl, "videoUrl is null");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("queued_task_id", taskId);
        payload.put("video_url", videoUrl);
        HttpRequest request = request("videos/create")
                .header("Content-Type", "application/json")
                .POST(json(payload))
                .build();
        send(request, "create video for task " + taskId);
    }

    @Override
    public void checkReachable() {
        HttpRequest request = request("").GET().build();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            logger.info("Task registry reachable at {} (HTTP {})", baseUrl, response.statusCode());
        } catch (IOException e) {
            throw new TaskRegistryException("Task registry unreachable at " + baseUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskRegistryException("Interrupted while contacting task registry", e);
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json");
    }

    private String send(HttpRequest request, String action) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TaskRegistryException("Failed to " + action + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskRegistryException("Interrupted while trying to " + action, e);
        }
        int code = response.statusCode();
        if (code < 200 || code >= 300) {
            throw new TaskRegistryException("Failed to " + action + ": HTTP " + code + " " + response.body(), code);
        }
        logger.debug("{} {} -> {}", request.method(), request.uri(), code);
        return response.body();
    }

    private static HttpRequest.BodyPublisher json(Object payload) {
        try {
            return HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize registry payload", e);
        }
    }
}
