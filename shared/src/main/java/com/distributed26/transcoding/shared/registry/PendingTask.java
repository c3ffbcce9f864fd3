package com.distributed26.transcoding.shared.registry;

import com.distributed26.transcoding.shared.jobs.TaskStatus;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A registry task waiting to be transcoded, as returned by the pending list.
 *
 * <p>The upload's resolution list is kept as raw JSON: one task with a bad list must not stop the
 * rest of the page from being read, so it is validated when the job message is built.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PendingTask {
    private final long id;
    private final String status;
    private final VideoUpload videoUpload;

    @JsonCreator
    public PendingTask(
            @JsonProperty("id") Long id,
            @JsonProperty("status") String status,
            @JsonProperty("videoUpload") VideoUpload videoUpload
    ) {
        this.id = Objects.requireNonNull(id, "id is null");
        this.status = status;
        this.videoUpload = videoUpload;
    }

    public long getId() {
        return id;
    }

    /** Raw registry status; may be {@code null} when the registry omits it. */
    public String getStatus() {
        return status;
    }

    /** True unless the registry reports a status other than pending. */
    public boolean isPending() {
        return status == null || TaskStatus.PENDING.getWireValue().equalsIgnoreCase(status);
    }

    public VideoUpload getVideoUpload() {
        return videoUpload;
    }

    @Override
    public String toString() {
        return "PendingTask{id=" + id + ", status=" + status + ", videoUpload=" + videoUpload + '}';
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VideoUpload {
        private final String path;
        private final String title;
        private final JsonNode resolution;

        @JsonCreator
        public VideoUpload(
                @JsonProperty("path") String path,
                @JsonProperty("title") String title,
                @JsonProperty("resolution") JsonNode resolution
        ) {
            this.path = path;
            this.title = title;
            this.resolution = resolution;
        }

        public String getPath() {
            return path;
        }

        public String getTitle() {
            return title;
        }

        public JsonNode getResolution() {
            return resolution;
        }

        @Override
        public String toString() {
            return "VideoUpload{path='" + path + "', title='" + title + "'}";
        }
    }
}
