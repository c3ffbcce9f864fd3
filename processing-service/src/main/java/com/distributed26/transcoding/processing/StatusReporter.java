package com.distributed26.transcoding.processing;

import com.distributed26.transcoding.shared.jobs.TaskStatus;
import com.distributed26.transcoding.shared.registry.TaskRegistry;
import com.distributed26.transcoding.shared.registry.TaskUpdate;
import java.time.Clock;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Best-effort status reporting. A registry failure is logged and reported back as {@code false};
 * it never changes the outcome of the work being reported on.
 */
public class StatusReporter {
    private static final Logger LOGGER = LogManager.getLogger(StatusReporter.class);

    private final TaskRegistry registry;
    private final Clock clock;

    public StatusReporter(TaskRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean queued(long taskId) {
        return attempt(taskId, "Queued", () -> registry.updateStatus(taskId, TaskStatus.QUEUED, null));
    }

    /** Status-only error, used where no encode has started yet. */
    public boolean rejected(long taskId, String errorMessage) {
        return attempt(taskId, "Error", () -> registry.updateStatus(taskId, TaskStatus.ERROR, errorMessage));
    }

    public boolean processing(long taskId) {
        return attempt(taskId, "Processing", () -> registry.updateTask(taskId, TaskUpdate.processing(clock.instant())));
    }

    public boolean failed(long taskId, String errorMessage) {
        return attempt(taskId, "Error", () -> registry.updateTask(taskId, TaskUpdate.error(errorMessage, clock.instant())));
    }

    public boolean completed(long taskId) {
        return attempt(taskId, "Completed", () -> registry.updateTask(taskId, TaskUpdate.completed(clock.instant())));
    }

    public boolean videoCreated(long taskId, String videoUrl) {
        return attempt(taskId, "video record", () -> registry.createVideo(taskId, videoUrl));
    }

    private boolean attempt(long taskId, String what, Runnable call) {
        try {
            call.run();
            LOGGER.debug("Reported {} for task {}", what, taskId);
            return true;
        } catch (RuntimeException e) {
            LOGGER.warn("Could not report {} for task {}: {}", what, taskId, e.getMessage());
            return false;
        }
    }
}
