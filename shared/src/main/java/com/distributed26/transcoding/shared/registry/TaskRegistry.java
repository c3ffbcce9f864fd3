package com.distributed26.transcoding.shared.registry;

import com.distributed26.transcoding.shared.jobs.TaskStatus;
import java.util.List;

/**
 * The external system of record for transcoding tasks. The pipeline reads pending work from it
 * and asks it to record status transitions; it never owns task state itself.
 *
 * <p>Every method throws {@link TaskRegistryException} when the call fails.
 */
public interface TaskRegistry {

    /** At most {@code limit} pending tasks, in the registry's order. */
    List<PendingTask> fetchPending(int limit);

    /** Full update: status plus start/end time or error message. */
    void updateTask(long taskId, TaskUpdate update);

    /** Status-only update, with an error message when {@code status} is an error. */
    void updateStatus(long taskId, TaskStatus status, String errorMessage);

    /** Records the produced video and where its master playlist lives. */
    void createVideo(long taskId, String videoUrl);

    /** Fails unless the registry answers HTTP at all. */
    void checkReachable();
}
