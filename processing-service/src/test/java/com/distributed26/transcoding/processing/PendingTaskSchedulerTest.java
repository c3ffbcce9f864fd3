package com.distributed26.transcoding.processing;

import static com.distributed26.transcoding.processing.TestTasks.RES_360;
import static com.distributed26.transcoding.processing.TestTasks.RES_720;
import static com.distributed26.transcoding.processing.TestTasks.pending;
import static com.distributed26.transcoding.processing.TestTasks.task;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.distributed26.transcoding.shared.jobs.JobMessageCodec;
import com.distributed26.transcoding.shared.jobs.TaskStatus;
import com.distributed26.transcoding.shared.jobs.TranscodeJob;
import com.distributed26.transcoding.shared.queue.JobQueue;
import com.distributed26.transcoding.shared.queue.QueueNotInitializedException;
import com.distributed26.transcoding.shared.queue.QueueOperationException;
import com.distributed26.transcoding.shared.registry.PendingTask;
import com.distributed26.transcoding.shared.registry.TaskRegistry;
import com.distributed26.transcoding.shared.registry.TaskRegistryException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PendingTaskSchedulerTest {
    private static final String QUEUE = "transcoding-video";
    private static final int CAPACITY = 10;

    @Mock
    private JobQueue queue;

    @Mock
    private TaskRegistry registry;

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    private PendingTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new PendingTaskScheduler(queue, QUEUE, CAPACITY, registry,
                new StatusReporter(registry, clock), new TranscodeJobFactory(clock), clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    // ── Admission control ──────────────────────────────────────────────────────

    @Test
    void fullQueue_neverContactsRegistry() {
        when(queue.depth(QUEUE)).thenReturn(CAPACITY);

        SchedulerCycleResult result = scheduler.runCycle();

        assertEquals(SchedulerCycleResult.Outcome.QUEUE_FULL, result.getOutcome());
        assertEquals(0, result.getAvailable());
        verifyNoInteractions(registry);
        verify(queue, never()).publish(any(), any());
    }

    @Test
    void overfullQueue_isTreatedAsFull() {
        when(queue.depth(QUEUE)).thenReturn(CAPACITY + 3);

        assertEquals(SchedulerCycleResult.Outcome.QUEUE_FULL, scheduler.runCycle().getOutcome());
        verifyNoInteractions(registry);
    }

    @Test
    void fetchLimit_isRemainingCapacity() {
        when(queue.depth(QUEUE)).thenReturn(7);
        when(registry.fetchPending(3)).thenReturn(List.of());

        SchedulerCycleResult result = scheduler.runCycle();

        assertEquals(SchedulerCycleResult.Outcome.NO_TASKS, result.getOutcome());
        assertEquals(7, result.getDepth());
        assertEquals(3, result.getAvailable());
        verify(registry).fetchPending(3);
        verify(queue, never()).publish(any(), any());
    }

    @Test
    void registryReturningTooMany_publishesOnlyAvailable() {
        when(queue.depth(QUEUE)).thenReturn(9);
        when(registry.fetchPending(1)).thenReturn(List.of(
                pending(1, "a.mp4", RES_360),
                pending(2, "b.mp4", RES_360),
                pending(3, "c.mp4", RES_360)));

        SchedulerCycleResult result = scheduler.runCycle();

        assertEquals(1, result.getPublished());
        assertEquals(2, result.getSkipped());
        verify(queue, times(1)).publish(eq(QUEUE), any());
    }

    // ── Publishing ─────────────────────────────────────────────────────────────

    @Test
    void eachPendingTask_isPublishedAndMarkedQueued() {
        when(queue.depth(QUEUE)).thenReturn(0);
        when(registry.fetchPending(CAPACITY)).thenReturn(List.of(
                pending(1, "a.mp4", RES_360, RES_720),
                pending(2, "b.mp4", RES_720)));

        SchedulerCycleResult result = scheduler.runCycle();

        assertEquals(SchedulerCycleResult.Outcome.DISPATCHED, result.getOutcome());
        assertEquals(2, result.getFetched());
        assertEquals(2, result.getPublished());
        assertEquals(0, result.getFailed());

        ArgumentCaptor<byte[]> payloads = ArgumentCaptor.forClass(byte[].class);
        verify(queue, times(2)).publish(eq(QUEUE), payloads.capture());
        TranscodeJob first = JobMessageCodec.decode(payloads.getAllValues().get(0));
        assertEquals(1L, first.getQueuedTaskId());
        assertEquals("a.mp4", first.getInputPath());
        assertEquals(2, first.getResolutions().size());
        assertEquals("transcoded/" + clock.millis() + "-Video_1", first.getOutputPath());

        verify(registry).updateStatus(1L, TaskStatus.QUEUED, null);
        verify(registry).updateStatus(2L, TaskStatus.QUEUED, null);
    }

    @Test
    void invalidTask_isReportedAndOthersStillPublished() {
        when(queue.depth(QUEUE)).thenReturn(0);
        when(registry.fetchPending(CAPACITY)).thenReturn(List.of(
                pending(1, "a.mp4"),
                pending(2, "b.mp4", RES_360)));

        SchedulerCycleResult result = scheduler.runCycle();

        assertEquals(1, result.getPublished());
        assertEquals(1, result.getFailed());
        verify(registry).updateStatus(eq(1L), eq(TaskStatus.ERROR), contains("no resolutions"));
        verify(registry).updateStatus(2L, TaskStatus.QUEUED, null);
        verify(queue, times(1)).publish(eq(QUEUE), any());
    }

    @Test
    void publishFailure_marksOnlyThatTaskErrored() {
        when(queue.depth(QUEUE)).thenReturn(0);
        when(registry.fetchPending(CAPACITY)).thenReturn(List.of(
                pending(1, "a.mp4", RES_360),
                pending(2, "b.mp4", RES_360)));
        doThrow(new QueueOperationException("channel closed", null))
                .doNothing()
                .when(queue).publish(eq(QUEUE), any());

        SchedulerCycleResult result = scheduler.runCycle();

        assertEquals(1, result.getPublished());
        assertEquals(1, result.getFailed());
        verify(registry).updateStatus(eq(1L), eq(TaskStatus.ERROR), contains("channel closed"));
        verify(registry, never()).updateStatus(eq(1L), eq(TaskStatus.QUEUED), any());
        verify(registry).updateStatus(2L, TaskStatus.QUEUED, null);
    }

    @Test
    void nonPendingTask_isSkipped() {
        when(queue.depth(QUEUE)).thenReturn(0);
        when(registry.fetchPending(CAPACITY)).thenReturn(List.of(
                task(1, "Processing", "a.mp4", RES_360),
                pending(2, "b.mp4", RES_360)));

        SchedulerCycleResult result = scheduler.runCycle();

        assertEquals(1, result.getPublished());
        assertEquals(1, result.getSkipped());
        verify(registry, never()).updateStatus(eq(1L), any(), any());
    }

    @Test
    void queuedReportFailure_doesNotUndoPublish() {
        when(queue.depth(QUEUE)).thenReturn(0);
        when(registry.fetchPending(CAPACITY)).thenReturn(List.of(pending(1, "a.mp4", RES_360)));
        doThrow(new TaskRegistryException("HTTP 500", 500))
                .when(registry).updateStatus(1L, TaskStatus.QUEUED, null);

        SchedulerCycleResult result = scheduler.runCycle();

        assertEquals(1, result.getPublished());
        assertEquals(0, result.getFailed());
    }

    // ── Aborted cycles ─────────────────────────────────────────────────────────

    @Test
    void registryFailure_abortsCycle() {
        when(queue.depth(QUEUE)).thenReturn(2);
        when(registry.fetchPending(8)).thenThrow(new TaskRegistryException("Failed to fetch pending tasks: HTTP 503", 503));

        SchedulerCycleResult result = scheduler.runCycle();

        assertEquals(SchedulerCycleResult.Outcome.ABORTED, result.getOutcome());
        assertTrue(result.getError().contains("503"));
        verify(queue, never()).publish(any(), any());
    }

    @Test
    void uninitializedQueue_abortsBeforeRegistry() {
        when(queue.depth(QUEUE)).thenThrow(new QueueNotInitializedException("RabbitMQ channel not initialized"));

        SchedulerCycleResult result = scheduler.runCycle();

        assertEquals(SchedulerCycleResult.Outcome.ABORTED, result.getOutcome());
        verifyNoInteractions(registry);
    }

    @Test
    void cycleAfterAbort_runsNormally() {
        when(queue.depth(QUEUE)).thenReturn(0);
        when(registry.fetchPending(CAPACITY))
                .thenThrow(new TaskRegistryException("down", -1))
                .thenReturn(List.of(pending(1, "a.mp4", RES_360)));

        assertEquals(SchedulerCycleResult.Outcome.ABORTED, scheduler.runCycle().getOutcome());
        assertEquals(SchedulerCycleResult.Outcome.DISPATCHED, scheduler.runCycle().getOutcome());
        assertEquals(SchedulerCycleResult.Outcome.DISPATCHED, scheduler.getLastResult().getOutcome());
    }

    // ── Scheduling ─────────────────────────────────────────────────────────────

    @Test
    void overlappingCycle_isSkipped() throws Exception {
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(queue.depth(QUEUE)).thenReturn(0);
        when(registry.fetchPending(anyInt())).thenAnswer(inv -> {
            fetching.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.<PendingTask>of();
        });

        Thread first = new Thread(scheduler::runCycle);
        first.start();
        assertTrue(fetching.await(5, TimeUnit.SECONDS));

        SchedulerCycleResult second = scheduler.runCycle();
        release.countDown();
        first.join(5000);

        assertEquals(SchedulerCycleResult.Outcome.SKIPPED_OVERLAP, second.getOutcome());
        verify(registry, times(1)).fetchPending(anyInt());
    }

    @Test
    void start_runsCyclesPeriodically() {
        when(queue.depth(QUEUE)).thenReturn(0);
        when(registry.fetchPending(CAPACITY)).thenReturn(List.of());

        scheduler.start(Duration.ofMillis(50));

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                verify(registry, atLeast(2)).fetchPending(CAPACITY));
        assertEquals(SchedulerCycleResult.Outcome.NO_TASKS, scheduler.getLastResult().getOutcome());
    }

    @Test
    void start_twice_throws() {
        scheduler.start(Duration.ofSeconds(60));
        assertThrows(IllegalStateException.class, () -> scheduler.start(Duration.ofSeconds(60)));
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new PendingTaskScheduler(queue, QUEUE, 0, registry,
                new StatusReporter(registry, clock), new TranscodeJobFactory(clock), clock));
    }
}
