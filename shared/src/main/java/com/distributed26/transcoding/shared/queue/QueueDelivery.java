package com.distributed26.transcoding.shared.queue;

/**
 * One message handed to a consumer. It stays unacknowledged, and keeps its prefetch slot,
 * until exactly one of {@link #ack()} or {@link #reject(boolean)} is called.
 */
public interface QueueDelivery {
    byte[] body();

    /** Removes the message from the queue for good. */
    void ack();

    /** Returns the message to the queue when {@code requeue} is true, otherwise drops it. */
    void reject(boolean requeue);

    boolean isSettled();
}
