package com.distributed26.transcoding.shared.queue;

/**
 * Durable work-queue transport shared by the scheduler (publish, depth) and the consumer.
 *
 * <p>{@link #connect()} must complete once before anything else; every other operation
 * throws {@link QueueNotInitializedException} until it has.
 */
public interface JobQueue extends AutoCloseable {

    /**
     * Opens the connection and the single shared channel.
     *
     * @throws IllegalStateException if already connected or a connect is in progress
     * @throws QueueConnectionException if the broker cannot be reached
     */
    void connect();

    boolean isConnected();

    /** Asserts {@code queueName} durable and publishes {@code payload} as a persistent message. */
    void publish(String queueName, byte[] payload);

    /**
     * Asserts {@code queueName} durable and subscribes with manual acknowledgment. The broker hands
     * this consumer at most {@code prefetch} unsettled deliveries at a time.
     *
     * @return a consumer tag usable with {@link #cancel(String)}
     */
    String consume(String queueName, int prefetch, DeliveryHandler handler);

    /** Stops a subscription started by {@link #consume}. */
    void cancel(String consumerTag);

    /** Number of messages ready for delivery; unacknowledged deliveries are not counted. */
    int depth(String queueName);

    @Override
    void close();
}
