package com.distributed26.transcoding.shared.queue;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * In-process {@link JobQueue} with the broker's delivery contract: manual acknowledgment,
 * prefetch-bounded in-flight deliveries, reject with or without requeue. Nothing survives
 * a restart, so this is for tests and single-process runs.
 */
public class InMemoryJobQueue implements JobQueue {
    private static final Logger logger = LogManager.getLogger(InMemoryJobQueue.class);

    private final Map<String, LinkedBlockingDeque<byte[]>> queues = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> unackedByQueue = new ConcurrentHashMap<>();
    private final Map<String, ConsumerLoop> consumers = new ConcurrentHashMap<>();
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicLong acked = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong requeued = new AtomicLong();

    @Override
    public void connect() {
        if (!connected.compareAndSet(false, true)) {
            throw new IllegalStateException("In-memory queue already initialized");
        }
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public void publish(String queueName, byte[] payload) {
        requireConnected();
        Objects.requireNonNull(payload, "payload is null");
        queue(queueName).offer(payload.clone());
    }

    @Override
    public String consume(String queueName, int prefetch, DeliveryHandler handler) {
        requireConnected();
        Objects.requireNonNull(handler, "handler is null");
        if (prefetch <= 0) {
            throw new IllegalArgumentException("prefetch must be > 0");
        }
        String tag = "inmem-" + UUID.randomUUID();
        ConsumerLoop loop = new ConsumerLoop(tag, queueName, prefetch, handler);
        consumers.put(tag, loop);
        loop.start();
        return tag;
    }

    @Override
    public void cancel(String consumerTag) {
        requireConnected();
        ConsumerLoop loop = consumers.remove(consumerTag);
        if (loop != null) {
            loop.stop();
        }
    }

    @Override
    public int depth(String queueName) {
        requireConnected();
        return queue(queueName).size();
    }

    /** Deliveries handed out on {@code queueName} and not yet settled. */
    public int unacknowledged(String queueName) {
        return unackedByQueue.computeIfAbsent(queueName, k -> new AtomicInteger()).get();
    }

    public long getAckedCount() {
        return acked.get();
    }

    /** Deliveries rejected without requeue. */
    public long getDroppedCount() {
        return dropped.get();
    }

    public long getRequeuedCount() {
        return requeued.get();
    }

    @Override
    public void close() {
        consumers.values().forEach(ConsumerLoop::stop);
        consumers.clear();
        connected.set(false);
    }

    private void requireConnected() {
        if (!connected.get()) {
            throw new QueueNotInitializedException("In-memory queue not initialized");
        }
    }

    private LinkedBlockingDeque<byte[]> queue(String queueName) {
        Objects.requireNonNull(queueName, "queueName is null");
        return queues.computeIfAbsent(queueName, k -> new LinkedBlockingDeque<>());
    }

    private final class ConsumerLoop {
        private final String tag;
        private final String queueName;
        private final Semaphore permits;
        private final DeliveryHandler handler;
        private volatile boolean running;
        private Thread thread;

        ConsumerLoop(String tag, String queueName, int prefetch, DeliveryHandler handler) {
            this.tag = tag;
            this.queueName = queueName;
            this.permits = new Semaphore(prefetch);
            this.handler = handler;
        }

        void start() {
            running = true;
            thread = new Thread(this::run, "InMemoryJobQueue-" + queueName);
            thread.setDaemon(true);
            thread.start();
        }

        void stop() {
            running = false;
            if (thread != null) {
                thread.interrupt();
            }
        }

        private void run() {
            LinkedBlockingDeque<byte[]> source = queue(queueName);
            while (running) {
                try {
                    permits.acquire();
                    byte[] body = source.poll(100, TimeUnit.MILLISECONDS);
                    if (body == null) {
                        permits.release();
                        continue;
                    }
                    unackedByQueue.computeIfAbsent(queueName, k -> new AtomicInteger()).incrementAndGet();
                    InMemoryDelivery delivery = new InMemoryDelivery(body, this);
                    try {
                        handler.handle(delivery);
                    } catch (RuntimeException e) {
                        logger.error("Delivery handler failed on consumer {}", tag, e);
                        if (!delivery.isSettled()) {
                            delivery.reject(false);
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        void settled(byte[] body, boolean requeue, boolean ack) {
            unackedByQueue.get(queueName).decrementAndGet();
            if (ack) {
                acked.incrementAndGet();
            } else if (requeue) {
                requeued.incrementAndGet();
                queue(queueName).offerFirst(body);
            } else {
                dropped.incrementAndGet();
            }
            permits.release();
        }
    }

    private static final class InMemoryDelivery implements QueueDelivery {
        private final byte[] body;
        private final ConsumerLoop owner;
        private final AtomicBoolean settled = new AtomicBoolean(false);

        InMemoryDelivery(byte[] body, ConsumerLoop owner) {
            this.body = body;
            this.owner = owner;
        }

        @Override
        public byte[] body() {
            return body;
        }

        @Override
        public void ack() {
            claim();
            owner.settled(body, false, true);
        }

        @Override
        public void reject(boolean requeue) {
            claim();
            owner.settled(body, requeue, false);
        }

        @Override
        public boolean isSettled() {
            return settled.get();
        }

        private void claim() {
            if (!settled.compareAndSet(false, true)) {
                throw new IllegalStateException("Delivery already settled");
            }
        }
    }
}
