package com.distributed26.transcoding.shared.queue;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.Delivery;
import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link JobQueue} over a single RabbitMQ connection and channel.
 *
 * <p>The channel is shared by the scheduler thread and the consumer dispatch thread, and AMQP
 * channels are not safe for concurrent use, so every channel call goes through {@code channelLock}.
 */
public class RabbitMQJobQueue implements JobQueue {
    private static final Logger logger = LogManager.getLogger(RabbitMQJobQueue.class);

    private static final AMQP.BasicProperties PERSISTENT_JSON = new AMQP.BasicProperties.Builder()
            .contentType("application/json")
            .deliveryMode(2)
            .build();

    private final String uri;
    private final String connectionName;
    private final Object channelLock = new Object();
    private final AtomicBoolean connectClaimed = new AtomicBoolean(false);
    private volatile Connection connection;
    private volatile Channel channel;

    public RabbitMQJobQueue(String uri, String connectionName) {
        this.uri = Objects.requireNonNull(uri, "uri is null");
        this.connectionName = Objects.requireNonNull(connectionName, "connectionName is null");
    }

    @Override
    public void connect() {
        if (!connectClaimed.compareAndSet(false, true)) {
            throw new IllegalStateException("RabbitMQ connection already initialized");
        }
        try {
            ConnectionFactory factory = new ConnectionFactory();
            factory.setUri(uri);
            Connection newConnection = factory.newConnection(connectionName);
            Channel newChannel = newConnection.createChannel();
            synchronized (channelLock) {
                this.connection = newConnection;
                this.channel = newChannel;
            }
            logger.info("RabbitMQ connected: host={} vhost={} connection={}",
                    factory.getHost(), factory.getVirtualHost(), connectionName);
        } catch (IOException | TimeoutException | URISyntaxException | GeneralSecurityException e) {
            // Leave the transport unclaimed so a supervisor may try again.
            connectClaimed.set(false);
            throw new QueueConnectionException("Failed to connect to RabbitMQ at " + redact(uri), e);
        }
    }

    @Override
    public boolean isConnected() {
        Channel current = channel;
        return current != null && current.isOpen();
    }

    @Override
    public void publish(String queueName, byte[] payload) {
        Objects.requireNonNull(queueName, "queueName is null");
        Objects.requireNonNull(payload, "payload is null");
        synchronized (channelLock) {
            Channel ch = requireChannel();
            try {
                declareDurable(ch, queueName);
                ch.basicPublish("", queueName, PERSISTENT_JSON, payload);
            } catch (IOException e) {
                throw new QueueOperationException("Failed to publish to queue " + queueName, e);
            }
        }
    }

    @Override
    public String consume(String queueName, int prefetch, DeliveryHandler handler) {
        Objects.requireNonNull(queueName, "queueName is null");
        Objects.requireNonNull(handler, "handler is null");
        if (prefetch <= 0) {
            throw new IllegalArgumentException("prefetch must be > 0");
        }
        synchronized (channelLock) {
            Channel ch = requireChannel();
            try {
                declareDurable(ch, queueName);
                ch.basicQos(prefetch);
                DeliverCallback callback = (consumerTag, delivery) -> dispatch(handler, new RabbitDelivery(delivery));
                String tag = ch.basicConsume(queueName, false, callback,
                        consumerTag -> logger.warn("Consumer {} on {} was cancelled by the broker", consumerTag, queueName));
                logger.info("Consuming queue={} prefetch={} tag={}", queueName, prefetch, tag);
                return tag;
            } catch (IOException e) {
                throw new QueueOperationException("Failed to start consumer on queue " + queueName, e);
            }
        }
    }

    @Override
    public void cancel(String consumerTag) {
        synchronized (channelLock) {
            Channel ch = requireChannel();
            try {
                ch.basicCancel(consumerTag);
            } catch (IOException e) {
                throw new QueueOperationException("Failed to cancel consumer " + consumerTag, e);
            }
        }
    }

    @Override
    public int depth(String queueName) {
        synchronized (channelLock) {
            Channel ch = requireChannel();
            try {
                return declareDurable(ch, queueName).getMessageCount();
            } catch (IOException e) {
                throw new QueueOperationException("Failed to read depth of queue " + queueName, e);
            }
        }
    }

    @Override
    public void close() {
        synchronized (channelLock) {
            try {
                if (channel != null && channel.isOpen()) {
                    channel.close();
                }
                if (connection != null && connection.isOpen()) {
                    connection.close();
                }
            } catch (IOException | TimeoutException e) {
                logger.warn("Error closing RabbitMQ connection", e);
            } finally {
                channel = null;
                connection = null;
            }
        }
    }

    private Channel requireChannel() {
        Channel ch = channel;
        if (ch == null) {
            throw new QueueNotInitializedException("RabbitMQ channel not initialized");
        }
        return ch;
    }

    private static AMQP.Queue.DeclareOk declareDurable(Channel ch, String queueName) throws IOException {
        return ch.queueDeclare(queueName, true, false, false, null);
    }

    /**
     * An exception escaping a DeliverCallback makes the client close the channel, which would also
     * take down the scheduler's publishing. Failures are settled here instead.
     */
    private static void dispatch(DeliveryHandler handler, RabbitDelivery delivery) {
        try {
            handler.handle(delivery);
        } catch (RuntimeException e) {
            logger.error("Delivery handler failed for tag={}", delivery.deliveryTag, e);
            if (!delivery.isSettled()) {
                delivery.reject(false);
            }
        }
    }

    private static String redact(String uri) {
        return uri.replaceAll("//[^@/]*@", "//***@");
    }

    private final class RabbitDelivery implements QueueDelivery {
        private final long deliveryTag;
        private final byte[] body;
        private final AtomicBoolean settled = new AtomicBoolean(false);

        RabbitDelivery(Delivery delivery) {
            this.deliveryTag = delivery.getEnvelope().getDeliveryTag();
            this.body = delivery.getBody();
        }

        @Override
        public byte[] body() {
            return body;
        }

        @Override
        public void ack() {
            claim();
            synchronized (channelLock) {
                try {
                    requireChannel().basicAck(deliveryTag, false);
                } catch (IOException e) {
                    throw new QueueOperationException("Failed to ack delivery " + deliveryTag, e);
                }
            }
        }

        @Override
        public void reject(boolean requeue) {
            claim();
            synchronized (channelLock) {
                try {
                    requireChannel().basicNack(deliveryTag, false, requeue);
                } catch (IOException e) {
                    throw new QueueOperationException("Failed to reject delivery " + deliveryTag, e);
                }
            }
        }

        @Override
        public boolean isSettled() {
            return settled.get();
        }

        private void claim() {
            if (!settled.compareAndSet(false, true)) {
                throw new IllegalStateException("Delivery " + deliveryTag + " already settled");
            }
        }
    }
}
