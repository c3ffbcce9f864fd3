package com.distributed26.transcoding.shared.queue;

@FunctionalInterface
public interface DeliveryHandler {
    void handle(QueueDelivery delivery);
}
