package com.lox.inventoryreservation.api.kafka.producer;

import com.lox.inventoryreservation.api.kafka.events.InventoryOutcomeEvent;
import reactor.core.publisher.Mono;

public interface OutcomeProducer {

    /**
     * Appends the outcome to the topic matching its status. Completes with a failed
     * {@link PublishResult} rather than an error when the broker does not acknowledge.
     */
    Mono<PublishResult> publish(InventoryOutcomeEvent outcome);
}
