package com.lox.inventoryreservation.api.kafka.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lox.inventoryreservation.api.exceptions.OutcomePublishException;
import com.lox.inventoryreservation.api.kafka.events.OrderCreatedEvent;
import com.lox.inventoryreservation.api.kafka.producer.OutcomeProducer;
import com.lox.inventoryreservation.api.kafka.topics.KafkaTopics;
import com.lox.inventoryreservation.api.services.ReservationEngine;
import com.lox.inventoryreservation.common.config.ReservationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Drives the reservation pipeline, one order event at a time. The listener blocks until the
 * outcome is acknowledged by the broker; the container commits the offset only when it returns.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderCreatedConsumer {

    private final ReservationEngine reservationEngine;
    private final OutcomeProducer outcomeProducer;
    private final ObjectMapper objectMapper;
    private final ReservationProperties properties;
    private final ConsumerLoopStats stats;

    private volatile ConsumerState state = ConsumerState.IDLE;

    @KafkaListener(
            id = "order-created-consumer",
            topics = KafkaTopics.ORDERS_TOPIC,
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "orderListenerContainerFactory"
    )
    public void handleOrderCreated(ConsumerRecord<String, String> record) {
        stats.recordReceived();
        log.debug("Received record from {}-{} at offset {}",
                record.topic(), record.partition(), record.offset());
        process(record.value()).block(properties.getCycleTimeout());
    }

    /**
     * One Processing/Publishing cycle. Completes empty when the payload is skipped, errors with
     * {@link OutcomePublishException} when the outcome could not be published.
     */
    public Mono<Void> process(String payload) {
        OrderCreatedEvent event = parse(payload);
        if (event == null) {
            stats.recordMalformed();
            return Mono.empty();
        }

        return Mono.defer(() -> {
                    state = ConsumerState.PROCESSING;
                    log.info("Received OrderCreatedEvent: {}", event);
                    return reservationEngine.reserve(event);
                })
                .flatMap(outcome -> {
                    state = ConsumerState.PUBLISHING;
                    return outcomeProducer.publish(outcome);
                })
                .flatMap(result -> {
                    if (!result.isPublished()) {
                        stats.recordPublishFailure();
                        return Mono.<Void>error(new OutcomePublishException(
                                "Outcome for Order ID " + event.getOrderId()
                                        + " was not acknowledged by '" + result.getTopic() + "'",
                                result.getCause()));
                    }
                    stats.recordPublished();
                    return Mono.<Void>empty();
                })
                .doFinally(signal -> state = ConsumerState.IDLE);
    }

    public ConsumerState getState() {
        return state;
    }

    private OrderCreatedEvent parse(String payload) {
        if (payload == null) {
            log.warn("Skipping record with empty payload");
            return null;
        }
        try {
            OrderCreatedEvent event = objectMapper.readValue(payload, OrderCreatedEvent.class);
            if (event == null || event.getOrderId() == null) {
                // An outcome cannot be correlated without an order ID
                log.warn("Skipping OrderCreatedEvent without orderId: {}", payload);
                return null;
            }
            return event;
        } catch (JsonProcessingException e) {
            log.error("Skipping malformed OrderCreatedEvent payload: {} ({})", payload,
                    e.getOriginalMessage());
            return null;
        }
    }
}
