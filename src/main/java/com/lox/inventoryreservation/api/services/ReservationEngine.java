package com.lox.inventoryreservation.api.services;

import com.lox.inventoryreservation.api.kafka.events.InventoryOutcomeEvent;
import com.lox.inventoryreservation.api.kafka.events.OrderCreatedEvent;
import reactor.core.publisher.Mono;

public interface ReservationEngine {

    /**
     * Decides whether the order can be served and applies the stock decrement when it can. Never
     * errors: every failure is expressed as a FAILED outcome.
     */
    Mono<InventoryOutcomeEvent> reserve(OrderCreatedEvent event);
}
