package com.lox.inventoryreservation.api.repositories.r2dbc;

import com.lox.inventoryreservation.api.models.InventoryReservation;
import reactor.core.publisher.Mono;

/**
 * Decisions already taken, one per order ID. Used to make reservation idempotent under
 * redelivery.
 */
public interface ReservationLedger {

    Mono<InventoryReservation> findByOrderId(Long orderId);

    /**
     * Fails with a data integrity violation if a decision is already recorded for the order.
     */
    Mono<Void> record(InventoryReservation reservation);
}
