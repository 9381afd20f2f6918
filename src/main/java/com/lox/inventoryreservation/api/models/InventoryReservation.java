package com.lox.inventoryreservation.api.models;

import com.lox.inventoryreservation.api.kafka.events.InventoryOutcomeEvent;
import com.lox.inventoryreservation.api.kafka.events.OrderCreatedEvent;
import com.lox.inventoryreservation.api.kafka.events.OutcomeStatus;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ledger row recording the single decision taken for an order. Written in the same transaction as
 * the stock decrement, keyed by order ID.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryReservation {

    private Long orderId;
    private Long productId;
    private Integer quantity;
    private OutcomeStatus status;
    private String message;
    private Instant createdAt;

    public static InventoryReservation fromDecision(OrderCreatedEvent event,
            InventoryOutcomeEvent outcome) {
        return InventoryReservation.builder()
                .orderId(event.getOrderId())
                .productId(event.getProductId())
                .quantity(event.getQuantity())
                .status(outcome.getStatus())
                .message(outcome.getMessage())
                .createdAt(Instant.now())
                .build();
    }
}
