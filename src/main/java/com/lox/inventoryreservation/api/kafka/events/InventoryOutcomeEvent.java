// src/main/java/com/lox/inventoryreservation/api/kafka/events/InventoryOutcomeEvent.java

package com.lox.inventoryreservation.api.kafka.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lox.inventoryreservation.api.models.InventoryReservation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a reservation attempt. Published to {@code inventory-reserved} or
 * {@code inventory-failed} depending on {@link #status}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryOutcomeEvent {

    public static final String RESERVED_MESSAGE = "Reserved successfully";
    public static final String NOT_ENOUGH_STOCK = "Not enough stock";
    public static final String PRODUCT_NOT_FOUND = "Product not found";
    public static final String INVALID_EVENT = "invalid event";
    public static final String TRANSIENT_ERROR = "transient error";

    @JsonProperty("orderId")
    private Long orderId;

    @JsonProperty("status")
    private OutcomeStatus status;

    @JsonProperty("message")
    private String message;

    public static InventoryOutcomeEvent reserved(Long orderId) {
        return new InventoryOutcomeEvent(orderId, OutcomeStatus.RESERVED, RESERVED_MESSAGE);
    }

    public static InventoryOutcomeEvent failed(Long orderId, String reason) {
        return new InventoryOutcomeEvent(orderId, OutcomeStatus.FAILED, reason);
    }

    /**
     * Rebuilds the outcome of a decision already taken for this order.
     */
    public static InventoryOutcomeEvent fromReservation(InventoryReservation reservation) {
        return new InventoryOutcomeEvent(reservation.getOrderId(), reservation.getStatus(),
                reservation.getMessage());
    }
}
