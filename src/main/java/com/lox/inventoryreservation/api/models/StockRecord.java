package com.lox.inventoryreservation.api.models;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the {@code inventories} table. Quantity is never negative in a committed state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockRecord {

    private Long productId;
    private Integer quantity;
    private Instant updatedAt;
}
