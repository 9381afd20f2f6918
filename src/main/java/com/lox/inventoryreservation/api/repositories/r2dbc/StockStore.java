package com.lox.inventoryreservation.api.repositories.r2dbc;

import com.lox.inventoryreservation.api.models.StockRecord;
import reactor.core.publisher.Mono;

public interface StockStore {

    /**
     * Point read of the current quantity. Completes empty when the product is unknown.
     */
    Mono<Integer> getQuantity(Long productId);

    /**
     * Decrements the quantity by {@code amount} in a single conditional statement, only when the
     * current quantity covers it.
     */
    Mono<ReserveResult> tryReserve(Long productId, int amount);

    Mono<StockRecord> findRecord(Long productId);

    Mono<StockRecord> insert(Long productId, int quantity);

    /**
     * @return number of rows updated, 0 when the product is unknown
     */
    Mono<Long> updateQuantity(Long productId, int quantity);
}
