package com.lox.inventoryreservation.api.services;

import com.lox.inventoryreservation.api.kafka.events.InventoryOutcomeEvent;
import com.lox.inventoryreservation.api.kafka.events.OrderCreatedEvent;
import com.lox.inventoryreservation.api.models.InventoryReservation;
import com.lox.inventoryreservation.api.repositories.r2dbc.ReservationLedger;
import com.lox.inventoryreservation.api.repositories.r2dbc.ReserveResult;
import com.lox.inventoryreservation.api.repositories.r2dbc.StockStore;
import com.lox.inventoryreservation.common.config.ReservationProperties;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

@Service
@Slf4j
public class ReservationEngineImpl implements ReservationEngine {

    static final String STORE_RETRY = "stockStore";

    private final StockStore stockStore;
    private final ReservationLedger reservationLedger;
    private final TransactionalOperator transactionalOperator;
    private final ReservationProperties properties;
    private final Retry storeRetry;

    public ReservationEngineImpl(StockStore stockStore, ReservationLedger reservationLedger,
            TransactionalOperator transactionalOperator, ReservationProperties properties,
            RetryRegistry retryRegistry) {
        this.stockStore = stockStore;
        this.reservationLedger = reservationLedger;
        this.transactionalOperator = transactionalOperator;
        this.properties = properties;
        this.storeRetry = retryRegistry.retry(STORE_RETRY);
    }

    @Override
    public Mono<InventoryOutcomeEvent> reserve(OrderCreatedEvent event) {
        Long orderId = event.getOrderId();
        if (!isValid(event)) {
            log.warn("Rejecting invalid OrderCreatedEvent: {}", event);
            return Mono.just(InventoryOutcomeEvent.failed(orderId, InventoryOutcomeEvent.INVALID_EVENT));
        }

        log.info("Reserving {} unit(s) of Product ID: {} for Order ID: {}",
                event.getQuantity(), event.getProductId(), orderId);

        return transactionalOperator.transactional(Mono.defer(() -> decideOnce(event)))
                .timeout(properties.getStoreTimeout())
                .transformDeferred(RetryOperator.of(storeRetry))
                .doOnNext(outcome -> log.info("Order ID: {} -> {} ({})",
                        orderId, outcome.getStatus(), outcome.getMessage()))
                .onErrorResume(e -> {
                    log.error("Store unavailable while reserving for Order ID: {}: {}",
                            orderId, e.toString());
                    return Mono.just(
                            InventoryOutcomeEvent.failed(orderId, InventoryOutcomeEvent.TRANSIENT_ERROR));
                });
    }

    /**
     * Runs inside one transaction: a recorded decision is replayed as is, otherwise the
     * conditional decrement and the ledger row commit together.
     */
    private Mono<InventoryOutcomeEvent> decideOnce(OrderCreatedEvent event) {
        return reservationLedger.findByOrderId(event.getOrderId())
                .map(existing -> {
                    log.info("Order ID: {} already decided as {}, replaying outcome",
                            existing.getOrderId(), existing.getStatus());
                    return InventoryOutcomeEvent.fromReservation(existing);
                })
                .switchIfEmpty(Mono.defer(() ->
                        stockStore.tryReserve(event.getProductId(), event.getQuantity())
                                .map(result -> toOutcome(event.getOrderId(), result))
                                .flatMap(outcome -> reservationLedger
                                        .record(InventoryReservation.fromDecision(event, outcome))
                                        .thenReturn(outcome))));
    }

    private static InventoryOutcomeEvent toOutcome(Long orderId, ReserveResult result) {
        switch (result) {
            case RESERVED:
                return InventoryOutcomeEvent.reserved(orderId);
            case INSUFFICIENT_STOCK:
                return InventoryOutcomeEvent.failed(orderId, InventoryOutcomeEvent.NOT_ENOUGH_STOCK);
            case NOT_FOUND:
                return InventoryOutcomeEvent.failed(orderId, InventoryOutcomeEvent.PRODUCT_NOT_FOUND);
            default:
                throw new IllegalStateException("Unknown reserve result: " + result);
        }
    }

    private static boolean isValid(OrderCreatedEvent event) {
        return event.getOrderId() != null
                && event.getProductId() != null && event.getProductId() > 0
                && event.getQuantity() != null && event.getQuantity() > 0;
    }
}
