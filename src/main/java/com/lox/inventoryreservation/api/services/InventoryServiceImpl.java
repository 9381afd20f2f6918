package com.lox.inventoryreservation.api.services;

import com.lox.inventoryreservation.api.exceptions.InventoryNotFoundException;
import com.lox.inventoryreservation.api.models.requests.InventoryRequest;
import com.lox.inventoryreservation.api.models.responses.AvailabilityResponse;
import com.lox.inventoryreservation.api.repositories.r2dbc.StockStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryServiceImpl implements InventoryService {

    private final StockStore stockStore;

    @Override
    public Mono<AvailabilityResponse> getAvailability(Long productId) {
        log.info("Entered getAvailability with Product ID: {}", productId);

        return stockStore.findRecord(productId)
                .switchIfEmpty(Mono.error(new InventoryNotFoundException(
                        "Inventory not found for Product ID: " + productId)))
                .map(AvailabilityResponse::fromRecord)
                .doOnNext(response -> log.info("Product ID: {} has {} unit(s) available",
                        productId, response.getQuantity()));
    }

    @Override
    public Mono<Void> createInventory(InventoryRequest request) {
        log.info("Entered createInventory with request: {}", request);

        Long productId = request.getProductId();
        if (productId == null || productId <= 0) {
            log.info("Invalid Product ID in request: {}", request);
            return Mono.error(new IllegalArgumentException("A positive product_id must be provided."));
        }

        return stockStore.insert(productId, request.getQuantity())
                .doOnSuccess(record -> log.info("Inventory created for Product ID: {} with quantity {}",
                        productId, record.getQuantity()))
                .doOnError(e -> log.error("Error creating inventory for Product ID {}: {}",
                        productId, e.getMessage()))
                .then();
    }

    @Override
    public Mono<Void> updateInventory(Long productId, InventoryRequest request) {
        log.info("Entered updateInventory for Product ID: {} with request: {}", productId, request);

        return stockStore.updateQuantity(productId, request.getQuantity())
                .doOnNext(rows -> {
                    if (rows == 0) {
                        log.info("No inventory row to update for Product ID: {}", productId);
                    } else {
                        log.info("Inventory updated for Product ID: {} to quantity {}",
                                productId, request.getQuantity());
                    }
                })
                .then();
    }
}
