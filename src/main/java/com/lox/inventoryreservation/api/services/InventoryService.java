package com.lox.inventoryreservation.api.services;

import com.lox.inventoryreservation.api.models.requests.InventoryRequest;
import com.lox.inventoryreservation.api.models.responses.AvailabilityResponse;
import reactor.core.publisher.Mono;

public interface InventoryService {

    Mono<AvailabilityResponse> getAvailability(Long productId);

    Mono<Void> createInventory(InventoryRequest request);

    Mono<Void> updateInventory(Long productId, InventoryRequest request);
}
