package com.lox.inventoryreservation.api.controllers;

import com.lox.inventoryreservation.api.exceptions.InventoryNotFoundException;
import com.lox.inventoryreservation.api.models.requests.InventoryRequest;
import com.lox.inventoryreservation.api.models.responses.AvailabilityResponse;
import com.lox.inventoryreservation.api.services.InventoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/inventory")
@RequiredArgsConstructor
@Slf4j
public class InventoryController {

    private final InventoryService inventoryService;

    @GetMapping("/{productId}")
    public Mono<ResponseEntity<AvailabilityResponse>> getInventory(
            @PathVariable("productId") String productId) {
        return parseProductId(productId)
                .flatMap(inventoryService::getAvailability)
                .map(ResponseEntity::ok);
    }

    @PostMapping
    public Mono<ResponseEntity<Void>> createInventory(@Valid @RequestBody InventoryRequest request) {
        return inventoryService.createInventory(request)
                .then(Mono.just(ResponseEntity.status(HttpStatus.CREATED).<Void>build()));
    }

    @PutMapping("/{productId}")
    public Mono<ResponseEntity<Void>> updateInventory(
            @PathVariable("productId") Long productId,
            @Valid @RequestBody InventoryRequest request) {
        return inventoryService.updateInventory(productId, request)
                .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    // A product ID that cannot exist is reported like any other unknown product
    private static Mono<Long> parseProductId(String productId) {
        try {
            return Mono.just(Long.valueOf(productId));
        } catch (NumberFormatException e) {
            log.info("Non-numeric Product ID requested: {}", productId);
            return Mono.error(new InventoryNotFoundException(
                    "Inventory not found for Product ID: " + productId));
        }
    }
}
