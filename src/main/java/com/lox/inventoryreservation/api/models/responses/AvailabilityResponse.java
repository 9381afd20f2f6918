package com.lox.inventoryreservation.api.models.responses;

import com.lox.inventoryreservation.api.models.StockRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityResponse {

    private boolean available;
    private int quantity;

    public static AvailabilityResponse fromRecord(StockRecord record) {
        int quantity = record.getQuantity();
        return AvailabilityResponse.builder()
                .available(quantity > 0)
                .quantity(quantity)
                .build();
    }
}
