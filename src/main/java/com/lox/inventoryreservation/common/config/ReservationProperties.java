package com.lox.inventoryreservation.common.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "inventory.reservation")
public class ReservationProperties {

    /**
     * Deadline for one store transaction (ledger lookup, conditional decrement, ledger insert).
     */
    @NotNull
    private Duration storeTimeout = Duration.ofSeconds(2);

    /**
     * Deadline for one send of an outcome event, before the publisher retries.
     */
    @NotNull
    private Duration publishTimeout = Duration.ofSeconds(12);

    /**
     * Upper bound on a full consume cycle (reserve and publish, retries included).
     */
    @NotNull
    private Duration cycleTimeout = Duration.ofSeconds(60);

    @NotNull
    private Duration readBackoffInitial = Duration.ofMillis(500);

    @NotNull
    private Duration readBackoffMax = Duration.ofSeconds(30);

    @NotNull
    private Duration redeliveryBackoffInitial = Duration.ofSeconds(1);

    @NotNull
    private Duration redeliveryBackoffMax = Duration.ofSeconds(30);

    /**
     * How long the listener container waits for an in-flight cycle when stopping.
     */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(30);
}
