package com.lox.inventoryreservation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InventoryReservationApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryReservationApplication.class, args);
    }
}
