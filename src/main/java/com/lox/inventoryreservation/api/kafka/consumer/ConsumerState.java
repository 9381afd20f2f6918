package com.lox.inventoryreservation.api.kafka.consumer;

public enum ConsumerState {
    IDLE,
    PROCESSING,
    PUBLISHING
}
