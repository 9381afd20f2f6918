package com.lox.inventoryreservation.api.kafka.events;

import com.lox.inventoryreservation.api.kafka.topics.KafkaTopics;
import lombok.Getter;

@Getter
public enum OutcomeStatus {

    RESERVED(KafkaTopics.INVENTORY_RESERVED_TOPIC),
    FAILED(KafkaTopics.INVENTORY_FAILED_TOPIC);

    private final String topic;

    OutcomeStatus(String topic) {
        this.topic = topic;
    }
}
