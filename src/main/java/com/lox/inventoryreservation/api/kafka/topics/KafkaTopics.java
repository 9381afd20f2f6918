// src/main/java/com/lox/inventoryreservation/api/kafka/topics/KafkaTopics.java

package com.lox.inventoryreservation.api.kafka.topics;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class KafkaTopics {

    // Published by the order service, keyed by product ID
    public static final String ORDERS_TOPIC = "orders";

    public static final String INVENTORY_RESERVED_TOPIC = "inventory-reserved";
    public static final String INVENTORY_FAILED_TOPIC = "inventory-failed";

    @Bean
    public NewTopic inventoryReservedTopic() {
        return new NewTopic(INVENTORY_RESERVED_TOPIC, 3, (short) 1);
    }

    @Bean
    public NewTopic inventoryFailedTopic() {
        return new NewTopic(INVENTORY_FAILED_TOPIC, 3, (short) 1);
    }
}
