package com.lox.inventoryreservation.api.kafka.config;

import com.lox.inventoryreservation.api.kafka.consumer.ConsumerLoopStats;
import com.lox.inventoryreservation.common.config.ReservationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;

@Configuration
public class KafkaListenerConfig {

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> orderListenerContainerFactory(
            ConsumerFactory<String, String> consumerFactory,
            OrderListenerErrorHandler orderListenerErrorHandler,
            ReservationProperties properties) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory);
        // One thread per instance: records are handled strictly in partition order
        factory.setConcurrency(1);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);
        factory.getContainerProperties()
                .setShutdownTimeout(properties.getShutdownTimeout().toMillis());
        factory.setCommonErrorHandler(orderListenerErrorHandler);
        return factory;
    }

    @Bean
    public OrderListenerErrorHandler orderListenerErrorHandler(ConsumerLoopStats stats,
            ReservationProperties properties) {
        return new OrderListenerErrorHandler(stats, properties);
    }
}
