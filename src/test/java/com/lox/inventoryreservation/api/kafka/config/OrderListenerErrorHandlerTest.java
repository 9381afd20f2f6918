package com.lox.inventoryreservation.api.kafka.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.lox.inventoryreservation.api.kafka.consumer.ConsumerLoopStats;
import com.lox.inventoryreservation.common.config.ReservationProperties;
import java.time.Duration;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.listener.MessageListenerContainer;

@DisplayName("OrderListenerErrorHandler")
class OrderListenerErrorHandlerTest {

    private ConsumerLoopStats stats;
    private OrderListenerErrorHandler errorHandler;

    @BeforeEach
    void setUp() {
        ReservationProperties properties = new ReservationProperties();
        properties.setReadBackoffInitial(Duration.ofMillis(5));
        properties.setReadBackoffMax(Duration.ofMillis(40));
        stats = new ConsumerLoopStats();
        errorHandler = new OrderListenerErrorHandler(stats, properties);
    }

    @Test
    @DisplayName("doubles the read backoff up to its cap")
    void shouldGrowReadBackoffUpToCap() {
        assertThat(errorHandler.readBackoffMillis(1)).isEqualTo(5L);
        assertThat(errorHandler.readBackoffMillis(2)).isEqualTo(10L);
        assertThat(errorHandler.readBackoffMillis(3)).isEqualTo(20L);
        assertThat(errorHandler.readBackoffMillis(4)).isEqualTo(40L);
        assertThat(errorHandler.readBackoffMillis(50)).isEqualTo(40L);
    }

    @Test
    @DisplayName("counts read errors without giving up")
    void shouldCountReadErrors() {
        MessageListenerContainer container = mock(MessageListenerContainer.class);
        Consumer<?, ?> consumer = mock(Consumer.class);

        errorHandler.handleOtherException(new TimeoutException("poll timed out"), consumer, container, false);
        errorHandler.handleOtherException(new TimeoutException("poll timed out"), consumer, container, false);

        assertThat(stats.getReadFailures()).isEqualTo(2);
        assertThat(stats.getConsecutiveReadFailures()).isEqualTo(2);
    }

    @Test
    @DisplayName("restarts the backoff sequence once a record is received")
    void shouldResetConsecutiveFailuresOnReceive() {
        MessageListenerContainer container = mock(MessageListenerContainer.class);
        Consumer<?, ?> consumer = mock(Consumer.class);

        errorHandler.handleOtherException(new TimeoutException("poll timed out"), consumer, container, false);
        stats.recordReceived();
        errorHandler.handleOtherException(new TimeoutException("poll timed out"), consumer, container, false);

        assertThat(stats.getReadFailures()).isEqualTo(2);
        assertThat(stats.getConsecutiveReadFailures()).isEqualTo(1);
    }
}
