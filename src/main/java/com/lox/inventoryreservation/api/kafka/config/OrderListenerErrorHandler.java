package com.lox.inventoryreservation.api.kafka.config;

import com.lox.inventoryreservation.api.kafka.consumer.ConsumerLoopStats;
import com.lox.inventoryreservation.common.config.ReservationProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.ListenerUtils;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Error handling for the order consumer.
 * <ul>
 *     <li>A failed cycle re-seeks the record and redelivers it with exponential backoff, capped
 *     in interval but not in attempts, so the offset never advances past an unpublished
 *     outcome.</li>
 *     <li>Errors raised outside record processing (poll, commit) are counted and followed by a
 *     bounded backoff before the container polls again.</li>
 * </ul>
 */
@Slf4j
public class OrderListenerErrorHandler extends DefaultErrorHandler {

    private final ConsumerLoopStats stats;
    private final long readBackoffInitialMs;
    private final long readBackoffMaxMs;

    public OrderListenerErrorHandler(ConsumerLoopStats stats, ReservationProperties properties) {
        super(redeliveryBackOff(properties));
        this.stats = stats;
        this.readBackoffInitialMs = properties.getReadBackoffInitial().toMillis();
        this.readBackoffMaxMs = properties.getReadBackoffMax().toMillis();
        setRetryListeners((record, ex, deliveryAttempt) ->
                log.error("ALERT: order record {}-{}@{} failed delivery attempt {}, redelivering: {}",
                        record.topic(), record.partition(), record.offset(), deliveryAttempt,
                        ex.getMessage()));
    }

    @Override
    public void handleOtherException(Exception thrownException, Consumer<?, ?> consumer,
            MessageListenerContainer container, boolean batchListener) {
        long consecutive = stats.recordReadFailure();
        long delay = readBackoffMillis(consecutive);
        log.error("Kafka read error (consecutive failures: {}, total: {}), retrying in {} ms",
                consecutive, stats.getReadFailures(), delay, thrownException);
        try {
            ListenerUtils.stoppableSleep(container, delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    long readBackoffMillis(long consecutiveFailures) {
        long delay = readBackoffInitialMs;
        for (long i = 1; i < consecutiveFailures && delay < readBackoffMaxMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, readBackoffMaxMs);
    }

    private static ExponentialBackOff redeliveryBackOff(ReservationProperties properties) {
        ExponentialBackOff backOff = new ExponentialBackOff(
                properties.getRedeliveryBackoffInitial().toMillis(), 2.0);
        backOff.setMaxInterval(properties.getRedeliveryBackoffMax().toMillis());
        return backOff;
    }
}
