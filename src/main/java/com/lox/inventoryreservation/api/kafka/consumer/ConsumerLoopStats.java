package com.lox.inventoryreservation.api.kafka.consumer;

import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Counters for the order consumer loop.
 */
@Component
public class ConsumerLoopStats {

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong publishFailures = new AtomicLong();
    private final AtomicLong readFailures = new AtomicLong();
    private final AtomicLong consecutiveReadFailures = new AtomicLong();

    public void recordReceived() {
        received.incrementAndGet();
        consecutiveReadFailures.set(0);
    }

    public void recordMalformed() {
        malformed.incrementAndGet();
    }

    public void recordPublished() {
        published.incrementAndGet();
    }

    public void recordPublishFailure() {
        publishFailures.incrementAndGet();
    }

    /**
     * @return consecutive read failures since the last received record, this one included
     */
    public long recordReadFailure() {
        readFailures.incrementAndGet();
        return consecutiveReadFailures.incrementAndGet();
    }

    public long getReceived() {
        return received.get();
    }

    public long getMalformed() {
        return malformed.get();
    }

    public long getPublished() {
        return published.get();
    }

    public long getPublishFailures() {
        return publishFailures.get();
    }

    public long getReadFailures() {
        return readFailures.get();
    }

    public long getConsecutiveReadFailures() {
        return consecutiveReadFailures.get();
    }
}
