package com.lox.inventoryreservation.api.kafka.producer;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Acknowledgement of an outcome send, returned to the consumer so it can decide whether the
 * record's offset may advance.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class PublishResult {

    private final boolean published;
    private final String topic;
    private final long offset;
    private final Throwable cause;

    public static PublishResult published(String topic, long offset) {
        return new PublishResult(true, topic, offset, null);
    }

    public static PublishResult failed(String topic, Throwable cause) {
        return new PublishResult(false, topic, -1L, cause);
    }
}
