package com.lox.inventoryreservation.api.exceptions;

/**
 * Thrown by the order consumer when an outcome could not be published, so the record is
 * redelivered instead of committed.
 */
public class OutcomePublishException extends RuntimeException {

    public OutcomePublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
