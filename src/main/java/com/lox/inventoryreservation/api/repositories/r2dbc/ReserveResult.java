package com.lox.inventoryreservation.api.repositories.r2dbc;

/**
 * Result of a conditional decrement against the stock table.
 */
public enum ReserveResult {
    RESERVED,
    INSUFFICIENT_STOCK,
    NOT_FOUND
}
