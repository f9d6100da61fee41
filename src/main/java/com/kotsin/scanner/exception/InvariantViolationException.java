package com.kotsin.scanner.exception;

/**
 * Thrown when a domain object is constructed with values that break one of its invariants
 * (zone high not above low, stop on the wrong side of entry, unsorted candles).
 * The offending object is never created and the value is never silently corrected.
 */
public class InvariantViolationException extends RuntimeException {

    private final String entity;

    public InvariantViolationException(String entity, String message) {
        super(String.format("[%s] %s", entity, message));
        this.entity = entity;
    }

    public String getEntity() {
        return entity;
    }
}
