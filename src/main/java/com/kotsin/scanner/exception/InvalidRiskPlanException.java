package com.kotsin.scanner.exception;

/**
 * Exception thrown when a signal cannot be priced: non-positive stop distance or non-finite size.
 */
public class InvalidRiskPlanException extends RuntimeException {

    private final String symbol;

    public InvalidRiskPlanException(String symbol, String message) {
        super(String.format("[%s] Invalid risk plan: %s", symbol, message));
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
