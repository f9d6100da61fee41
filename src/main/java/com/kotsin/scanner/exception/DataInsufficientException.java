package com.kotsin.scanner.exception;

/**
 * Exception thrown when a series exists but holds fewer bars than a calculation needs.
 * Callers skip the evaluation for that symbol and log a warning.
 */
public class DataInsufficientException extends RuntimeException {

    private final String symbol;

    public DataInsufficientException(String symbol, String message) {
        super(String.format("[%s] %s", symbol, message));
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
