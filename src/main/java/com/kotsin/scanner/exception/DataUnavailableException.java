package com.kotsin.scanner.exception;

import com.kotsin.scanner.model.Timeframe;

/**
 * Exception thrown when the candle provider cannot return a series at all.
 */
public class DataUnavailableException extends RuntimeException {

    private final String symbol;
    private final Timeframe timeframe;

    public DataUnavailableException(String symbol, Timeframe timeframe, String message) {
        super(String.format("[%s:%s] %s", symbol, timeframe, message));
        this.symbol = symbol;
        this.timeframe = timeframe;
    }

    public DataUnavailableException(String symbol, Timeframe timeframe, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", symbol, timeframe, message), cause);
        this.symbol = symbol;
        this.timeframe = timeframe;
    }

    public String getSymbol() {
        return symbol;
    }

    public Timeframe getTimeframe() {
        return timeframe;
    }
}
