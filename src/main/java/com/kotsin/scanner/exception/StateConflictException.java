package com.kotsin.scanner.exception;

import com.kotsin.scanner.trading.state.TradeState;

/**
 * Exception thrown when the compare-and-set write of a trade loses against a concurrent writer.
 * Not a hard failure: the caller re-reads the trade and re-runs the evaluation.
 */
public class StateConflictException extends RuntimeException {

    private final String tradeId;
    private final TradeState expectedState;
    private final long expectedVersion;

    public StateConflictException(String tradeId, TradeState expectedState, long expectedVersion) {
        super(String.format("[%s] Trade changed concurrently (expected state=%s, version=%d)",
                tradeId, expectedState, expectedVersion));
        this.tradeId = tradeId;
        this.expectedState = expectedState;
        this.expectedVersion = expectedVersion;
    }

    public String getTradeId() {
        return tradeId;
    }

    public TradeState getExpectedState() {
        return expectedState;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
