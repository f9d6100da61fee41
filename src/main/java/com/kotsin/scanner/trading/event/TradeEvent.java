package com.kotsin.scanner.trading.event;

import java.time.Instant;

/**
 * A notification emitted for exactly one successful trade transition.
 */
public interface TradeEvent {

    String getTradeId();

    String getSymbol();

    /**
     * When the transition happened (bar time for level hits, evaluation time otherwise).
     */
    Instant getTime();

    default String getEventType() {
        return getClass().getSimpleName();
    }
}
