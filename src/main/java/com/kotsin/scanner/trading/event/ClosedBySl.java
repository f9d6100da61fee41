package com.kotsin.scanner.trading.event;

import lombok.Value;

import java.time.Instant;

/**
 * Stop-loss level was touched; the trade closed at the stop.
 */
@Value
public class ClosedBySl implements TradeEvent {

    CloseDetails details;

    @Override
    public String getTradeId() {
        return details.getTradeId();
    }

    @Override
    public String getSymbol() {
        return details.getSymbol();
    }

    @Override
    public Instant getTime() {
        return details.getCloseTime();
    }
}
