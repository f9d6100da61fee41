package com.kotsin.scanner.trading.event;

import lombok.Value;

import java.time.Instant;

/**
 * Trade closed early on an applied close recommendation or an explicit manual close.
 */
@Value
public class ClosedManual implements TradeEvent {

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
