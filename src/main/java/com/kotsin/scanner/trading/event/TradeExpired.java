package com.kotsin.scanner.trading.event;

import lombok.Value;

import java.time.Instant;

/**
 * Trade reached the maximum holding duration and closed at the bar close.
 */
@Value
public class TradeExpired implements TradeEvent {

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
