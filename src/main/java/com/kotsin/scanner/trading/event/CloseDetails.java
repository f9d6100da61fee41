package com.kotsin.scanner.trading.event;

import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.trading.state.Trade;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of a trade at the moment it closed.
 */
@Value
@Builder
public class CloseDetails {

    String tradeId;
    String symbol;
    Direction direction;
    double entryPrice;
    double closePrice;
    double stopLoss;
    double takeProfit;
    double rMultiple;
    Duration holding;
    Instant closeTime;
    String reason;

    public static CloseDetails of(Trade closed) {
        return CloseDetails.builder()
                .tradeId(closed.getId())
                .symbol(closed.getSymbol())
                .direction(closed.getDirection())
                .entryPrice(closed.getEntryPrice())
                .closePrice(closed.getClosePrice())
                .stopLoss(closed.getStopLoss())
                .takeProfit(closed.getTakeProfit())
                .rMultiple(closed.rMultipleAt(closed.getClosePrice()))
                .holding(closed.holdingDuration(closed.getCloseTime()))
                .closeTime(closed.getCloseTime())
                .reason(closed.getCloseReason())
                .build();
    }
}
