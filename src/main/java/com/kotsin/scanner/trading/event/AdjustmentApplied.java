package com.kotsin.scanner.trading.event;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AdjustmentApplied implements TradeEvent {

    String tradeId;
    String symbol;
    double oldStopLoss;
    double newStopLoss;
    double oldTakeProfit;
    double newTakeProfit;
    String reason;
    Instant time;
}
