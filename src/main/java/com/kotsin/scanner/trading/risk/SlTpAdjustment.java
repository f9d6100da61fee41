package com.kotsin.scanner.trading.risk;

import lombok.Builder;
import lombok.Value;

/**
 * A recommended change to an open trade. For CLOSE_EARLY the levels are the trade's current ones.
 */
@Value
@Builder
public class SlTpAdjustment {

    public enum Action {
        MOVE_STOP_TO_BREAK_EVEN,
        TRAIL_STOP,
        CLOSE_EARLY
    }

    Action action;
    double newStopLoss;
    double newTakeProfit;
    String reason;
}
