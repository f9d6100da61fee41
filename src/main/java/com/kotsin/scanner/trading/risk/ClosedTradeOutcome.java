package com.kotsin.scanner.trading.risk;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * One closed trade as seen by the statistics: excursions in price units (both non-negative),
 * realized R and time in the trade.
 */
@Value
@Builder
public class ClosedTradeOutcome {

    String tradeId;
    double mae;
    double mfe;
    double rMultiple;
    Duration holdingDuration;
    Instant closedAt;

    public boolean isWinner() {
        return rMultiple > 0;
    }
}
