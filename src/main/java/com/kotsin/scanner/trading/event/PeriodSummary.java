package com.kotsin.scanner.trading.event;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Activity digest for one reporting period.
 */
@Value
@Builder
public class PeriodSummary {

    Instant from;
    Instant to;
    int opened;
    int closedByTp;
    int closedBySl;
    int closedManual;
    int expired;
    int stillOpen;
    double totalR;

    /**
     * Share of closed trades with positive R, or 0 when nothing closed.
     */
    double winRate;

    public int getClosed() {
        return closedByTp + closedBySl + closedManual + expired;
    }
}
