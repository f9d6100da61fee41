package com.kotsin.scanner.trading.strategy;

import com.kotsin.scanner.model.Direction;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Signal - one trading idea produced by a strategy.
 *
 * Immutable. {@code estimatedRr} stays null until the risk estimator has priced the signal;
 * {@link #withEstimatedRr(double)} returns a priced copy.
 */
@Value
@Builder(toBuilder = true)
public class Signal {

    String id;
    String symbol;
    Direction direction;
    Instant time;
    double entryPrice;
    String strategyName;
    String rationale;
    Double estimatedRr;

    /**
     * Open time of the H4 bar whose close produced this signal.
     */
    Instant h4BarTime;

    public Signal withEstimatedRr(double rr) {
        return toBuilder().estimatedRr(rr).build();
    }
}
