package com.kotsin.scanner.model;

import com.kotsin.scanner.exception.InvariantViolationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Candle - one closed OHLCV bar.
 *
 * Immutable once built. Construction rejects bars whose high/low do not bracket open and close.
 */
@Value
public class Candle {

    Instant openTime;
    double open;
    double high;
    double low;
    double close;
    double volume;

    @Builder
    public Candle(Instant openTime, double open, double high, double low, double close, double volume) {
        if (openTime == null) {
            throw new InvariantViolationException("Candle", "openTime is required");
        }
        if (!Double.isFinite(open) || !Double.isFinite(high) || !Double.isFinite(low) || !Double.isFinite(close)) {
            throw new InvariantViolationException("Candle", "non-finite price at " + openTime);
        }
        if (high < low || high < Math.max(open, close) || low > Math.min(open, close)) {
            throw new InvariantViolationException("Candle",
                    String.format("inconsistent OHLC at %s: o=%s h=%s l=%s c=%s", openTime, open, high, low, close));
        }
        this.openTime = openTime;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    public boolean isBullish() {
        return close > open;
    }

    public boolean isBearish() {
        return close < open;
    }

    public double body() {
        return Math.abs(close - open);
    }

    public double range() {
        return high - low;
    }

    public double upperWick() {
        return high - Math.max(open, close);
    }

    public double lowerWick() {
        return Math.min(open, close) - low;
    }

    /**
     * Instant at which this bar closes for the given timeframe.
     */
    public Instant closeTime(Timeframe timeframe) {
        return openTime.plus(timeframe.getBarDuration());
    }
}
