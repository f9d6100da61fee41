package com.kotsin.scanner.model;

import java.time.Duration;

/**
 * Timeframes the scanner works with, from the H4 bias timeframe down to M1 entries.
 */
public enum Timeframe {
    H4("240m", Duration.ofHours(4), Duration.ofDays(30)),
    H1("60m", Duration.ofHours(1), Duration.ofDays(14)),
    M30("30m", Duration.ofMinutes(30), Duration.ofDays(7)),
    M15("15m", Duration.ofMinutes(15), Duration.ofDays(7)),
    M5("5m", Duration.ofMinutes(5), Duration.ofDays(3)),
    M1("1m", Duration.ofMinutes(1), Duration.ofDays(1));

    private final String interval;
    private final Duration barDuration;
    private final Duration defaultLookback;

    Timeframe(String interval, Duration barDuration, Duration defaultLookback) {
        this.interval = interval;
        this.barDuration = barDuration;
        this.defaultLookback = defaultLookback;
    }

    /**
     * Interval code understood by the historical candle API ("240m", "5m", ...).
     */
    public String getInterval() {
        return interval;
    }

    public Duration getBarDuration() {
        return barDuration;
    }

    public Duration getDefaultLookback() {
        return defaultLookback;
    }
}
