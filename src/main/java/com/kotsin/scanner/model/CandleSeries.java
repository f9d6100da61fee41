package com.kotsin.scanner.model;

import com.kotsin.scanner.exception.InvariantViolationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * CandleSeries - immutable, strictly time-ordered bars for one (symbol, timeframe) pair.
 *
 * Produced by a {@code CandleProvider}; every analysis component reads it and none mutates it.
 */
public final class CandleSeries {

    private final String symbol;
    private final Timeframe timeframe;
    private final List<Candle> candles;

    private CandleSeries(String symbol, Timeframe timeframe, List<Candle> candles) {
        this.symbol = symbol;
        this.timeframe = timeframe;
        this.candles = candles;
    }

    /**
     * Build a series, rejecting duplicate or out-of-order timestamps.
     */
    public static CandleSeries of(String symbol, Timeframe timeframe, List<Candle> candles) {
        if (symbol == null || timeframe == null) {
            throw new InvariantViolationException("CandleSeries", "symbol and timeframe are required");
        }
        List<Candle> copy = new ArrayList<>(candles == null ? List.of() : candles);
        for (int i = 1; i < copy.size(); i++) {
            Instant previous = copy.get(i - 1).getOpenTime();
            Instant current = copy.get(i).getOpenTime();
            if (!current.isAfter(previous)) {
                throw new InvariantViolationException("CandleSeries",
                        String.format("%s %s timestamps not strictly increasing at index %d (%s after %s)",
                                symbol, timeframe, i, current, previous));
            }
        }
        return new CandleSeries(symbol, timeframe, Collections.unmodifiableList(copy));
    }

    public static CandleSeries empty(String symbol, Timeframe timeframe) {
        return new CandleSeries(symbol, timeframe, List.of());
    }

    public String getSymbol() {
        return symbol;
    }

    public Timeframe getTimeframe() {
        return timeframe;
    }

    public List<Candle> getCandles() {
        return candles;
    }

    public int size() {
        return candles.size();
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    public Candle get(int index) {
        return candles.get(index);
    }

    public Optional<Candle> last() {
        return candles.isEmpty() ? Optional.empty() : Optional.of(candles.get(candles.size() - 1));
    }

    /**
     * Bars whose open time is at or after {@code since}.
     */
    public CandleSeries since(Instant since) {
        if (since == null) {
            return this;
        }
        List<Candle> kept = candles.stream()
                .filter(c -> !c.getOpenTime().isBefore(since))
                .toList();
        return new CandleSeries(symbol, timeframe, kept);
    }

    @Override
    public String toString() {
        return String.format("CandleSeries[%s %s, %d bars]", symbol, timeframe, candles.size());
    }
}
