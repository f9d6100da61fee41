package com.kotsin.scanner.mtf;

import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Timeframe;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * MultiTimeframeContext - one scan's snapshot of every timeframe for a symbol.
 *
 * Built fresh per evaluation and discarded afterwards. {@code lastSeenH4BarTime} is the
 * caller's record of the newest H4 bar it has already evaluated (null on the first scan).
 */
@Getter
@ToString(exclude = "series")
public class MultiTimeframeContext {

    private final String symbol;
    private final Instant evaluationTime;
    private final double currentPrice;
    private final Instant lastSeenH4BarTime;
    private final Map<Timeframe, CandleSeries> series;

    @Builder
    public MultiTimeframeContext(String symbol, Instant evaluationTime, double currentPrice,
                                 Instant lastSeenH4BarTime, Map<Timeframe, CandleSeries> series) {
        this.symbol = symbol;
        this.evaluationTime = evaluationTime;
        this.currentPrice = currentPrice;
        this.lastSeenH4BarTime = lastSeenH4BarTime;
        this.series = series == null || series.isEmpty()
                ? new EnumMap<>(Timeframe.class)
                : new EnumMap<>(series);
    }

    /**
     * Series for the timeframe, or empty when it was not loaded or holds no bars.
     */
    public Optional<CandleSeries> series(Timeframe timeframe) {
        CandleSeries s = series.get(timeframe);
        return s == null || s.isEmpty() ? Optional.empty() : Optional.of(s);
    }
}
