package com.kotsin.scanner.smc.detector;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.smc.model.Bias;
import com.kotsin.scanner.smc.model.StructureEvent;
import com.kotsin.scanner.smc.model.SwingPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * FractalSwingStructureAnalyzer - swing points and structure breaks on one series.
 *
 * SWING: a bar whose high (low) is strictly above (below) every bar within
 * {@code swing-window} bars on both sides.
 *
 * STRUCTURE WALK (bar by bar, using only swings already confirmed by later bars):
 * - close above the active swing high  -> bullish BOS, or CHOCH if the trend was bearish
 * - wick above it but close at/below   -> bearish SWEEP
 * - mirror rules for the active swing low
 * A swing is consumed by the first break or sweep; the next confirmed swing replaces it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FractalSwingStructureAnalyzer implements SwingStructureAnalyzer {

    private final ScannerConfig config;

    @Override
    public int minimumBars() {
        return 2 * window() + 1;
    }

    @Override
    public List<SwingPoint> findSwings(CandleSeries series) {
        int window = window();
        if (series.size() < minimumBars()) {
            log.debug("[MKT_STRUCT] {} {}: not enough candles for swings: {} (need {})",
                    series.getSymbol(), series.getTimeframe(), series.size(), minimumBars());
            return List.of();
        }

        List<Candle> candles = series.getCandles();
        List<SwingPoint> swings = new ArrayList<>();

        for (int i = window; i < candles.size() - window; i++) {
            Candle pivot = candles.get(i);
            boolean isHigh = true;
            boolean isLow = true;

            for (int j = 1; j <= window && (isHigh || isLow); j++) {
                Candle before = candles.get(i - j);
                Candle after = candles.get(i + j);
                if (pivot.getHigh() <= before.getHigh() || pivot.getHigh() <= after.getHigh()) {
                    isHigh = false;
                }
                if (pivot.getLow() >= before.getLow() || pivot.getLow() >= after.getLow()) {
                    isLow = false;
                }
            }

            if (isHigh) {
                swings.add(swing(i, pivot, pivot.getHigh(), SwingPoint.Kind.HIGH));
            }
            if (isLow) {
                swings.add(swing(i, pivot, pivot.getLow(), SwingPoint.Kind.LOW));
            }
        }

        log.debug("[MKT_STRUCT] {} {}: {} swings from {} candles",
                series.getSymbol(), series.getTimeframe(), swings.size(), candles.size());
        return swings;
    }

    @Override
    public List<StructureEvent> findStructure(CandleSeries series, List<SwingPoint> swings) {
        if (series.size() < minimumBars() || swings.isEmpty()) {
            return List.of();
        }

        int window = window();
        List<Candle> candles = series.getCandles();
        List<SwingPoint> ordered = new ArrayList<>(swings);
        ordered.sort(Comparator.comparingInt(SwingPoint::getIndex));

        List<StructureEvent> events = new ArrayList<>();
        Bias trend = null;
        SwingPoint activeHigh = null;
        SwingPoint activeLow = null;
        int next = 0;

        for (int j = 0; j < candles.size(); j++) {
            // A swing is only known once its right-hand window has printed
            while (next < ordered.size() && ordered.get(next).getIndex() + window < j) {
                SwingPoint confirmed = ordered.get(next++);
                if (confirmed.isHigh()) {
                    activeHigh = confirmed;
                } else {
                    activeLow = confirmed;
                }
            }

            Candle bar = candles.get(j);

            if (activeHigh != null) {
                double level = activeHigh.getPrice();
                if (bar.getClose() > level) {
                    events.add(event(trend == Bias.BEARISH ? StructureEvent.Kind.CHOCH : StructureEvent.Kind.BOS,
                            Bias.BULLISH, bar.getClose(), level, j, bar));
                    trend = Bias.BULLISH;
                    activeHigh = null;
                } else if (bar.getHigh() > level) {
                    events.add(event(StructureEvent.Kind.SWEEP, Bias.BEARISH, bar.getHigh(), level, j, bar));
                    activeHigh = null;
                }
            }

            if (activeLow != null) {
                double level = activeLow.getPrice();
                if (bar.getClose() < level) {
                    events.add(event(trend == Bias.BULLISH ? StructureEvent.Kind.CHOCH : StructureEvent.Kind.BOS,
                            Bias.BEARISH, bar.getClose(), level, j, bar));
                    trend = Bias.BEARISH;
                    activeLow = null;
                } else if (bar.getLow() < level) {
                    events.add(event(StructureEvent.Kind.SWEEP, Bias.BULLISH, bar.getLow(), level, j, bar));
                    activeLow = null;
                }
            }
        }

        if (!events.isEmpty()) {
            StructureEvent last = events.get(events.size() - 1);
            log.debug("[MKT_STRUCT] {} {}: {} events, last {} {} at index {}",
                    series.getSymbol(), series.getTimeframe(), events.size(),
                    last.getBias(), last.getKind(), last.getIndex());
        }
        return events;
    }

    private int window() {
        return config.getStructure().getSwingWindow();
    }

    private static SwingPoint swing(int index, Candle candle, double price, SwingPoint.Kind kind) {
        return SwingPoint.builder()
                .index(index)
                .time(candle.getOpenTime())
                .price(price)
                .kind(kind)
                .build();
    }

    private static StructureEvent event(StructureEvent.Kind kind, Bias bias, double price, double level,
                                        int index, Candle bar) {
        return StructureEvent.builder()
                .kind(kind)
                .bias(bias)
                .price(price)
                .level(level)
                .index(index)
                .time(bar.getOpenTime())
                .build();
    }
}
