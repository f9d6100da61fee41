package com.kotsin.scanner.indicator;

import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleSeries;

import java.util.List;
import java.util.OptionalDouble;

/**
 * AtrCalculator - true range and Wilder-smoothed Average True Range.
 *
 * TR(0)  = high - low (no previous close)
 * TR(t)  = max(high - low, |high - prevClose|, |low - prevClose|)
 * ATR    = mean(TR(0..period-1)), then ATR(t) = ATR(t-1) + (TR(t) - ATR(t-1)) / period
 */
public final class AtrCalculator {

    private AtrCalculator() {
    }

    public static double[] trueRanges(List<Candle> candles) {
        double[] tr = new double[candles.size()];
        for (int i = 0; i < candles.size(); i++) {
            Candle current = candles.get(i);
            if (i == 0) {
                tr[i] = current.range();
                continue;
            }
            double prevClose = candles.get(i - 1).getClose();
            tr[i] = Math.max(current.range(),
                    Math.max(Math.abs(current.getHigh() - prevClose),
                            Math.abs(current.getLow() - prevClose)));
        }
        return tr;
    }

    /**
     * Wilder ATR at the last bar, or empty when the series has fewer than {@code period} bars.
     */
    public static OptionalDouble wilderAtr(CandleSeries series, int period) {
        if (period <= 0 || series.size() < period) {
            return OptionalDouble.empty();
        }
        double[] tr = trueRanges(series.getCandles());

        double atr = 0;
        for (int i = 0; i < period; i++) {
            atr += tr[i];
        }
        atr /= period;

        for (int i = period; i < tr.length; i++) {
            atr = atr + (tr[i] - atr) / period;
        }
        return OptionalDouble.of(atr);
    }

    /**
     * Simple mean of the {@code window} true ranges ending at {@code endIndex} (inclusive).
     * Returns NaN when the window does not fit.
     */
    public static double trailingMean(double[] trueRanges, int endIndex, int window) {
        int start = endIndex - window + 1;
        if (window <= 0 || start < 0 || endIndex >= trueRanges.length) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = start; i <= endIndex; i++) {
            sum += trueRanges[i];
        }
        return sum / window;
    }
}
