package com.kotsin.scanner.indicator;

import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Timeframe;
import com.kotsin.scanner.support.TestCandles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static com.kotsin.scanner.support.TestCandles.hlc;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AtrCalculator - true range and Wilder ATR")
class AtrCalculatorTest {

    private final CandleSeries series = TestCandles.series(Timeframe.H4,
            hlc(Timeframe.H4, 0, 10, 8, 9),
            hlc(Timeframe.H4, 1, 12, 9, 11),
            hlc(Timeframe.H4, 2, 11, 10, 10.5));

    @Test
    @DisplayName("First true range is high - low, later ones include the previous close")
    void testTrueRanges() {
        double[] tr = AtrCalculator.trueRanges(series.getCandles());
        assertArrayEquals(new double[]{2, 3, 1}, tr, 1e-9);
    }

    @Test
    @DisplayName("Gap bars use the distance from the previous close")
    void testTrueRange_Gap() {
        CandleSeries gapped = TestCandles.series(Timeframe.H4,
                hlc(Timeframe.H4, 0, 10, 8, 10),
                hlc(Timeframe.H4, 1, 20, 19, 19.5));
        assertEquals(10, AtrCalculator.trueRanges(gapped.getCandles())[1], 1e-9);
    }

    @Test
    @DisplayName("Wilder ATR seeds with the simple mean then smooths")
    void testWilderAtr() {
        OptionalDouble atr = AtrCalculator.wilderAtr(series, 2);
        assertTrue(atr.isPresent());
        // seed (2 + 3) / 2 = 2.5, then 2.5 + (1 - 2.5) / 2
        assertEquals(1.75, atr.getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("Too few bars gives no ATR")
    void testWilderAtr_Insufficient() {
        assertTrue(AtrCalculator.wilderAtr(series, 14).isEmpty());
        assertTrue(AtrCalculator.wilderAtr(CandleSeries.empty("X", Timeframe.H1), 14).isEmpty());
    }

    @Test
    @DisplayName("Trailing mean over a window, NaN when it does not fit")
    void testTrailingMean() {
        double[] tr = {2, 3, 1, 4};
        assertEquals(8.0 / 3, AtrCalculator.trailingMean(tr, 3, 3), 1e-9);
        assertTrue(Double.isNaN(AtrCalculator.trailingMean(tr, 1, 3)));
    }
}
