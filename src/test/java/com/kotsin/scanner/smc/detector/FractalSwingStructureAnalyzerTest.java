package com.kotsin.scanner.smc.detector;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Timeframe;
import com.kotsin.scanner.smc.model.Bias;
import com.kotsin.scanner.smc.model.StructureEvent;
import com.kotsin.scanner.smc.model.SwingPoint;
import com.kotsin.scanner.support.TestCandles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.kotsin.scanner.support.TestCandles.hlc;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FractalSwingStructureAnalyzer - swings, BOS, CHOCH, sweeps")
class FractalSwingStructureAnalyzerTest {

    private static final Timeframe TF = Timeframe.H1;

    private FractalSwingStructureAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        ScannerConfig config = new ScannerConfig();
        config.getStructure().setSwingWindow(2);
        analyzer = new FractalSwingStructureAnalyzer(config);
    }

    /**
     * Swing high 15 at index 2, swing low 9 at index 4.
     */
    private List<Candle> baseBars() {
        List<Candle> bars = new ArrayList<>();
        bars.add(hlc(TF, 0, 10, 8, 9));
        bars.add(hlc(TF, 1, 11, 9, 10));
        bars.add(hlc(TF, 2, 15, 12, 13));
        bars.add(hlc(TF, 3, 13, 10, 11));
        bars.add(hlc(TF, 4, 12, 9, 10));
        bars.add(hlc(TF, 5, 14, 11, 13));
        return bars;
    }

    @Test
    @DisplayName("Swing needs strictly higher high than window bars on both sides")
    void testFindSwings() {
        CandleSeries series = TestCandles.series(TF, baseBars().subList(0, 5));

        List<SwingPoint> swings = analyzer.findSwings(series);

        assertEquals(1, swings.size());
        assertEquals(SwingPoint.Kind.HIGH, swings.get(0).getKind());
        assertEquals(2, swings.get(0).getIndex());
        assertEquals(15, swings.get(0).getPrice(), 1e-9);
    }

    @Test
    @DisplayName("Equal neighbouring highs are not a swing")
    void testEqualHighsNotSwing() {
        CandleSeries series = TestCandles.series(TF,
                hlc(TF, 0, 10, 8, 9),
                hlc(TF, 1, 15, 9, 10),
                hlc(TF, 2, 15, 12, 13),
                hlc(TF, 3, 13, 10, 11),
                hlc(TF, 4, 12, 9, 10));

        assertTrue(analyzer.findSwings(series).stream().noneMatch(SwingPoint::isHigh));
    }

    @Test
    @DisplayName("Close above the swing high is a bullish BOS")
    void testBullishBos() {
        List<Candle> bars = baseBars();
        bars.add(hlc(TF, 6, 17, 13, 16));
        CandleSeries series = TestCandles.series(TF, bars);

        List<StructureEvent> events = analyzer.findStructure(series);

        assertEquals(1, events.size());
        StructureEvent bos = events.get(0);
        assertEquals(StructureEvent.Kind.BOS, bos.getKind());
        assertEquals(Bias.BULLISH, bos.getBias());
        assertEquals(15, bos.getLevel(), 1e-9);
        assertEquals(16, bos.getPrice(), 1e-9);
        assertEquals(6, bos.getIndex());
    }

    @Test
    @DisplayName("Break against the established trend is a CHOCH")
    void testChoch() {
        List<Candle> bars = baseBars();
        bars.add(hlc(TF, 6, 17, 13, 16));
        bars.add(hlc(TF, 7, 16, 12, 13));
        bars.add(TestCandles.bar(TF, 8, 12, 13, 8, 8.5));
        CandleSeries series = TestCandles.series(TF, bars);

        List<StructureEvent> events = analyzer.findStructure(series);

        assertEquals(2, events.size());
        assertEquals(StructureEvent.Kind.BOS, events.get(0).getKind());
        StructureEvent choch = events.get(1);
        assertEquals(StructureEvent.Kind.CHOCH, choch.getKind());
        assertEquals(Bias.BEARISH, choch.getBias());
        assertEquals(9, choch.getLevel(), 1e-9);
        assertEquals(8, choch.getIndex());
    }

    @Test
    @DisplayName("Wick through the swing with close back inside is a sweep, not a BOS")
    void testSweep() {
        List<Candle> bars = baseBars();
        bars.add(hlc(TF, 6, 16, 13, 14.5));
        bars.add(hlc(TF, 7, 17, 14, 16.5));
        CandleSeries series = TestCandles.series(TF, bars);

        List<StructureEvent> events = analyzer.findStructure(series);

        assertEquals(1, events.size());
        assertEquals(StructureEvent.Kind.SWEEP, events.get(0).getKind());
        assertEquals(Bias.BEARISH, events.get(0).getBias());
        assertEquals(16, events.get(0).getPrice(), 1e-9);
        assertFalse(events.get(0).isBreak());
    }

    @Test
    @DisplayName("Fewer than 2 x window + 1 bars returns empty, never an error")
    void testShortSeries() {
        CandleSeries series = TestCandles.series(TF, baseBars().subList(0, 4));

        assertEquals(5, analyzer.minimumBars());
        assertTrue(analyzer.findSwings(series).isEmpty());
        assertTrue(analyzer.findStructure(series).isEmpty());
        assertTrue(analyzer.findStructure(CandleSeries.empty("X", TF)).isEmpty());
    }
}
