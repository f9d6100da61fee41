package com.kotsin.scanner.smc.detector;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Timeframe;
import com.kotsin.scanner.smc.model.Bias;
import com.kotsin.scanner.smc.model.OrderBlock;
import com.kotsin.scanner.support.TestCandles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.kotsin.scanner.support.TestCandles.bar;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AtrOrderBlockDetector")
class AtrOrderBlockDetectorTest {

    private static final Timeframe TF = Timeframe.H4;

    private AtrOrderBlockDetector detector;

    @BeforeEach
    void setUp() {
        ScannerConfig config = new ScannerConfig();
        config.getOrderBlock().setAtrWindow(3);
        config.getOrderBlock().setMoveBars(2);
        config.getOrderBlock().setStrengthMultiplier(1.5);
        detector = new AtrOrderBlockDetector(config);
    }

    @Test
    @DisplayName("Last bearish candle before a strong up move is a bullish block")
    void testBullishBlock() {
        // trailing ATR at index 2 = 2; move range 106 - 99 = 7 > 1.5 x 2
        CandleSeries series = TestCandles.series(TF,
                bar(TF, 0, 100, 101, 99, 100.5),
                bar(TF, 1, 100.5, 101.5, 99.5, 100),
                bar(TF, 2, 100, 100.5, 98.5, 99),
                bar(TF, 3, 99, 103, 99, 102.5),
                bar(TF, 4, 102.5, 106, 102, 105.5));

        List<OrderBlock> blocks = detector.detect(series);

        assertEquals(1, blocks.size());
        OrderBlock block = blocks.get(0);
        assertEquals(Bias.BULLISH, block.getBias());
        assertEquals(98.5, block.getLow(), 1e-9);
        assertEquals(100.5, block.getHigh(), 1e-9);
        assertEquals(2, block.getOriginIndex());
        assertEquals(2.0, block.getAtr(), 1e-9);
        assertEquals(7.0, block.getMoveRange(), 1e-9);
    }

    @Test
    @DisplayName("Last bullish candle before a strong down move is a bearish block")
    void testBearishBlock() {
        CandleSeries series = TestCandles.series(TF,
                bar(TF, 0, 100, 101, 99, 100.5),
                bar(TF, 1, 100.5, 101.5, 99.5, 100),
                bar(TF, 2, 100, 101.5, 99.5, 101),
                bar(TF, 3, 101, 101, 97, 97.5),
                bar(TF, 4, 97.5, 98, 94, 94.5));

        List<OrderBlock> blocks = detector.detect(series);

        assertEquals(1, blocks.size());
        assertEquals(Bias.BEARISH, blocks.get(0).getBias());
        assertEquals(99.5, blocks.get(0).getLow(), 1e-9);
        assertEquals(101.5, blocks.get(0).getHigh(), 1e-9);
    }

    @Test
    @DisplayName("Move smaller than multiplier x ATR is not a block")
    void testWeakMoveIgnored() {
        CandleSeries series = TestCandles.series(TF,
                bar(TF, 0, 100, 101, 99, 100.5),
                bar(TF, 1, 100.5, 101.5, 99.5, 100),
                bar(TF, 2, 100, 100.5, 98.5, 99),
                bar(TF, 3, 99, 100.8, 98.9, 100.7),
                bar(TF, 4, 100.7, 101, 100.5, 100.9));

        assertTrue(detector.detect(series).isEmpty());
    }

    @Test
    @DisplayName("A later close through the block's far side prunes it")
    void testTradedThroughPruned() {
        CandleSeries series = TestCandles.series(TF,
                bar(TF, 0, 100, 101, 99, 100.5),
                bar(TF, 1, 100.5, 101.5, 99.5, 100),
                bar(TF, 2, 100, 100.5, 98.5, 99),
                bar(TF, 3, 99, 103, 99, 102.5),
                bar(TF, 4, 102.5, 106, 102, 105.5),
                bar(TF, 5, 105, 105.5, 97, 98));

        assertTrue(detector.detect(series).isEmpty());
    }

    @Test
    @DisplayName("Fewer bars than ATR window + move bars returns empty")
    void testShortSeries() {
        CandleSeries series = TestCandles.series(TF,
                bar(TF, 0, 100, 101, 99, 100.5),
                bar(TF, 1, 100.5, 101.5, 99.5, 100),
                bar(TF, 2, 100, 100.5, 98.5, 99),
                bar(TF, 3, 99, 103, 99, 102.5));

        assertEquals(5, detector.minimumBars());
        assertTrue(detector.detect(series).isEmpty());
    }
}
