package com.kotsin.scanner.smc.detector;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.indicator.AtrCalculator;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.smc.model.Bias;
import com.kotsin.scanner.smc.model.OrderBlock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * AtrOrderBlockDetector - Order Blocks confirmed by an ATR-relative displacement.
 *
 * BULLISH OB: bearish candle i, bullish candle i+1, and over the next {@code move-bars} bars
 *             the range (max high - min low) exceeds {@code strength-multiplier} x trailing ATR
 *             while the last move bar closes above candle i's high.
 * BEARISH OB: mirror image.
 *
 * PRUNING:
 * - invalidated: a later close beyond the block's far side (below a bullish block's low,
 *   above a bearish block's high)
 * - superseded: an earlier block overlapped by a later block of the same bias
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AtrOrderBlockDetector implements OrderBlockDetector {

    private final ScannerConfig config;

    @Override
    public int minimumBars() {
        ScannerConfig.OrderBlockConfig ob = config.getOrderBlock();
        return ob.getAtrWindow() + ob.getMoveBars();
    }

    @Override
    public List<OrderBlock> detect(CandleSeries series) {
        if (series.size() < minimumBars()) {
            log.debug("[SMC_OB] {} {}: not enough candles: {} (need {})",
                    series.getSymbol(), series.getTimeframe(), series.size(), minimumBars());
            return List.of();
        }

        ScannerConfig.OrderBlockConfig ob = config.getOrderBlock();
        List<Candle> candles = series.getCandles();
        double[] trueRanges = AtrCalculator.trueRanges(candles);
        int moveBars = ob.getMoveBars();

        List<OrderBlock> candidates = new ArrayList<>();
        for (int i = ob.getAtrWindow() - 1; i + moveBars < candles.size(); i++) {
            Candle base = candles.get(i);
            Candle first = candles.get(i + 1);

            Bias bias;
            if (base.isBearish() && first.isBullish()) {
                bias = Bias.BULLISH;
            } else if (base.isBullish() && first.isBearish()) {
                bias = Bias.BEARISH;
            } else {
                continue;
            }

            double atr = AtrCalculator.trailingMean(trueRanges, i, ob.getAtrWindow());
            if (!(atr > 0)) {
                continue;
            }

            double maxHigh = Double.NEGATIVE_INFINITY;
            double minLow = Double.POSITIVE_INFINITY;
            for (int k = i + 1; k <= i + moveBars; k++) {
                maxHigh = Math.max(maxHigh, candles.get(k).getHigh());
                minLow = Math.min(minLow, candles.get(k).getLow());
            }
            double moveRange = maxHigh - minLow;
            double moveClose = candles.get(i + moveBars).getClose();

            boolean displaced = bias == Bias.BULLISH ? moveClose > base.getHigh() : moveClose < base.getLow();
            if (!displaced || moveRange <= ob.getStrengthMultiplier() * atr) {
                continue;
            }

            OrderBlock block = OrderBlock.builder()
                    .high(base.getHigh())
                    .low(base.getLow())
                    .bias(bias)
                    .originIndex(i)
                    .time(base.getOpenTime())
                    .moveRange(moveRange)
                    .atr(atr)
                    .build();

            if (isInvalidated(block, candles, i + moveBars + 1)) {
                log.debug("[SMC_OB] {} {}: {} block at {} traded through, dropped",
                        series.getSymbol(), series.getTimeframe(), bias, i);
                continue;
            }
            candidates.add(block);
        }

        List<OrderBlock> kept = new ArrayList<>();
        for (int idx = candidates.size() - 1; idx >= 0; idx--) {
            OrderBlock block = candidates.get(idx);
            boolean superseded = kept.stream()
                    .anyMatch(later -> later.getBias() == block.getBias() && later.overlaps(block));
            if (!superseded) {
                kept.add(block);
            }
        }
        kept.sort(Comparator.comparingInt(OrderBlock::getOriginIndex));

        if (!kept.isEmpty()) {
            OrderBlock last = kept.get(kept.size() - 1);
            log.debug("[SMC_OB] {} {}: {} blocks, latest {} [{} - {}] at index {}",
                    series.getSymbol(), series.getTimeframe(), kept.size(),
                    last.getBias(), last.getLow(), last.getHigh(), last.getOriginIndex());
        }
        return kept;
    }

    private static boolean isInvalidated(OrderBlock block, List<Candle> candles, int from) {
        for (int k = from; k < candles.size(); k++) {
            double close = candles.get(k).getClose();
            if (block.getBias() == Bias.BULLISH ? close < block.getLow() : close > block.getHigh()) {
                return true;
            }
        }
        return false;
    }
}
