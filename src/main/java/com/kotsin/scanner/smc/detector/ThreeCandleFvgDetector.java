package com.kotsin.scanner.smc.detector;

import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.smc.model.Bias;
import com.kotsin.scanner.smc.model.FairValueGap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * ThreeCandleFvgDetector - Fair Value Gaps from consecutive triples (a, b, c).
 *
 * BULLISH FVG: a.high < c.low  -> zone [a.high, c.low]
 * BEARISH FVG: a.low  > c.high -> zone [c.high, a.low]
 *
 * Origin index is the middle candle. A gap is filled by the first bar after c whose
 * range covers the whole zone.
 */
@Slf4j
@Component
public class ThreeCandleFvgDetector implements FairValueGapDetector {

    private static final int MIN_CANDLES = 3;

    @Override
    public List<FairValueGap> detect(CandleSeries series) {
        if (series.size() < MIN_CANDLES) {
            return List.of();
        }

        List<Candle> candles = series.getCandles();
        List<FairValueGap> gaps = new ArrayList<>();

        for (int i = 2; i < candles.size(); i++) {
            Candle a = candles.get(i - 2);
            Candle b = candles.get(i - 1);
            Candle c = candles.get(i);

            FairValueGap gap = null;
            if (a.getHigh() < c.getLow()) {
                gap = new FairValueGap(c.getLow(), a.getHigh(), Bias.BULLISH, i - 1, b.getOpenTime());
            } else if (a.getLow() > c.getHigh()) {
                gap = new FairValueGap(a.getLow(), c.getHigh(), Bias.BEARISH, i - 1, b.getOpenTime());
            }
            if (gap == null) {
                continue;
            }

            for (int k = i + 1; k < candles.size(); k++) {
                Candle later = candles.get(k);
                if (later.getLow() <= gap.getLow() && later.getHigh() >= gap.getHigh()) {
                    gap.markFilled(k);
                    break;
                }
            }
            gaps.add(gap);
        }

        if (!gaps.isEmpty()) {
            log.debug("[SMC_FVG] {} {}: {} gaps ({} unfilled)", series.getSymbol(), series.getTimeframe(),
                    gaps.size(), gaps.stream().filter(FairValueGap::isActive).count());
        }
        return gaps;
    }
}
