package com.kotsin.scanner.trading.strategy;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.indicator.AtrCalculator;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.Timeframe;
import com.kotsin.scanner.mtf.MultiTimeframeContext;
import com.kotsin.scanner.smc.detector.FairValueGapDetector;
import com.kotsin.scanner.smc.detector.OrderBlockDetector;
import com.kotsin.scanner.smc.detector.SwingStructureAnalyzer;
import com.kotsin.scanner.smc.model.Bias;
import com.kotsin.scanner.smc.model.FairValueGap;
import com.kotsin.scanner.smc.model.OrderBlock;
import com.kotsin.scanner.smc.model.PriceZone;
import com.kotsin.scanner.smc.model.StructureEvent;
import com.kotsin.scanner.trading.state.Trade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * H4FvgStrategy - H4 zone bias, lower-timeframe structure confirmation, M5/M1 entry trigger.
 *
 * FLOW (evaluated once per newly closed H4 bar):
 * 1. H4 must have a bar newer than the caller's last-seen H4 bar
 * 2. BIAS: most recent active H4 FVG / Order Block within the zone lookback.
 *    Most recent FVG and most recent OB pointing opposite ways = conflict, no signal
 * 3. CONFIRMATION: BOS or CHOCH in the bias direction on H1, M30 or M15
 * 4. ENTRY: wick rejection at the bias zone, or micro BOS/CHOCH, on M5 or M1
 * 5. Signal at the context's current price
 *
 * Open trades are re-read on H4 and H1: the latest break or sweep relative to the trade's
 * direction is reported as continuation, exhaustion or neutral.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class H4FvgStrategy implements TradingStrategy {

    private static final Timeframe[] CONFIRMATION_TIMEFRAMES = {Timeframe.H1, Timeframe.M30, Timeframe.M15};
    private static final Timeframe[] ENTRY_TIMEFRAMES = {Timeframe.M5, Timeframe.M1};
    private static final Timeframe[] TREND_TIMEFRAMES = {Timeframe.H4, Timeframe.H1};

    private final ScannerConfig config;
    private final SwingStructureAnalyzer structureAnalyzer;
    private final FairValueGapDetector fvgDetector;
    private final OrderBlockDetector orderBlockDetector;

    @Override
    public String getStrategyName() {
        return config.getStrategy().getName();
    }

    @Override
    public Optional<Signal> evaluateNewSignal(MultiTimeframeContext ctx) {
        String symbol = ctx.getSymbol();

        if (!hasUsableSeries(ctx, Timeframe.values())) {
            return Optional.empty();
        }

        // Step 1: new H4 close
        CandleSeries h4 = ctx.series(Timeframe.H4).orElseThrow();
        Candle lastH4 = h4.last().orElseThrow();
        if (ctx.getLastSeenH4BarTime() != null && !lastH4.getOpenTime().isAfter(ctx.getLastSeenH4BarTime())) {
            log.debug("[STRATEGY] {} no new H4 close since {}", symbol, ctx.getLastSeenH4BarTime());
            return Optional.empty();
        }

        // Step 2: H4 bias from zones
        Optional<PriceZone> biasZone = resolveBiasZone(symbol, h4);
        if (biasZone.isEmpty()) {
            return Optional.empty();
        }
        PriceZone zone = biasZone.get();
        Bias bias = zone.getBias();

        // Step 3: structure confirmation
        List<String> confirmations = new ArrayList<>();
        for (Timeframe timeframe : CONFIRMATION_TIMEFRAMES) {
            CandleSeries series = ctx.series(timeframe).orElseThrow();
            recentBreak(series, bias, config.getStrategy().getConfirmationLookback())
                    .ifPresent(e -> confirmations.add(timeframe + " " + e.getKind()));
        }
        if (confirmations.isEmpty()) {
            log.debug("[STRATEGY] {} {} bias has no H1/M30/M15 confirmation", symbol, bias);
            return Optional.empty();
        }

        // Step 4: entry trigger
        List<String> triggers = new ArrayList<>();
        for (Timeframe timeframe : ENTRY_TIMEFRAMES) {
            CandleSeries series = ctx.series(timeframe).orElseThrow();
            if (hasWickRejection(series, zone)) {
                triggers.add(timeframe + " wick rejection");
            }
            recentBreak(series, bias, config.getStrategy().getEntryLookback())
                    .ifPresent(e -> triggers.add(timeframe + " micro " + e.getKind()));
        }
        if (triggers.isEmpty()) {
            log.debug("[STRATEGY] {} {} bias confirmed ({}) but no M5/M1 trigger", symbol, bias, confirmations);
            return Optional.empty();
        }

        // Step 5: signal
        String rationale = String.format("H4 %s %s [%.5f - %.5f]; confirmation: %s; entry: %s",
                bias, zone instanceof FairValueGap ? "FVG" : "OB", zone.getLow(), zone.getHigh(),
                String.join(", ", confirmations), String.join(", ", triggers));

        Signal signal = Signal.builder()
                .id(UUID.randomUUID().toString())
                .symbol(symbol)
                .direction(bias.toDirection())
                .time(ctx.getEvaluationTime())
                .entryPrice(ctx.getCurrentPrice())
                .strategyName(getStrategyName())
                .rationale(rationale)
                .h4BarTime(lastH4.getOpenTime())
                .build();

        log.info("[STRATEGY] {} {} signal @ {} | {}", symbol, signal.getDirection(), signal.getEntryPrice(), rationale);
        return Optional.of(signal);
    }

    @Override
    public Optional<AdjustmentRecommendation> evaluateOpenTrade(Trade trade, MultiTimeframeContext ctx) {
        if (!hasUsableSeries(ctx, TREND_TIMEFRAMES)) {
            return Optional.empty();
        }

        CandleSeries h4 = ctx.series(Timeframe.H4).orElseThrow();
        OptionalDouble atr = AtrCalculator.wilderAtr(h4, config.getRisk().getAtrPeriod());
        if (atr.isEmpty()) {
            log.warn("[STRATEGY] {} H4 too short for ATR({}): {} bars",
                    ctx.getSymbol(), config.getRisk().getAtrPeriod(), h4.size());
            return Optional.empty();
        }

        Bias tradeBias = Bias.of(trade.getDirection());
        int lookback = config.getStrategy().getConfirmationLookback();
        MarketCondition condition = MarketCondition.NEUTRAL;
        List<String> notes = new ArrayList<>();

        for (Timeframe timeframe : TREND_TIMEFRAMES) {
            CandleSeries series = ctx.series(timeframe).orElseThrow();
            Optional<StructureEvent> latest = latestEvent(series, lookback);
            if (latest.isEmpty()) {
                continue;
            }
            StructureEvent event = latest.get();
            notes.add(timeframe + " " + event.getBias() + " " + event.getKind());

            boolean against = event.getBias() != tradeBias;
            if (against) {
                condition = MarketCondition.EXHAUSTION;
                break;
            }
            if (event.isBreak()) {
                condition = MarketCondition.CONTINUATION;
            }
        }

        return Optional.of(AdjustmentRecommendation.builder()
                .tradeId(trade.getId())
                .condition(condition)
                .h4Atr(atr.getAsDouble())
                .currentPrice(ctx.getCurrentPrice())
                .evaluationTime(ctx.getEvaluationTime())
                .notes(notes.isEmpty() ? "no recent H4/H1 structure" : String.join(", ", notes))
                .build());
    }

    private boolean hasUsableSeries(MultiTimeframeContext ctx, Timeframe[] required) {
        int minimum = structureAnalyzer.minimumBars();
        for (Timeframe timeframe : required) {
            Optional<CandleSeries> series = ctx.series(timeframe);
            if (series.isEmpty()) {
                log.warn("[STRATEGY] {} skipped: no {} data", ctx.getSymbol(), timeframe);
                return false;
            }
            if (series.get().size() < minimum) {
                log.warn("[STRATEGY] {} skipped: {} has {} bars (need {})",
                        ctx.getSymbol(), timeframe, series.get().size(), minimum);
                return false;
            }
        }
        return true;
    }

    Optional<PriceZone> resolveBiasZone(String symbol, CandleSeries h4) {
        int firstIndex = h4.size() - config.getStrategy().getH4ZoneLookback();

        Optional<FairValueGap> fvg = fvgDetector.detect(h4).stream()
                .filter(FairValueGap::isActive)
                .filter(z -> z.getOriginIndex() >= firstIndex)
                .max(Comparator.comparingInt(FairValueGap::getOriginIndex));
        Optional<OrderBlock> ob = orderBlockDetector.detect(h4).stream()
                .filter(z -> z.getOriginIndex() >= firstIndex)
                .max(Comparator.comparingInt(OrderBlock::getOriginIndex));

        if (fvg.isEmpty() && ob.isEmpty()) {
            log.debug("[STRATEGY] {} no active H4 zone", symbol);
            return Optional.empty();
        }
        if (fvg.isPresent() && ob.isPresent() && fvg.get().getBias() != ob.get().getBias()) {
            log.debug("[STRATEGY] {} H4 zones conflict: FVG {} vs OB {}",
                    symbol, fvg.get().getBias(), ob.get().getBias());
            return Optional.empty();
        }
        if (fvg.isPresent() && ob.isPresent()) {
            return Optional.of(fvg.get().getOriginIndex() >= ob.get().getOriginIndex() ? fvg.get() : ob.get());
        }
        return fvg.isPresent() ? Optional.of(fvg.get()) : Optional.of(ob.get());
    }

    private Optional<StructureEvent> recentBreak(CandleSeries series, Bias bias, int lookback) {
        int firstIndex = series.size() - lookback;
        List<StructureEvent> events = structureAnalyzer.findStructure(series);
        for (int i = events.size() - 1; i >= 0; i--) {
            StructureEvent event = events.get(i);
            if (event.getIndex() < firstIndex) {
                break;
            }
            if (event.isBreak() && event.getBias() == bias) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    private Optional<StructureEvent> latestEvent(CandleSeries series, int lookback) {
        List<StructureEvent> events = structureAnalyzer.findStructure(series);
        if (events.isEmpty()) {
            return Optional.empty();
        }
        StructureEvent last = events.get(events.size() - 1);
        return last.getIndex() >= series.size() - lookback ? Optional.of(last) : Optional.empty();
    }

    /**
     * Rejection candle within the entry lookback: the wick on the zone side is at least
     * {@code wick-body-ratio} times the body, pokes into the zone, and the close holds on the
     * bias side of the zone's far edge.
     */
    boolean hasWickRejection(CandleSeries series, PriceZone zone) {
        double ratio = config.getStrategy().getWickBodyRatio();
        int first = Math.max(0, series.size() - config.getStrategy().getEntryLookback());
        Direction direction = zone.getBias().toDirection();

        for (int i = series.size() - 1; i >= first; i--) {
            Candle c = series.get(i);
            double wick = direction == Direction.BUY ? c.lowerWick() : c.upperWick();
            if (wick <= 0 || wick < ratio * c.body()) {
                continue;
            }
            boolean touches = direction == Direction.BUY
                    ? c.getLow() <= zone.getHigh() && c.getClose() >= zone.getLow()
                    : c.getHigh() >= zone.getLow() && c.getClose() <= zone.getHigh();
            if (touches) {
                return true;
            }
        }
        return false;
    }
}
