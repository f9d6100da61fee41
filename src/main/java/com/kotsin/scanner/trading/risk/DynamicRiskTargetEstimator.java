package com.kotsin.scanner.trading.risk;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.exception.DataInsufficientException;
import com.kotsin.scanner.exception.InvalidRiskPlanException;
import com.kotsin.scanner.indicator.AtrCalculator;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.smc.detector.SwingStructureAnalyzer;
import com.kotsin.scanner.smc.model.SwingPoint;
import com.kotsin.scanner.store.OutcomeStore;
import com.kotsin.scanner.trading.state.Trade;
import com.kotsin.scanner.trading.strategy.MarketCondition;
import com.kotsin.scanner.trading.strategy.Signal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * DynamicRiskTargetEstimator - volatility and history based stops, targets and sizing.
 *
 * NEW SIGNAL:
 * - stop   = nearest opposite H4 swing within the swing lookback, pushed k x ATR(H4) further away
 *            (no swing: the lookback window's extreme, capped at entry)
 * - target = entry +/- median historical MFE when enough closed trades exist, else fallback RR x stop distance
 * - size   = (equity x risk fraction) / (stop distance x point value)
 *
 * OPEN TRADE (configured order, first match wins):
 * - BREAK_EVEN  unrealized R >= break-even R and the stop is still behind entry
 * - TRAIL       unrealized R >= trail R and price -/+ fraction x ATR(H4) improves the stop
 * - CLOSE_EARLY held longer than factor x median winner holding, without continuation structure
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DynamicRiskTargetEstimator implements RiskTargetEstimator {

    private final ScannerConfig config;
    private final SwingStructureAnalyzer structureAnalyzer;
    private final OutcomeStore outcomeStore;

    @Override
    public RiskPlan estimateForNewSignal(SignalRiskContext context) {
        Signal signal = context.getSignal();
        String symbol = signal.getSymbol();
        Direction direction = signal.getDirection();
        double entry = signal.getEntryPrice();
        ScannerConfig.RiskConfig risk = config.getRisk();

        double atrH4 = requireAtr(symbol, context.getH4(), "H4");
        double atrH1 = requireAtr(symbol, context.getH1(), "H1");

        double swingLevel = protectiveLevel(context.getH4(), direction, entry);
        double stopLoss = direction.adverse(swingLevel, risk.getStopAtrBuffer() * atrH4);
        double stopDistance = Math.abs(entry - stopLoss);
        if (!(stopDistance > 0) || !direction.isStrictlyAdverse(entry, stopLoss)) {
            throw new InvalidRiskPlanException(symbol,
                    String.format("stop distance %s (entry %s, stop %s)", stopDistance, entry, stopLoss));
        }

        HistoricalOutcomeStats stats = HistoricalOutcomeStats.from(symbol, direction,
                outcomeStore.queryClosedTrades(symbol, direction));

        double targetDistance;
        TargetSource source;
        if (stats.getSampleCount() >= risk.getMinSampleCount() && stats.getMedianMfe() > 0) {
            targetDistance = stats.getMedianMfe();
            source = TargetSource.HISTORICAL_MFE;
        } else {
            targetDistance = risk.getFallbackRr() * stopDistance;
            source = TargetSource.FIXED_RR;
        }
        double takeProfit = direction.favorable(entry, targetDistance);

        double riskAmount = riskAmount();
        double size = positionSize(symbol, stopDistance);

        RiskPlan plan = RiskPlan.builder()
                .direction(direction)
                .entryPrice(entry)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .riskAmount(riskAmount)
                .size(size)
                .stopDistance(stopDistance)
                .atrH4(atrH4)
                .atrH1(atrH1)
                .targetSource(source)
                .build();

        log.info("[RISK] {} {} entry={} SL={} TP={} ({}, n={}) risk={} size={} RR={}",
                symbol, direction, entry, fmt(stopLoss), fmt(takeProfit), source, stats.getSampleCount(),
                fmt(riskAmount), fmt(size), fmt(plan.riskReward()));
        return plan;
    }

    /**
     * Account currency put at risk on every trade.
     */
    public double riskAmount() {
        ScannerConfig.RiskConfig risk = config.getRisk();
        return risk.getEquity() * risk.getRiskFraction();
    }

    /**
     * Units so that a stop-out loses exactly {@link #riskAmount()}.
     *
     * @throws InvalidRiskPlanException when the distance is not positive or the size is not finite
     */
    public double positionSize(String symbol, double stopDistance) {
        if (!(stopDistance > 0)) {
            throw new InvalidRiskPlanException(symbol, "stop distance must be positive, was " + stopDistance);
        }
        double size = riskAmount() / (stopDistance * config.getRisk().getPointValue());
        if (!Double.isFinite(size)) {
            throw new InvalidRiskPlanException(symbol, "size is not finite for stop distance " + stopDistance);
        }
        return size;
    }

    @Override
    public Optional<SlTpAdjustment> evaluateAdjustment(OpenTradeAnalytics analytics) {
        Trade trade = analytics.getTrade();
        if (!trade.isOpen()) {
            return Optional.empty();
        }

        for (ScannerConfig.AdjustmentRule rule : config.getRisk().getAdjustmentOrder()) {
            Optional<SlTpAdjustment> adjustment = switch (rule) {
                case BREAK_EVEN -> breakEven(analytics);
                case TRAIL -> trail(analytics);
                case CLOSE_EARLY -> closeEarly(analytics);
            };
            if (adjustment.isPresent()) {
                log.info("[RISK] {} [{}] {} -> SL={} TP={} ({})", trade.getSymbol(), trade.getId(),
                        adjustment.get().getAction(), fmt(adjustment.get().getNewStopLoss()),
                        fmt(adjustment.get().getNewTakeProfit()), adjustment.get().getReason());
                return adjustment;
            }
        }
        return Optional.empty();
    }

    private Optional<SlTpAdjustment> breakEven(OpenTradeAnalytics analytics) {
        Trade trade = analytics.getTrade();
        double r = analytics.unrealizedR();
        if (r < config.getRisk().getBreakEvenR()
                || !trade.getDirection().isStrictlyAdverse(trade.getEntryPrice(), trade.getStopLoss())) {
            return Optional.empty();
        }
        return Optional.of(SlTpAdjustment.builder()
                .action(SlTpAdjustment.Action.MOVE_STOP_TO_BREAK_EVEN)
                .newStopLoss(trade.getEntryPrice())
                .newTakeProfit(trade.getTakeProfit())
                .reason(String.format("%.2fR open, stop to break-even", r))
                .build());
    }

    private Optional<SlTpAdjustment> trail(OpenTradeAnalytics analytics) {
        Trade trade = analytics.getTrade();
        double r = analytics.unrealizedR();
        double atr = analytics.getRecommendation().getH4Atr();
        if (r < config.getRisk().getTrailR() || !(atr > 0)) {
            return Optional.empty();
        }
        Direction direction = trade.getDirection();
        double candidate = direction.adverse(analytics.getRecommendation().getCurrentPrice(),
                config.getRisk().getTrailAtrFraction() * atr);
        if (!direction.isStrictlyFavorable(trade.getStopLoss(), candidate)) {
            return Optional.empty();
        }
        return Optional.of(SlTpAdjustment.builder()
                .action(SlTpAdjustment.Action.TRAIL_STOP)
                .newStopLoss(candidate)
                .newTakeProfit(trade.getTakeProfit())
                .reason(String.format("%.2fR open, trail %.2f x ATR(H4)", r, config.getRisk().getTrailAtrFraction()))
                .build());
    }

    private Optional<SlTpAdjustment> closeEarly(OpenTradeAnalytics analytics) {
        Trade trade = analytics.getTrade();
        if (analytics.getRecommendation().getCondition() == MarketCondition.CONTINUATION) {
            return Optional.empty();
        }

        HistoricalOutcomeStats stats = HistoricalOutcomeStats.from(trade.getSymbol(), trade.getDirection(),
                outcomeStore.queryClosedTrades(trade.getSymbol(), trade.getDirection()));
        Optional<Duration> medianHolding = stats.getMedianWinnerHolding();
        if (medianHolding.isEmpty()) {
            return Optional.empty();
        }

        Duration elapsed = trade.holdingDuration(analytics.getRecommendation().getEvaluationTime());
        double limitMillis = medianHolding.get().toMillis() * config.getRisk().getStaleHoldingFactor();
        if (elapsed.toMillis() <= limitMillis) {
            return Optional.empty();
        }
        return Optional.of(SlTpAdjustment.builder()
                .action(SlTpAdjustment.Action.CLOSE_EARLY)
                .newStopLoss(trade.getStopLoss())
                .newTakeProfit(trade.getTakeProfit())
                .reason(String.format("held %s vs median winner %s, structure %s",
                        elapsed, medianHolding.get(), analytics.getRecommendation().getCondition()))
                .build());
    }

    private double requireAtr(String symbol, CandleSeries series, String label) {
        int period = config.getRisk().getAtrPeriod();
        OptionalDouble atr = AtrCalculator.wilderAtr(series, period);
        if (atr.isEmpty() || !(atr.getAsDouble() > 0)) {
            throw new DataInsufficientException(symbol,
                    String.format("%s has %d bars, ATR(%d) unavailable", label, series.size(), period));
        }
        return atr.getAsDouble();
    }

    /**
     * Nearest swing low below entry (BUY) or swing high above entry (SELL) inside the lookback.
     */
    double protectiveLevel(CandleSeries h4, Direction direction, double entry) {
        int firstIndex = Math.max(0, h4.size() - config.getRisk().getSwingLookback());
        SwingPoint.Kind wanted = direction == Direction.BUY ? SwingPoint.Kind.LOW : SwingPoint.Kind.HIGH;

        List<SwingPoint> swings = structureAnalyzer.findSwings(h4);
        Optional<Double> nearest = swings.stream()
                .filter(s -> s.getKind() == wanted && s.getIndex() >= firstIndex)
                .map(SwingPoint::getPrice)
                .filter(price -> direction.isStrictlyAdverse(entry, price))
                .reduce(direction == Direction.BUY ? Math::max : Math::min);
        if (nearest.isPresent()) {
            return nearest.get();
        }

        double extreme = direction == Direction.BUY ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        for (int i = firstIndex; i < h4.size(); i++) {
            Candle c = h4.get(i);
            extreme = direction == Direction.BUY ? Math.min(extreme, c.getLow()) : Math.max(extreme, c.getHigh());
        }
        log.debug("[RISK] {} no swing in lookback, using window extreme {}", h4.getSymbol(), extreme);
        return direction == Direction.BUY ? Math.min(extreme, entry) : Math.max(extreme, entry);
    }

    private static String fmt(double value) {
        return String.format("%.5f", value);
    }
}
