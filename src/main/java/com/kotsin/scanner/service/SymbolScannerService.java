package com.kotsin.scanner.service;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.exception.DataInsufficientException;
import com.kotsin.scanner.exception.DataUnavailableException;
import com.kotsin.scanner.exception.InvalidRiskPlanException;
import com.kotsin.scanner.exception.InvariantViolationException;
import com.kotsin.scanner.exception.StateConflictException;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleSeries;
import com.kotsin.scanner.model.Timeframe;
import com.kotsin.scanner.mtf.MultiTimeframeContext;
import com.kotsin.scanner.mtf.MultiTimeframeContextLoader;
import com.kotsin.scanner.store.OutcomeStore;
import com.kotsin.scanner.trading.risk.OpenTradeAnalytics;
import com.kotsin.scanner.trading.risk.RiskPlan;
import com.kotsin.scanner.trading.risk.RiskTargetEstimator;
import com.kotsin.scanner.trading.risk.SignalRiskContext;
import com.kotsin.scanner.trading.risk.SlTpAdjustment;
import com.kotsin.scanner.trading.state.Trade;
import com.kotsin.scanner.trading.state.TradeStateMachine;
import com.kotsin.scanner.trading.state.TransitionOutcome;
import com.kotsin.scanner.trading.strategy.AdjustmentRecommendation;
import com.kotsin.scanner.trading.strategy.H4CloseTracker;
import com.kotsin.scanner.trading.strategy.Signal;
import com.kotsin.scanner.trading.strategy.TradingStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SymbolScannerService - one scan cycle over every configured symbol.
 *
 * PER SYMBOL:
 * 1. load the six-timeframe context
 * 2. manage open trades: bars -> SL/TP/expiry, then strategy read + estimator adjustment
 * 3. evaluate a new signal, price it, open the trade
 * 4. remember the newest H4 bar as evaluated
 *
 * Failures stay per symbol: one symbol's missing data or bad plan never stops the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SymbolScannerService {

    private final ScannerConfig config;
    private final MultiTimeframeContextLoader contextLoader;
    private final TradingStrategy strategy;
    private final RiskTargetEstimator riskEstimator;
    private final TradeStateMachine stateMachine;
    private final OutcomeStore outcomeStore;
    private final H4CloseTracker h4CloseTracker;
    private final Clock clock;

    /**
     * @return number of symbols scanned without error
     */
    public int runScanCycle() {
        Map<String, String> symbols = config.getSymbols();
        if (symbols.isEmpty()) {
            log.warn("[SCANNER] No symbols configured");
            return 0;
        }

        long start = System.currentTimeMillis();
        int ok = 0;
        for (Map.Entry<String, String> entry : symbols.entrySet()) {
            String alias = entry.getKey();
            try {
                scanSymbol(alias, entry.getValue());
                ok++;
            } catch (DataUnavailableException e) {
                log.warn("[SCANNER] {} skipped, data unavailable: {}", alias, e.getMessage());
            } catch (RuntimeException e) {
                log.error("[SCANNER] {} scan failed: {}", alias, e.getMessage(), e);
            }
        }
        log.info("[SCANNER] Cycle done: {}/{} symbols in {}ms", ok, symbols.size(), System.currentTimeMillis() - start);
        return ok;
    }

    /**
     * @return the signal accepted in this scan, if any
     * @throws DataUnavailableException when the provider cannot return a series
     */
    public Optional<Signal> scanSymbol(String alias, String providerSymbol) {
        Instant now = clock.instant();

        MultiTimeframeContext ctx;
        try {
            ctx = contextLoader.load(alias, providerSymbol, now, h4CloseTracker.lastSeen(alias));
        } catch (DataInsufficientException e) {
            log.warn("[SCANNER] {} skipped: {}", alias, e.getMessage());
            return Optional.empty();
        }

        for (Trade trade : outcomeStore.findOpenTrades(alias)) {
            manageOpenTrade(trade.getId(), ctx);
        }

        Optional<Signal> accepted = evaluateNewSignal(ctx);

        ctx.series(Timeframe.H4)
                .flatMap(CandleSeries::last)
                .ifPresent(bar -> h4CloseTracker.markSeen(alias, bar.getOpenTime()));
        return accepted;
    }

    Optional<Signal> evaluateNewSignal(MultiTimeframeContext ctx) {
        Optional<Signal> signal = strategy.evaluateNewSignal(ctx);
        if (signal.isEmpty()) {
            return Optional.empty();
        }

        try {
            RiskPlan plan = riskEstimator.estimateForNewSignal(SignalRiskContext.of(signal.get(), ctx));
            Trade trade = stateMachine.open(signal.get(), plan);
            return Optional.of(trade.getSignal());
        } catch (InvalidRiskPlanException | InvariantViolationException e) {
            log.error("[SCANNER] {} signal rejected: {}", ctx.getSymbol(), e.getMessage());
        } catch (DataInsufficientException e) {
            log.warn("[SCANNER] {} signal not priced: {}", ctx.getSymbol(), e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Run the trade through bars and adjustments, re-reading and starting over after a
     * compare-and-set conflict, up to the configured number of attempts.
     */
    void manageOpenTrade(String tradeId, MultiTimeframeContext ctx) {
        int maxAttempts = 1 + config.getLifecycle().getMaxConflictRetries();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<Trade> current = outcomeStore.findTrade(tradeId);
            if (current.isEmpty() || !current.get().isOpen()) {
                return;
            }
            try {
                evaluateOpenTrade(current.get(), ctx);
                return;
            } catch (StateConflictException e) {
                log.warn("[SCANNER] {} attempt {}/{}: {}", ctx.getSymbol(), attempt, maxAttempts, e.getMessage());
            }
        }
        log.error("[SCANNER] {} [{}] gave up after {} conflicting attempts", ctx.getSymbol(), tradeId, maxAttempts);
    }

    private void evaluateOpenTrade(Trade trade, MultiTimeframeContext ctx) {
        Timeframe barTimeframe = config.getLifecycle().getBarTimeframe();
        List<Candle> bars = ctx.series(barTimeframe)
                .map(CandleSeries::getCandles)
                .orElse(List.of());

        Optional<CandleSeries> fine = finestBelow(ctx, barTimeframe);
        TransitionOutcome outcome = fine.isPresent()
                ? stateMachine.onBars(trade, fine.get().getCandles(), fine.get().getTimeframe(), bars, barTimeframe)
                : stateMachine.onBars(trade, bars, barTimeframe);
        Trade latest = outcome.getTrade();
        if (!latest.isOpen()) {
            return;
        }

        outcome = stateMachine.checkExpiry(latest, ctx.getCurrentPrice(), ctx.getEvaluationTime());
        latest = outcome.getTrade();
        if (!latest.isOpen()) {
            return;
        }

        Optional<AdjustmentRecommendation> recommendation = strategy.evaluateOpenTrade(latest, ctx);
        if (recommendation.isEmpty()) {
            return;
        }

        Optional<SlTpAdjustment> adjustment = riskEstimator.evaluateAdjustment(OpenTradeAnalytics.builder()
                .trade(latest)
                .recommendation(recommendation.get())
                .build());
        if (adjustment.isPresent()) {
            try {
                stateMachine.applyAdjustment(latest, adjustment.get(), ctx.getCurrentPrice(), ctx.getEvaluationTime());
            } catch (InvariantViolationException e) {
                log.error("[SCANNER] {} [{}] adjustment rejected: {}", ctx.getSymbol(), latest.getId(), e.getMessage());
            }
        }
    }

    /**
     * Finest loaded series whose bars are shorter than the lifecycle bar.
     */
    private static Optional<CandleSeries> finestBelow(MultiTimeframeContext ctx, Timeframe barTimeframe) {
        Timeframe[] timeframes = Timeframe.values();
        for (int i = timeframes.length - 1; i >= 0; i--) {
            Timeframe tf = timeframes[i];
            if (tf.getBarDuration().compareTo(barTimeframe.getBarDuration()) >= 0) {
                break;
            }
            Optional<CandleSeries> series = ctx.series(tf);
            if (series.isPresent()) {
                return series;
            }
        }
        return Optional.empty();
    }
}
