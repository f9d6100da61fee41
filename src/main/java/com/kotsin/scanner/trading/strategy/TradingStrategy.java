package com.kotsin.scanner.trading.strategy;

import com.kotsin.scanner.mtf.MultiTimeframeContext;
import com.kotsin.scanner.trading.state.Trade;

import java.util.Optional;

/**
 * A multi-timeframe strategy. New strategies are added by implementing this interface.
 *
 * Both methods are pure: they read the context and never mutate trades or the context.
 * Recoverable data gaps yield {@link Optional#empty()} rather than an exception.
 */
public interface TradingStrategy {

    String getStrategyName();

    /**
     * At most one signal per symbol per newly closed H4 bar.
     */
    Optional<Signal> evaluateNewSignal(MultiTimeframeContext ctx);

    Optional<AdjustmentRecommendation> evaluateOpenTrade(Trade trade, MultiTimeframeContext ctx);
}
