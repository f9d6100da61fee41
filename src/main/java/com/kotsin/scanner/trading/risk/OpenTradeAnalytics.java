package com.kotsin.scanner.trading.risk;

import com.kotsin.scanner.trading.state.Trade;
import com.kotsin.scanner.trading.strategy.AdjustmentRecommendation;
import lombok.Builder;
import lombok.Value;

/**
 * An open trade together with the strategy's latest read of the market around it.
 */
@Value
@Builder
public class OpenTradeAnalytics {

    Trade trade;
    AdjustmentRecommendation recommendation;

    /**
     * Open profit in units of the initial stop distance.
     */
    public double unrealizedR() {
        double initialRisk = Math.abs(trade.getEntryPrice() - trade.getInitialStopLoss());
        if (initialRisk <= 0) {
            return 0;
        }
        return trade.getDirection().excursion(trade.getEntryPrice(), recommendation.getCurrentPrice()) / initialRisk;
    }
}
