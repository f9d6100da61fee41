package com.kotsin.scanner.trading.strategy;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Output of {@link TradingStrategy#evaluateOpenTrade}: a read-only view of the market around an
 * open trade, consumed by the risk estimator. Carries no instruction to change the trade.
 */
@Value
@Builder
public class AdjustmentRecommendation {

    String tradeId;
    MarketCondition condition;
    double h4Atr;
    double currentPrice;
    Instant evaluationTime;
    String notes;
}
