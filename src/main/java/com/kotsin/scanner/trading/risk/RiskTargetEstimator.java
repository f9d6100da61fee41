package com.kotsin.scanner.trading.risk;

import com.kotsin.scanner.exception.DataInsufficientException;
import com.kotsin.scanner.exception.InvalidRiskPlanException;

import java.util.Optional;

/**
 * Prices new signals and recommends stop/target changes for open trades.
 */
public interface RiskTargetEstimator {

    /**
     * @throws DataInsufficientException when H4 or H1 is too short for ATR
     * @throws InvalidRiskPlanException  when the stop distance is not positive or the size is not finite
     */
    RiskPlan estimateForNewSignal(SignalRiskContext context);

    /**
     * At most one adjustment per call; rules are tried in the configured order and the first match wins.
     */
    Optional<SlTpAdjustment> evaluateAdjustment(OpenTradeAnalytics analytics);
}
