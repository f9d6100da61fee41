package com.kotsin.scanner.trading.risk;

import com.kotsin.scanner.exception.InvariantViolationException;
import com.kotsin.scanner.model.Direction;
import lombok.Builder;
import lombok.Value;

/**
 * RiskPlan - stop, target and size for one signal.
 *
 * Construction enforces stop strictly on the adverse side of entry and target strictly on the
 * favorable side; a plan that breaks either is never created.
 */
@Value
public class RiskPlan {

    Direction direction;
    double entryPrice;
    double stopLoss;
    double takeProfit;
    double riskAmount;
    double size;
    double stopDistance;
    double atrH4;
    double atrH1;
    TargetSource targetSource;

    @Builder
    public RiskPlan(Direction direction, double entryPrice, double stopLoss, double takeProfit,
                    double riskAmount, double size, double stopDistance, double atrH4, double atrH1,
                    TargetSource targetSource) {
        if (direction == null) {
            throw new InvariantViolationException("RiskPlan", "direction is required");
        }
        if (!direction.isStrictlyAdverse(entryPrice, stopLoss)) {
            throw new InvariantViolationException("RiskPlan",
                    String.format("%s stop %s not on adverse side of entry %s", direction, stopLoss, entryPrice));
        }
        if (!direction.isStrictlyFavorable(entryPrice, takeProfit)) {
            throw new InvariantViolationException("RiskPlan",
                    String.format("%s target %s not on favorable side of entry %s", direction, takeProfit, entryPrice));
        }
        this.direction = direction;
        this.entryPrice = entryPrice;
        this.stopLoss = stopLoss;
        this.takeProfit = takeProfit;
        this.riskAmount = riskAmount;
        this.size = size;
        this.stopDistance = stopDistance;
        this.atrH4 = atrH4;
        this.atrH1 = atrH1;
        this.targetSource = targetSource;
    }

    /**
     * Reward-to-risk ratio of the plan.
     */
    public double riskReward() {
        return Math.abs(takeProfit - entryPrice) / stopDistance;
    }
}
