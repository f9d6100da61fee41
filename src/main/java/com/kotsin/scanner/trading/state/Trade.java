package com.kotsin.scanner.trading.state;

import com.kotsin.scanner.exception.InvariantViolationException;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.trading.risk.ClosedTradeOutcome;
import com.kotsin.scanner.trading.risk.RiskPlan;
import com.kotsin.scanner.trading.strategy.Signal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Duration;
import java.time.Instant;

/**
 * Trade - a tracked position in pure-signal mode.
 *
 * Immutable: every change produces a new instance with {@code version + 1}, written through the
 * outcome store's compare-and-set. Only {@link TradeStateMachine} creates changed copies.
 *
 * {@code initialStopLoss} never moves and defines 1R. {@code stopLoss} may be moved to
 * break-even or trailed past entry; {@code takeProfit} always stays on the favorable side.
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
@Document(collection = "trades")
@CompoundIndexes({
        @CompoundIndex(name = "symbol_state_idx", def = "{'symbol': 1, 'state': 1}"),
        @CompoundIndex(name = "symbol_direction_closeTime_idx", def = "{'symbol': 1, 'direction': 1, 'closeTime': -1}")
})
public class Trade {

    @Id
    String id;

    @Indexed(unique = true)
    String signalId;

    Signal signal;
    RiskPlan riskPlan;

    String symbol;
    Direction direction;
    double entryPrice;
    double initialStopLoss;
    double stopLoss;
    double takeProfit;

    TradeState state;
    long version;

    Instant openTime;
    Instant closeTime;
    Double closePrice;
    String closeReason;

    // Running excursions in price units, both >= 0
    double maxFavorableExcursion;
    double maxAdverseExcursion;

    /**
     * Open time of the newest bar already applied to this trade; null until the first bar.
     */
    Instant lastBarTime;

    /**
     * New OPEN trade for a priced signal. Rejects a plan whose levels sit on the wrong side.
     */
    public static Trade open(String id, Signal signal, RiskPlan plan, Instant openTime) {
        Direction direction = signal.getDirection();
        if (plan.getDirection() != direction) {
            throw new InvariantViolationException("Trade",
                    String.format("plan direction %s differs from signal %s", plan.getDirection(), direction));
        }
        if (!direction.isStrictlyAdverse(signal.getEntryPrice(), plan.getStopLoss())) {
            throw new InvariantViolationException("Trade",
                    String.format("%s stop %s not adverse to entry %s", direction, plan.getStopLoss(), signal.getEntryPrice()));
        }
        if (!direction.isStrictlyFavorable(signal.getEntryPrice(), plan.getTakeProfit())) {
            throw new InvariantViolationException("Trade",
                    String.format("%s target %s not favorable to entry %s", direction, plan.getTakeProfit(), signal.getEntryPrice()));
        }
        return Trade.builder()
                .id(id)
                .signalId(signal.getId())
                .signal(signal)
                .riskPlan(plan)
                .symbol(signal.getSymbol())
                .direction(direction)
                .entryPrice(signal.getEntryPrice())
                .initialStopLoss(plan.getStopLoss())
                .stopLoss(plan.getStopLoss())
                .takeProfit(plan.getTakeProfit())
                .state(TradeState.OPEN)
                .version(0)
                .openTime(openTime)
                .build();
    }

    public boolean isOpen() {
        return state == TradeState.OPEN;
    }

    public double initialRisk() {
        return Math.abs(entryPrice - initialStopLoss);
    }

    /**
     * Realized R at {@code exitPrice}.
     */
    public double rMultipleAt(double exitPrice) {
        double risk = initialRisk();
        return risk > 0 ? direction.excursion(entryPrice, exitPrice) / risk : 0;
    }

    public Duration holdingDuration(Instant until) {
        return Duration.between(openTime, until);
    }

    /**
     * Statistics view of a closed trade.
     */
    public ClosedTradeOutcome toOutcome() {
        if (!state.isTerminal() || closePrice == null || closeTime == null) {
            throw new InvariantViolationException("Trade", id + " is not closed");
        }
        return ClosedTradeOutcome.builder()
                .tradeId(id)
                .mae(maxAdverseExcursion)
                .mfe(maxFavorableExcursion)
                .rMultiple(rMultipleAt(closePrice))
                .holdingDuration(holdingDuration(closeTime))
                .closedAt(closeTime)
                .build();
    }
}
