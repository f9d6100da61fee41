package com.kotsin.scanner.trading.state;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.exception.InvariantViolationException;
import com.kotsin.scanner.exception.StateConflictException;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.Timeframe;
import com.kotsin.scanner.notification.NotificationSink;
import com.kotsin.scanner.store.OutcomeStore;
import com.kotsin.scanner.trading.event.AdjustmentApplied;
import com.kotsin.scanner.trading.event.CloseDetails;
import com.kotsin.scanner.trading.event.ClosedBySl;
import com.kotsin.scanner.trading.event.ClosedByTp;
import com.kotsin.scanner.trading.event.ClosedManual;
import com.kotsin.scanner.trading.event.SignalAccepted;
import com.kotsin.scanner.trading.event.TradeEvent;
import com.kotsin.scanner.trading.event.TradeExpired;
import com.kotsin.scanner.trading.risk.RiskPlan;
import com.kotsin.scanner.trading.risk.SlTpAdjustment;
import com.kotsin.scanner.trading.strategy.Signal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * TradeStateMachine - sole owner of trade state.
 *
 * STATES: OPEN -> CLOSED_BY_SL | CLOSED_BY_TP | CLOSED_MANUAL | EXPIRED (all terminal, absorbing)
 *
 * PER BAR (OPEN only, bars at or before the last applied bar are skipped):
 * 0. the lifecycle bar that straddles the open is covered by finer bars from the open onwards
 * 1. stop touched   (BUY low <= SL, SELL high >= SL)  -> CLOSED_BY_SL at the stop
 * 2. target touched (BUY high >= TP, SELL low <= TP)  -> CLOSED_BY_TP at the target
 *    both on one bar: stop wins unless stop-wins-same-bar is off
 * 3. max holding reached                             -> EXPIRED at the bar close
 * otherwise only the running MAE/MFE move.
 *
 * Every change is computed in memory first and committed with one compare-and-set on
 * (state, version). A lost race throws {@link StateConflictException}; nothing is emitted.
 * A committed transition emits exactly one event; a no-op emits nothing and writes nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TradeStateMachine {

    private final OutcomeStore outcomeStore;
    private final NotificationSink notificationSink;
    private final ScannerConfig config;

    /**
     * Create the OPEN trade for a priced signal and announce it.
     */
    public Trade open(Signal signal, RiskPlan plan) {
        Trade trade = Trade.open(UUID.randomUUID().toString(), signal.withEstimatedRr(plan.riskReward()),
                plan, signal.getTime());
        outcomeStore.createTrade(trade);
        log.info("[TRADE_SM] {} [{}] OPEN {} @ {} SL={} TP={}", trade.getSymbol(), trade.getId(),
                trade.getDirection(), trade.getEntryPrice(), trade.getStopLoss(), trade.getTakeProfit());
        notificationSink.emit(SignalAccepted.of(trade));
        return trade;
    }

    public TransitionOutcome onBar(Trade trade, Candle bar, Timeframe timeframe) {
        return onBars(trade, List.of(bar), timeframe);
    }

    /**
     * Apply a batch of closed bars in time order. Stops at the first terminal transition.
     * A bar that opened before the trade is skipped whole.
     */
    public TransitionOutcome onBars(Trade trade, List<Candle> bars, Timeframe timeframe) {
        return onBars(trade, List.of(), timeframe, bars, timeframe);
    }

    /**
     * Apply {@code bars}, first covering the one that straddles the trade's open with
     * {@code fineBars}: fine bars opening at or after the open and closing by the end of the
     * straddling bar come first, then the whole bars.
     */
    public TransitionOutcome onBars(Trade trade, List<Candle> fineBars, Timeframe fineTimeframe,
                                    List<Candle> bars, Timeframe timeframe) {
        return switch (trade.getState()) {
            case OPEN -> applyBars(trade, timeline(trade, fineBars, fineTimeframe, bars, timeframe));
            case CLOSED_BY_TP, CLOSED_BY_SL, CLOSED_MANUAL, EXPIRED -> ignored(trade, "bars");
        };
    }

    /**
     * Apply an estimator recommendation. CLOSE_EARLY closes the trade at {@code currentPrice};
     * stop moves must stay strictly behind the current price.
     */
    public TransitionOutcome applyAdjustment(Trade trade, SlTpAdjustment adjustment, double currentPrice, Instant now) {
        return switch (trade.getState()) {
            case OPEN -> adjustment.getAction() == SlTpAdjustment.Action.CLOSE_EARLY
                    ? close(trade, TradeState.CLOSED_MANUAL, currentPrice, now, adjustment.getReason())
                    : moveLevels(trade, adjustment, currentPrice, now);
            case CLOSED_BY_TP, CLOSED_BY_SL, CLOSED_MANUAL, EXPIRED -> ignored(trade, adjustment.getAction().name());
        };
    }

    public TransitionOutcome closeManual(Trade trade, double price, Instant now, String reason) {
        return switch (trade.getState()) {
            case OPEN -> close(trade, TradeState.CLOSED_MANUAL, price, now, reason);
            case CLOSED_BY_TP, CLOSED_BY_SL, CLOSED_MANUAL, EXPIRED -> ignored(trade, "manual close");
        };
    }

    /**
     * Expire by wall-clock time, for trades whose bars stopped arriving.
     */
    public TransitionOutcome checkExpiry(Trade trade, double lastPrice, Instant now) {
        return switch (trade.getState()) {
            case OPEN -> isExpired(trade, now)
                    ? close(trade, TradeState.EXPIRED, lastPrice, now, "max holding " + config.getLifecycle().getMaxHolding() + " reached")
                    : TransitionOutcome.noOp(trade);
            case CLOSED_BY_TP, CLOSED_BY_SL, CLOSED_MANUAL, EXPIRED -> ignored(trade, "expiry");
        };
    }

    private static List<TimedBar> timeline(Trade trade, List<Candle> fineBars, Timeframe fineTimeframe,
                                           List<Candle> bars, Timeframe timeframe) {
        Instant straddleEnd = barBoundaryAtOrAfter(trade.getOpenTime(), timeframe);
        List<TimedBar> timeline = new ArrayList<>();
        for (Candle fine : fineBars) {
            if (!fine.closeTime(fineTimeframe).isAfter(straddleEnd)) {
                timeline.add(new TimedBar(fine, fineTimeframe));
            }
        }
        for (Candle bar : bars) {
            timeline.add(new TimedBar(bar, timeframe));
        }
        return timeline;
    }

    /**
     * Bars are aligned to the epoch in UTC.
     */
    private static Instant barBoundaryAtOrAfter(Instant time, Timeframe timeframe) {
        long duration = timeframe.getBarDuration().toMillis();
        long millis = time.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(millis + duration - 1, duration) * duration);
    }

    private TransitionOutcome applyBars(Trade trade, List<TimedBar> timeline) {
        Direction direction = trade.getDirection();
        double entry = trade.getEntryPrice();
        double mfe = trade.getMaxFavorableExcursion();
        double mae = trade.getMaxAdverseExcursion();
        Instant lastBarTime = trade.getLastBarTime();
        boolean applied = false;

        for (TimedBar timed : timeline) {
            Candle bar = timed.bar();
            if (bar.getOpenTime().isBefore(trade.getOpenTime())
                    || (lastBarTime != null && !bar.getOpenTime().isAfter(lastBarTime))) {
                continue;
            }
            applied = true;
            lastBarTime = bar.getOpenTime();
            Instant barClose = bar.closeTime(timed.timeframe());

            boolean stopHit = direction == Direction.BUY
                    ? bar.getLow() <= trade.getStopLoss()
                    : bar.getHigh() >= trade.getStopLoss();
            boolean targetHit = direction == Direction.BUY
                    ? bar.getHigh() >= trade.getTakeProfit()
                    : bar.getLow() <= trade.getTakeProfit();

            if (stopHit && (!targetHit || config.getLifecycle().isStopWinsSameBar())) {
                Trade withBar = withExcursions(trade, mfe, Math.max(mae, -direction.excursion(entry, trade.getStopLoss())), lastBarTime);
                return close(withBar, TradeState.CLOSED_BY_SL, trade.getStopLoss(), barClose,
                        targetHit ? "stop and target on one bar, stop first" : "stop-loss touched");
            }
            if (targetHit) {
                Trade withBar = withExcursions(trade, Math.max(mfe, direction.excursion(entry, trade.getTakeProfit())), mae, lastBarTime);
                return close(withBar, TradeState.CLOSED_BY_TP, trade.getTakeProfit(), barClose,
                        stopHit ? "stop and target on one bar, target first" : "take-profit touched");
            }

            double favorableExtreme = direction == Direction.BUY ? bar.getHigh() : bar.getLow();
            double adverseExtreme = direction == Direction.BUY ? bar.getLow() : bar.getHigh();
            mfe = Math.max(mfe, direction.excursion(entry, favorableExtreme));
            mae = Math.max(mae, -direction.excursion(entry, adverseExtreme));

            if (isExpired(trade, barClose)) {
                return close(withExcursions(trade, mfe, mae, lastBarTime), TradeState.EXPIRED, bar.getClose(), barClose,
                        "max holding " + config.getLifecycle().getMaxHolding() + " reached");
            }
        }

        if (!applied) {
            return TransitionOutcome.noOp(trade);
        }
        Trade updated = withExcursions(trade, mfe, mae, lastBarTime).toBuilder()
                .version(trade.getVersion() + 1)
                .build();
        commit(trade, updated);
        return TransitionOutcome.silent(updated);
    }

    private TransitionOutcome moveLevels(Trade trade, SlTpAdjustment adjustment, double currentPrice, Instant now) {
        Direction direction = trade.getDirection();
        if (!direction.isStrictlyAdverse(currentPrice, adjustment.getNewStopLoss())) {
            throw new InvariantViolationException("Trade",
                    String.format("%s new stop %s not behind current price %s", trade.getId(),
                            adjustment.getNewStopLoss(), currentPrice));
        }
        if (!direction.isStrictlyFavorable(trade.getEntryPrice(), adjustment.getNewTakeProfit())) {
            throw new InvariantViolationException("Trade",
                    String.format("%s new target %s not favorable to entry %s", trade.getId(),
                            adjustment.getNewTakeProfit(), trade.getEntryPrice()));
        }

        Trade updated = trade.toBuilder()
                .stopLoss(adjustment.getNewStopLoss())
                .takeProfit(adjustment.getNewTakeProfit())
                .version(trade.getVersion() + 1)
                .build();
        commit(trade, updated);

        TradeEvent event = AdjustmentApplied.builder()
                .tradeId(trade.getId())
                .symbol(trade.getSymbol())
                .oldStopLoss(trade.getStopLoss())
                .newStopLoss(updated.getStopLoss())
                .oldTakeProfit(trade.getTakeProfit())
                .newTakeProfit(updated.getTakeProfit())
                .reason(adjustment.getAction() + ": " + adjustment.getReason())
                .time(now)
                .build();
        log.info("[TRADE_SM] {} [{}] {} SL {} -> {}", trade.getSymbol(), trade.getId(),
                adjustment.getAction(), trade.getStopLoss(), updated.getStopLoss());
        notificationSink.emit(event);
        return TransitionOutcome.emitted(updated, event);
    }

    private TransitionOutcome close(Trade trade, TradeState target, double price, Instant time, String reason) {
        Trade closed = trade.toBuilder()
                .state(target)
                .closePrice(price)
                .closeTime(time)
                .closeReason(reason)
                .version(trade.getVersion() + 1)
                .build();
        commit(trade, closed);

        CloseDetails details = CloseDetails.of(closed);
        TradeEvent event = switch (target) {
            case CLOSED_BY_SL -> new ClosedBySl(details);
            case CLOSED_BY_TP -> new ClosedByTp(details);
            case CLOSED_MANUAL -> new ClosedManual(details);
            case EXPIRED -> new TradeExpired(details);
            case OPEN -> throw new IllegalArgumentException("OPEN is not a closing state");
        };
        log.info("[TRADE_SM] {} [{}] {} -> {} @ {} ({}R) {}", trade.getSymbol(), trade.getId(),
                trade.getState(), target, price, String.format("%.2f", details.getRMultiple()), reason);
        notificationSink.emit(event);
        return TransitionOutcome.emitted(closed, event);
    }

    /**
     * The read copy's (state, version) is the CAS expectation.
     */
    private void commit(Trade read, Trade updated) {
        if (!outcomeStore.compareAndSetTrade(read.getId(), read.getState(), read.getVersion(), updated)) {
            log.warn("[TRADE_SM] {} [{}] conflict writing v{} over {} v{}", read.getSymbol(), read.getId(),
                    updated.getVersion(), read.getState(), read.getVersion());
            throw new StateConflictException(read.getId(), read.getState(), read.getVersion());
        }
    }

    private boolean isExpired(Trade trade, Instant at) {
        return !trade.getOpenTime().plus(config.getLifecycle().getMaxHolding()).isAfter(at);
    }

    private static Trade withExcursions(Trade trade, double mfe, double mae, Instant lastBarTime) {
        return trade.toBuilder()
                .maxFavorableExcursion(Math.max(0, mfe))
                .maxAdverseExcursion(Math.max(0, mae))
                .lastBarTime(lastBarTime)
                .build();
    }

    private record TimedBar(Candle bar, Timeframe timeframe) {
    }

    private static TransitionOutcome ignored(Trade trade, String attempt) {
        log.debug("[TRADE_SM] {} [{}] {} ignored, trade is {}", trade.getSymbol(), trade.getId(), attempt, trade.getState());
        return TransitionOutcome.noOp(trade);
    }
}
