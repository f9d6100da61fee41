package com.kotsin.scanner.trading.state;

import com.kotsin.scanner.trading.event.TradeEvent;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Result of one state-machine call: the trade as now stored, whether anything was written, and
 * the event emitted for a state or level change (absent for no-ops and silent excursion updates).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransitionOutcome {

    Trade trade;
    boolean written;
    TradeEvent event;

    public static TransitionOutcome noOp(Trade trade) {
        return new TransitionOutcome(trade, false, null);
    }

    public static TransitionOutcome silent(Trade trade) {
        return new TransitionOutcome(trade, true, null);
    }

    public static TransitionOutcome emitted(Trade trade, TradeEvent event) {
        return new TransitionOutcome(trade, true, event);
    }

    public Optional<TradeEvent> getEvent() {
        return Optional.ofNullable(event);
    }

    public boolean isTransitioned() {
        return event != null;
    }
}
