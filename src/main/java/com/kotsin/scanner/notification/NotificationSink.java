package com.kotsin.scanner.notification;

import com.kotsin.scanner.trading.event.PeriodSummary;
import com.kotsin.scanner.trading.event.TradeEvent;

/**
 * Outbound channel for trade events. Called at most once per committed transition, never for
 * no-op attempts. Delivery problems are the sink's to log; they never undo a transition.
 */
public interface NotificationSink {

    void emit(TradeEvent event);

    void publishSummary(PeriodSummary summary);
}
