package com.kotsin.scanner.notification;

import com.kotsin.scanner.trading.event.AdjustmentApplied;
import com.kotsin.scanner.trading.event.CloseDetails;
import com.kotsin.scanner.trading.event.ClosedBySl;
import com.kotsin.scanner.trading.event.ClosedByTp;
import com.kotsin.scanner.trading.event.ClosedManual;
import com.kotsin.scanner.trading.event.PeriodSummary;
import com.kotsin.scanner.trading.event.SignalAccepted;
import com.kotsin.scanner.trading.event.TradeEvent;
import com.kotsin.scanner.trading.event.TradeExpired;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * LoggingNotificationSink - writes each event as one human-readable log line.
 * Default sink when Kafka publishing is off.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "scanner.notification.kafka.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void emit(TradeEvent event) {
        log.info("[NOTIFY] {}", format(event));
    }

    @Override
    public void publishSummary(PeriodSummary summary) {
        log.info("[NOTIFY] Summary {} -> {}: opened={} closed={} (TP={} SL={} manual={} expired={}) open={} totalR={} winRate={}%",
                summary.getFrom(), summary.getTo(), summary.getOpened(), summary.getClosed(),
                summary.getClosedByTp(), summary.getClosedBySl(), summary.getClosedManual(), summary.getExpired(),
                summary.getStillOpen(), String.format("%.2f", summary.getTotalR()),
                String.format("%.1f", summary.getWinRate() * 100));
    }

    static String format(TradeEvent event) {
        if (event instanceof SignalAccepted s) {
            return String.format("NEW %s %s @ %.5f | SL %.5f | TP %.5f | risk %.2f | size %.4f | RR %.2f | %s",
                    s.getDirection(), s.getSymbol(), s.getEntryPrice(), s.getStopLoss(), s.getTakeProfit(),
                    s.getRiskAmount(), s.getSize(), s.getRiskReward(), s.getRationale());
        }
        if (event instanceof AdjustmentApplied a) {
            return String.format("ADJUST %s [%s] SL %.5f -> %.5f | TP %.5f -> %.5f | %s",
                    a.getSymbol(), a.getTradeId(), a.getOldStopLoss(), a.getNewStopLoss(),
                    a.getOldTakeProfit(), a.getNewTakeProfit(), a.getReason());
        }
        if (event instanceof ClosedBySl e) {
            return closed("STOP HIT", e.getDetails());
        }
        if (event instanceof ClosedByTp e) {
            return closed("TARGET HIT", e.getDetails());
        }
        if (event instanceof ClosedManual e) {
            return closed("CLOSED", e.getDetails());
        }
        if (event instanceof TradeExpired e) {
            return closed("EXPIRED", e.getDetails());
        }
        return event.getEventType() + " " + event.getSymbol() + " [" + event.getTradeId() + "]";
    }

    private static String closed(String label, CloseDetails d) {
        return String.format("%s %s %s [%s] entry %.5f exit %.5f | %.2fR | held %s | %s",
                label, d.getDirection(), d.getSymbol(), d.getTradeId(), d.getEntryPrice(), d.getClosePrice(),
                d.getRMultiple(), d.getHolding(), d.getReason());
    }
}
