package com.kotsin.scanner.service;

import com.kotsin.scanner.notification.NotificationSink;
import com.kotsin.scanner.store.OutcomeStore;
import com.kotsin.scanner.trading.event.PeriodSummary;
import com.kotsin.scanner.trading.state.Trade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Builds and publishes the activity digest for a reporting period [from, to).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PeriodSummaryService {

    private final OutcomeStore outcomeStore;
    private final NotificationSink notificationSink;

    public PeriodSummary summarize(Instant from, Instant to) {
        List<Trade> opened = outcomeStore.findTradesOpenedBetween(from, to);
        List<Trade> closed = outcomeStore.findTradesClosedBetween(from, to);

        int tp = 0;
        int sl = 0;
        int manual = 0;
        int expired = 0;
        int winners = 0;
        double totalR = 0;

        for (Trade trade : closed) {
            switch (trade.getState()) {
                case CLOSED_BY_TP -> tp++;
                case CLOSED_BY_SL -> sl++;
                case CLOSED_MANUAL -> manual++;
                case EXPIRED -> expired++;
                case OPEN -> {
                    continue;
                }
            }
            double r = trade.rMultipleAt(trade.getClosePrice());
            totalR += r;
            if (r > 0) {
                winners++;
            }
        }

        int closedCount = tp + sl + manual + expired;
        return PeriodSummary.builder()
                .from(from)
                .to(to)
                .opened(opened.size())
                .closedByTp(tp)
                .closedBySl(sl)
                .closedManual(manual)
                .expired(expired)
                .stillOpen(outcomeStore.findAllOpenTrades().size())
                .totalR(totalR)
                .winRate(closedCount == 0 ? 0 : (double) winners / closedCount)
                .build();
    }

    public PeriodSummary publish(Instant from, Instant to) {
        PeriodSummary summary = summarize(from, to);
        log.info("[SCANNER] Summary {} -> {}: opened={} closed={}", from, to, summary.getOpened(), summary.getClosed());
        notificationSink.publishSummary(summary);
        return summary;
    }
}
