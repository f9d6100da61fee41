package com.kotsin.scanner.notification;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.trading.event.PeriodSummary;
import com.kotsin.scanner.trading.event.TradeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * KafkaNotificationSink - publishes events as JSON to the trade-events topic, keyed by symbol so
 * all events of one symbol stay ordered on one partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scanner.notification.kafka.enabled", havingValue = "true")
public class KafkaNotificationSink implements NotificationSink {

    private static final String SUMMARY_KEY = "summary";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ScannerConfig config;

    @Override
    public void emit(TradeEvent event) {
        String topic = config.getNotification().getKafka().getTopic();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", event.getEventType());
        payload.put("event", event);
        try {
            kafkaTemplate.send(topic, event.getSymbol(), payload);
            log.debug("[NOTIFY] {} {} published to {}", event.getSymbol(), event.getEventType(), topic);
        } catch (Exception e) {
            log.error("[NOTIFY] {} Failed to publish {} for trade {}: {}",
                    event.getSymbol(), event.getEventType(), event.getTradeId(), e.getMessage());
        }
    }

    @Override
    public void publishSummary(PeriodSummary summary) {
        String topic = config.getNotification().getKafka().getTopic();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "PeriodSummary");
        payload.put("event", summary);
        try {
            kafkaTemplate.send(topic, SUMMARY_KEY, payload);
        } catch (Exception e) {
            log.error("[NOTIFY] Failed to publish period summary: {}", e.getMessage());
        }
    }
}
