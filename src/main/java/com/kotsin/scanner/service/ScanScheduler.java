package com.kotsin.scanner.service;

import com.kotsin.scanner.config.ScannerConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Timer for scan cycles and period summaries. Only active with scanner.scheduling-enabled=true.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scanner.scheduling-enabled", havingValue = "true")
public class ScanScheduler {

    private final SymbolScannerService scannerService;
    private final PeriodSummaryService summaryService;
    private final ScannerConfig config;
    private final Clock clock;

    private final AtomicReference<Instant> periodStart = new AtomicReference<>();

    @Scheduled(fixedDelayString = "${scanner.scan-interval-ms:60000}", initialDelay = 5000)
    public void scan() {
        try {
            scannerService.runScanCycle();
        } catch (RuntimeException e) {
            log.error("[SCANNER] Scan cycle failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${scanner.summary-interval-ms:7200000}",
            initialDelayString = "${scanner.summary-interval-ms:7200000}")
    public void summarize() {
        Instant now = clock.instant();
        Instant from = periodStart.getAndSet(now);
        if (from == null) {
            from = now.minusMillis(config.getSummaryIntervalMs());
        }
        try {
            summaryService.publish(from, now);
        } catch (RuntimeException e) {
            log.error("[SCANNER] Summary failed: {}", e.getMessage(), e);
        }
    }
}
