package com.kotsin.scanner.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fails startup on configuration the core cannot work with.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator {

    private final ScannerConfig config;

    @Value("${spring.profiles.active:default}")
    private String activeProfile;

    @Value("${spring.data.mongodb.uri:}")
    private String mongoUri;

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        if ("test".equals(activeProfile)) {
            log.info("[CONFIG] Skipping configuration validation in test mode");
            return;
        }

        List<String> errors = validate(config);
        if ("mongo".equals(config.getStore()) && isNullOrEmpty(mongoUri)) {
            errors.add("scanner.store=mongo but spring.data.mongodb.uri is not configured");
        }

        if (!errors.isEmpty()) {
            log.error("[CONFIG] Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed. Please fix the errors above.");
        }

        log.info("[CONFIG] Configuration validation passed");
        logConfigurationSummary();
    }

    static List<String> validate(ScannerConfig config) {
        List<String> errors = new ArrayList<>();

        if (config.getSymbols().isEmpty()) {
            errors.add("scanner.symbols is empty");
        }
        if (config.getScanIntervalMs() <= 0) {
            errors.add("scanner.scan-interval-ms must be positive");
        }
        if (config.getSummaryIntervalMs() <= 0) {
            errors.add("scanner.summary-interval-ms must be positive");
        }
        if (!"memory".equals(config.getStore()) && !"mongo".equals(config.getStore())) {
            errors.add("scanner.store must be 'memory' or 'mongo', was " + config.getStore());
        }
        if (config.getStructure().getSwingWindow() < 1) {
            errors.add("scanner.structure.swing-window must be >= 1");
        }
        if (config.getOrderBlock().getStrengthMultiplier() <= 0) {
            errors.add("scanner.order-block.strength-multiplier must be positive");
        }
        if (config.getOrderBlock().getAtrWindow() < 1 || config.getOrderBlock().getMoveBars() < 1) {
            errors.add("scanner.order-block.atr-window and move-bars must be >= 1");
        }
        if (config.getStrategy().getH4ZoneLookback() < 1
                || config.getStrategy().getConfirmationLookback() < 1
                || config.getStrategy().getEntryLookback() < 1) {
            errors.add("scanner.strategy lookbacks must be >= 1");
        }

        ScannerConfig.RiskConfig risk = config.getRisk();
        if (risk.getAtrPeriod() < 1) {
            errors.add("scanner.risk.atr-period must be >= 1");
        }
        if (risk.getStopAtrBuffer() <= 0) {
            errors.add("scanner.risk.stop-atr-buffer must be positive");
        }
        if (risk.getEquity() <= 0) {
            errors.add("scanner.risk.equity must be positive");
        }
        if (risk.getRiskFraction() <= 0 || risk.getRiskFraction() >= 1) {
            errors.add("scanner.risk.risk-fraction must be in (0, 1)");
        }
        if (risk.getPointValue() <= 0) {
            errors.add("scanner.risk.point-value must be positive");
        }
        if (risk.getFallbackRr() <= 0) {
            errors.add("scanner.risk.fallback-rr must be positive");
        }
        if (risk.getSwingLookback() < 1 || risk.getMinSampleCount() < 1) {
            errors.add("scanner.risk.swing-lookback and min-sample-count must be >= 1");
        }
        if (risk.getBreakEvenR() <= 0) {
            errors.add("scanner.risk.break-even-r must be positive");
        }
        if (risk.getTrailR() <= 0) {
            errors.add("scanner.risk.trail-r must be positive");
        }
        if (risk.getTrailAtrFraction() <= 0) {
            errors.add("scanner.risk.trail-atr-fraction must be positive");
        }
        if (risk.getStaleHoldingFactor() <= 0) {
            errors.add("scanner.risk.stale-holding-factor must be positive");
        }
        if (risk.getAdjustmentOrder() == null || risk.getAdjustmentOrder().isEmpty()) {
            errors.add("scanner.risk.adjustment-order must list at least one rule");
        }

        if (config.getLifecycle().getMaxHolding() == null
                || config.getLifecycle().getMaxHolding().isNegative()
                || config.getLifecycle().getMaxHolding().isZero()) {
            errors.add("scanner.lifecycle.max-holding must be positive");
        }
        if (config.getLifecycle().getMaxConflictRetries() < 0) {
            errors.add("scanner.lifecycle.max-conflict-retries must be >= 0");
        }
        if (config.getCandleCache().getMaxSize() <= 0) {
            errors.add("scanner.candle-cache.max-size must be positive");
        }
        Duration minTtl = config.getCandleCache().getMinTtl();
        if (minTtl == null || minTtl.isNegative() || minTtl.isZero()) {
            errors.add("scanner.candle-cache.min-ttl must be positive");
        }
        return errors;
    }

    private void logConfigurationSummary() {
        ScannerConfig.RiskConfig risk = config.getRisk();
        log.info("[CONFIG] Configuration Summary:");
        log.info("  Symbols: {}", config.getSymbols());
        log.info("  Scan interval: {}ms, scheduling={}", config.getScanIntervalMs(), config.isSchedulingEnabled());
        log.info("  Store: {} ({})", config.getStore(), maskUri(mongoUri));
        log.info("  Risk: equity={} fraction={} k={} minSamples={} fallbackRR={}",
                risk.getEquity(), risk.getRiskFraction(), risk.getStopAtrBuffer(),
                risk.getMinSampleCount(), risk.getFallbackRr());
        log.info("  Lifecycle: maxHolding={} stopWinsSameBar={} bars={}",
                config.getLifecycle().getMaxHolding(), config.getLifecycle().isStopWinsSameBar(),
                config.getLifecycle().getBarTimeframe());
        log.info("  Kafka events: {}", config.getNotification().getKafka().isEnabled()
                ? config.getNotification().getKafka().getTopic() : "off");
    }

    private static boolean isNullOrEmpty(String str) {
        return str == null || str.trim().isEmpty();
    }

    private static String maskUri(String uri) {
        if (isNullOrEmpty(uri)) {
            return "not configured";
        }
        return uri.replaceAll(":[^:@]+@", ":****@");
    }
}
