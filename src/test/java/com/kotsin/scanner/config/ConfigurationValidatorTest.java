package com.kotsin.scanner.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigurationValidator - startup checks")
class ConfigurationValidatorTest {

    private ScannerConfig config;

    @BeforeEach
    void setUp() {
        config = new ScannerConfig();
        config.setSymbols(Map.of("US30", "^DJI"));
    }

    @Test
    @DisplayName("Defaults with one symbol are valid")
    void testDefaultsValid() {
        assertTrue(ConfigurationValidator.validate(config).isEmpty());
    }

    @Test
    @DisplayName("Missing symbols and an unknown store are reported")
    void testSymbolsAndStore() {
        config.setSymbols(Map.of());
        config.setStore("redis");

        List<String> errors = ConfigurationValidator.validate(config);

        assertEquals(2, errors.size());
        assertTrue(errors.stream().anyMatch(e -> e.contains("scanner.symbols")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("scanner.store")));
    }

    @Test
    @DisplayName("Risk and lifecycle parameters out of range are reported")
    void testRiskAndLifecycle() {
        config.getRisk().setRiskFraction(1.5);
        config.getRisk().setPointValue(0);
        config.getRisk().setAdjustmentOrder(List.of());
        config.getLifecycle().setMaxHolding(Duration.ZERO);
        config.getStructure().setSwingWindow(0);

        List<String> errors = ConfigurationValidator.validate(config);

        assertEquals(5, errors.size());
        assertTrue(errors.stream().anyMatch(e -> e.contains("risk-fraction")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("max-holding")));
    }

    @Test
    @DisplayName("Non-positive intervals, adjustment thresholds and cache TTL are reported")
    void testIntervalsAndAdjustmentThresholds() {
        config.setSummaryIntervalMs(0);
        config.getRisk().setBreakEvenR(0);
        config.getRisk().setTrailR(-1);
        config.getRisk().setTrailAtrFraction(0);
        config.getRisk().setStaleHoldingFactor(0);
        config.getCandleCache().setMinTtl(Duration.ZERO);

        List<String> errors = ConfigurationValidator.validate(config);

        assertEquals(6, errors.size());
        assertTrue(errors.stream().anyMatch(e -> e.contains("summary-interval-ms")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("break-even-r")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("trail-r")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("trail-atr-fraction")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("stale-holding-factor")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("min-ttl")));
    }
}
