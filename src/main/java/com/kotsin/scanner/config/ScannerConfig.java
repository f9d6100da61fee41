package com.kotsin.scanner.config;

import com.kotsin.scanner.model.Timeframe;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration for the scanner: detector windows, strategy lookbacks,
 * risk parameters and lifecycle policy. Nothing in the core hard-codes these values.
 */
@Configuration
@ConfigurationProperties(prefix = "scanner")
@Data
public class ScannerConfig {

    /**
     * Symbol alias -> provider symbol (e.g. US30 -> ^DJI)
     */
    private Map<String, String> symbols = new LinkedHashMap<>();

    /**
     * Delay between scan cycles
     */
    private long scanIntervalMs = 60_000L;

    /**
     * Delay between period summaries
     */
    private long summaryIntervalMs = 7_200_000L;

    /**
     * Run the scan cycle on a timer. Off by default so tests and one-shot runs stay quiet.
     */
    private boolean schedulingEnabled = false;

    /**
     * Outcome store backend: "memory" or "mongo"
     */
    private String store = "memory";

    private StructureConfig structure = new StructureConfig();

    private OrderBlockConfig orderBlock = new OrderBlockConfig();

    private StrategyConfig strategy = new StrategyConfig();

    private RiskConfig risk = new RiskConfig();

    private LifecycleConfig lifecycle = new LifecycleConfig();

    private CandleCacheConfig candleCache = new CandleCacheConfig();

    private HistoryApiConfig historyApi = new HistoryApiConfig();

    private NotificationConfig notification = new NotificationConfig();

    @Data
    public static class StructureConfig {
        /**
         * Bars on each side a swing extreme must beat
         */
        private int swingWindow = 3;
    }

    @Data
    public static class OrderBlockConfig {
        /**
         * Displacement range must exceed this multiple of the trailing ATR
         */
        private double strengthMultiplier = 1.5;

        /**
         * Trailing window for the local average true range
         */
        private int atrWindow = 14;

        /**
         * Bars after the candidate candle that make up the displacement
         */
        private int moveBars = 3;
    }

    @Data
    public static class StrategyConfig {
        private String name = "H4 FVG / OB + structure";

        /**
         * Only H4 zones originating in the last N bars decide bias
         */
        private int h4ZoneLookback = 20;

        /**
         * H1/M30/M15 BOS/CHOCH must be within the last N bars of that series
         */
        private int confirmationLookback = 10;

        /**
         * M5/M1 trigger must be within the last N bars of that series
         */
        private int entryLookback = 3;

        /**
         * Rejection wick must be at least this multiple of the candle body
         */
        private double wickBodyRatio = 2.0;
    }

    @Data
    public static class RiskConfig {
        private int atrPeriod = 14;

        /**
         * k: stop sits k x ATR(H4) beyond the structural swing
         */
        private double stopAtrBuffer = 0.5;

        /**
         * H4 bars searched for the protective swing
         */
        private int swingLookback = 30;

        /**
         * Closed trades needed before the median MFE drives the target
         */
        private int minSampleCount = 10;

        /**
         * Risk-reward multiple used when history is too thin
         */
        private double fallbackRr = 2.0;

        private double equity = 10_000.0;

        private double riskFraction = 0.01;

        /**
         * Account currency per one price unit per one unit of size
         */
        private double pointValue = 1.0;

        private double breakEvenR = 1.0;

        private double trailR = 2.0;

        /**
         * Trailing distance as a fraction of ATR(H4)
         */
        private double trailAtrFraction = 1.0;

        /**
         * Early close once elapsed time exceeds median winner holding time by this factor
         */
        private double staleHoldingFactor = 2.0;

        /**
         * Evaluation order of the adjustment rules; the first matching rule wins
         */
        private List<AdjustmentRule> adjustmentOrder = new ArrayList<>(
                List.of(AdjustmentRule.BREAK_EVEN, AdjustmentRule.TRAIL, AdjustmentRule.CLOSE_EARLY));
    }

    public enum AdjustmentRule {
        BREAK_EVEN,
        TRAIL,
        CLOSE_EARLY
    }

    @Data
    public static class LifecycleConfig {
        private Duration maxHolding = Duration.ofDays(7);

        /**
         * When one bar touches both levels, close at the stop (true) or at the target (false)
         */
        private boolean stopWinsSameBar = true;

        /**
         * Bars of this timeframe drive SL/TP/expiry checks
         */
        private Timeframe barTimeframe = Timeframe.H1;

        /**
         * Re-read and re-evaluate attempts after a compare-and-set conflict
         */
        private int maxConflictRetries = 3;
    }

    @Data
    public static class CandleCacheConfig {
        private long maxSize = 500L;
        // floor for entries whose next bar is overdue (market closed, provider lagging)
        private Duration minTtl = Duration.ofSeconds(30);
    }

    @Data
    public static class HistoryApiConfig {
        private String baseUrl = "http://localhost:8002";
        private int connectTimeoutMs = 5_000;
        private int readTimeoutMs = 60_000;
    }

    @Data
    public static class NotificationConfig {
        private KafkaNotificationConfig kafka = new KafkaNotificationConfig();
    }

    @Data
    public static class KafkaNotificationConfig {
        private boolean enabled = false;
        private String topic = "trade-events";
    }
}
