package com.kotsin.scanner.trading.strategy;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Newest H4 bar open time already evaluated, per symbol. Owned by the scanner, read into each
 * {@link com.kotsin.scanner.mtf.MultiTimeframeContext}.
 */
@Component
public class H4CloseTracker {

    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();

    public Instant lastSeen(String symbol) {
        return lastSeen.get(symbol);
    }

    /**
     * Record {@code barTime} if it is newer than what is stored. Returns true when it was new.
     */
    public boolean markSeen(String symbol, Instant barTime) {
        Instant previous = lastSeen.get(symbol);
        if (previous != null && !barTime.isAfter(previous)) {
            return false;
        }
        lastSeen.merge(symbol, barTime, (a, b) -> b.isAfter(a) ? b : a);
        return true;
    }
}
