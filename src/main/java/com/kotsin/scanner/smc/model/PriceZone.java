package com.kotsin.scanner.smc.model;

import java.time.Instant;

/**
 * Common view of FVG and Order Block zones, used when the strategy looks for the most recent
 * active zone regardless of how it was formed.
 */
public interface PriceZone {

    double getHigh();

    double getLow();

    Bias getBias();

    int getOriginIndex();

    Instant getTime();

    /**
     * Active zones take part in bias decisions; inactive ones are kept for audit only.
     */
    boolean isActive();

    default boolean contains(double price) {
        return price >= getLow() && price <= getHigh();
    }

    default double midpoint() {
        return (getHigh() + getLow()) / 2.0;
    }
}
