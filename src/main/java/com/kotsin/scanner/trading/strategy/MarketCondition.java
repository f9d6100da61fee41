package com.kotsin.scanner.trading.strategy;

/**
 * Read of higher-timeframe structure relative to an open trade's direction.
 */
public enum MarketCondition {
    CONTINUATION,   // latest H4/H1 break agrees with the trade
    EXHAUSTION,     // latest break or sweep goes against the trade
    NEUTRAL         // nothing recent either way
}
