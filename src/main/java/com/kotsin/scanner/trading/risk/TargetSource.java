package com.kotsin.scanner.trading.risk;

/**
 * Where a take-profit distance came from.
 */
public enum TargetSource {
    HISTORICAL_MFE,
    FIXED_RR
}
