package com.kotsin.scanner.trading.state;

/**
 * Lifecycle state of a trade. Every state except OPEN is terminal and absorbing.
 */
public enum TradeState {
    OPEN,
    CLOSED_BY_TP,
    CLOSED_BY_SL,
    CLOSED_MANUAL,
    EXPIRED;

    public boolean isTerminal() {
        return switch (this) {
            case OPEN -> false;
            case CLOSED_BY_TP, CLOSED_BY_SL, CLOSED_MANUAL, EXPIRED -> true;
        };
    }
}
