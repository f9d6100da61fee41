package com.kotsin.scanner.smc.model;

import com.kotsin.scanner.model.Direction;

/**
 * Directional bias of a structure event or price zone.
 */
public enum Bias {
    BULLISH,
    BEARISH;

    public Direction toDirection() {
        return this == BULLISH ? Direction.BUY : Direction.SELL;
    }

    public static Bias of(Direction direction) {
        return direction == Direction.BUY ? BULLISH : BEARISH;
    }
}
