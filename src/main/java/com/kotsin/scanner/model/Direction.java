package com.kotsin.scanner.model;

/**
 * Trade direction. Price helpers express "adverse" and "favorable" relative to the direction
 * so callers never branch on BUY/SELL for simple offsets.
 */
public enum Direction {
    BUY,
    SELL;

    /**
     * +1 for BUY, -1 for SELL.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }

    public Direction opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * Move {@code price} by {@code distance} in the favorable direction.
     */
    public double favorable(double price, double distance) {
        return price + sign() * distance;
    }

    /**
     * Move {@code price} by {@code distance} in the adverse direction.
     */
    public double adverse(double price, double distance) {
        return price - sign() * distance;
    }

    /**
     * Signed excursion of {@code price} from {@code reference}; positive when favorable.
     */
    public double excursion(double reference, double price) {
        return sign() * (price - reference);
    }

    /**
     * True when {@code price} lies strictly on the adverse side of {@code reference}.
     */
    public boolean isStrictlyAdverse(double reference, double price) {
        return excursion(reference, price) < 0;
    }

    /**
     * True when {@code price} lies strictly on the favorable side of {@code reference}.
     */
    public boolean isStrictlyFavorable(double reference, double price) {
        return excursion(reference, price) > 0;
    }
}
