package com.kotsin.scanner.smc.model;

import com.kotsin.scanner.exception.InvariantViolationException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * OrderBlock - last opposite-direction candle before a strong displacement.
 *
 * BULLISH (demand): last bearish candle before a strong up move.
 * BEARISH (supply): last bullish candle before a strong down move.
 * The zone is that candle's [low, high]. {@code moveRange} and {@code atr} record how strong
 * the displacement was when the block was found.
 */
@Value
public class OrderBlock implements PriceZone {

    double high;
    double low;
    Bias bias;
    int originIndex;
    Instant time;
    double moveRange;
    double atr;

    @Builder
    public OrderBlock(double high, double low, Bias bias, int originIndex, Instant time,
                      double moveRange, double atr) {
        if (!(high > low)) {
            throw new InvariantViolationException("OrderBlock",
                    String.format("zone high %s must exceed low %s", high, low));
        }
        if (bias == null) {
            throw new InvariantViolationException("OrderBlock", "bias is required");
        }
        this.high = high;
        this.low = low;
        this.bias = bias;
        this.originIndex = originIndex;
        this.time = time;
        this.moveRange = moveRange;
        this.atr = atr;
    }

    /**
     * Pruned blocks never reach callers, so every returned block is active.
     */
    @Override
    public boolean isActive() {
        return true;
    }

    public boolean overlaps(OrderBlock other) {
        return low <= other.high && other.low <= high;
    }
}
