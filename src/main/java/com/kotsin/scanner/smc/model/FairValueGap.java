package com.kotsin.scanner.smc.model;

import com.kotsin.scanner.exception.InvariantViolationException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * FairValueGap - three-candle price imbalance.
 *
 * BULLISH: zone [candle1.high, candle3.low]
 * BEARISH: zone [candle3.high, candle1.low]
 *
 * A gap is filled the first time a later bar's range covers the whole zone. Filled gaps stay in
 * detector output for explainability but are no longer active.
 */
@Getter
@ToString
public class FairValueGap implements PriceZone {

    private final double high;
    private final double low;
    private final Bias bias;
    private final int originIndex;
    private final Instant time;
    private boolean filled;
    private int filledIndex = -1;

    public FairValueGap(double high, double low, Bias bias, int originIndex, Instant time) {
        if (!(high > low)) {
            throw new InvariantViolationException("FairValueGap",
                    String.format("zone high %s must exceed low %s", high, low));
        }
        if (bias == null) {
            throw new InvariantViolationException("FairValueGap", "bias is required");
        }
        this.high = high;
        this.low = low;
        this.bias = bias;
        this.originIndex = originIndex;
        this.time = time;
    }

    /**
     * Record the bar that filled this gap. Only the first fill counts.
     */
    public void markFilled(int index) {
        if (!filled) {
            filled = true;
            filledIndex = index;
        }
    }

    @Override
    public boolean isActive() {
        return !filled;
    }
}
