package com.kotsin.scanner.smc.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A local price extremum: its high (or low) beats every bar inside the swing window on both sides.
 */
@Value
@Builder
public class SwingPoint {

    public enum Kind {
        HIGH,
        LOW
    }

    int index;
    Instant time;
    double price;
    Kind kind;

    public boolean isHigh() {
        return kind == Kind.HIGH;
    }
}
