package com.kotsin.scanner.smc.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A structural shift on one series.
 *
 * For BOS/CHOCH {@code price} is the breaking close; for a sweep it is the wick extreme.
 * {@code level} is the swing price that was broken or swept.
 */
@Value
@Builder
public class StructureEvent {

    public enum Kind {
        BOS,    // close beyond a swing in the prevailing (or first) trend direction
        CHOCH,  // BOS against the previously established trend
        SWEEP   // wick beyond a swing, close back inside
    }

    Kind kind;
    Bias bias;
    double price;
    double level;
    int index;
    Instant time;

    public boolean isBreak() {
        return kind == Kind.BOS || kind == Kind.CHOCH;
    }
}
