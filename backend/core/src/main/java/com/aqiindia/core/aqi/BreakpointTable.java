package com.aqiindia.core.aqi;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, contiguous breakpoint bands starting at zero concentration.
 */
public record BreakpointTable(List<Breakpoint> breakpoints) {
    public BreakpointTable {
        Objects.requireNonNull(breakpoints, "breakpoints are required");
        breakpoints = List.copyOf(breakpoints);
        if (breakpoints.isEmpty()) {
            throw new IllegalArgumentException("Breakpoint table must have at least one band");
        }
        if (breakpoints.get(0).concentrationLow() != 0.0) {
            throw new IllegalArgumentException("Breakpoint table must start at concentration 0");
        }
        for (int i = 1; i < breakpoints.size(); i++) {
            Breakpoint previous = breakpoints.get(i - 1);
            Breakpoint current = breakpoints.get(i);
            if (current.concentrationLow() <= previous.concentrationLow()) {
                throw new IllegalArgumentException("Breakpoint lows must strictly increase at band " + i);
            }
            if (current.concentrationLow() != previous.concentrationHigh()) {
                throw new IllegalArgumentException("Breakpoint band " + i + " is not contiguous with band " + (i - 1));
            }
        }
    }

    public static BreakpointTable of(Breakpoint... breakpoints) {
        return new BreakpointTable(List.of(breakpoints));
    }

    public Breakpoint first() {
        return breakpoints.get(0);
    }

    public Breakpoint last() {
        return breakpoints.get(breakpoints.size() - 1);
    }

    public int nominalMaxIndex() {
        return last().indexHigh();
    }
}
