package com.aqiindia.core.aqi;

import java.util.OptionalDouble;

/**
 * One linear band of a breakpoint table, mapping {@code [concentrationLow, concentrationHigh]}
 * onto {@code [indexLow, indexHigh]}.
 */
public record Breakpoint(
        double concentrationLow,
        double concentrationHigh,
        int indexLow,
        int indexHigh
) {
    public Breakpoint {
        if (Double.isNaN(concentrationLow) || Double.isNaN(concentrationHigh)) {
            throw new IllegalArgumentException("Breakpoint concentrations must be numbers");
        }
        if (concentrationHigh < concentrationLow) {
            throw new IllegalArgumentException(
                    "Breakpoint high " + concentrationHigh + " is below low " + concentrationLow
            );
        }
        if (indexHigh < indexLow) {
            throw new IllegalArgumentException("Breakpoint index high " + indexHigh + " is below low " + indexLow);
        }
    }

    public boolean contains(double concentration) {
        return concentration >= concentrationLow && concentration <= concentrationHigh;
    }

    public boolean isDegenerate() {
        return concentrationHigh == concentrationLow;
    }

    /**
     * Linear index for {@code concentration} along this band, ignoring the band limits.
     */
    double project(double concentration) {
        if (isDegenerate()) {
            return indexLow;
        }
        return indexLow + (double) (indexHigh - indexLow) * (concentration - concentrationLow)
                / (concentrationHigh - concentrationLow);
    }

    public OptionalDouble interpolate(double concentration) {
        if (!contains(concentration)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(project(concentration));
    }
}
