package com.aqiindia.core.aqi;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Converts particulate concentrations into AQI sub-indices and aggregates them into an overall AQI.
 *
 * <p>All operations are pure and safe to call from any thread. Absence of data is always an empty
 * optional and never zero; a concentration that is present but unusable raises
 * {@link InvalidConcentrationException}.
 *
 * <p>Sub-indices are rounded half-up, so {@code 75.5} becomes {@code 76}.
 */
public final class AqiCalculator {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private AqiCalculator() {
    }

    /**
     * Index for {@code concentration} inside a single band, unrounded.
     *
     * @return the interpolated index, {@code indexLow} for a degenerate band, or empty when the
     *         concentration lies outside {@code [concentrationLow, concentrationHigh]}
     */
    public static OptionalDouble interpolate(double concentration, Breakpoint breakpoint) {
        return breakpoint.interpolate(concentration);
    }

    /**
     * Rounded sub-index for a possibly absent concentration.
     *
     * <p>The first band containing the concentration wins. Concentrations above the last band follow
     * the last band's slope without a cap.
     *
     * @throws InvalidConcentrationException if the concentration is negative or not finite
     */
    public static OptionalInt subIndex(OptionalDouble concentration, BreakpointTable table) {
        if (concentration.isEmpty()) {
            return OptionalInt.empty();
        }
        return subIndex(concentration.getAsDouble(), table);
    }

    public static OptionalInt subIndex(double concentration, BreakpointTable table) {
        return subIndex(ownerOf(table), concentration, table);
    }

    public static OptionalInt subIndex(Measurement measurement) {
        return subIndex(measurement.pollutant(), measurement.concentration(), measurement.pollutant().table());
    }

    private static OptionalInt subIndex(Pollutant pollutant, double concentration, BreakpointTable table) {
        requireValidConcentration(pollutant, concentration);
        if (concentration < table.first().concentrationLow()) {
            return OptionalInt.empty();
        }
        for (Breakpoint breakpoint : table.breakpoints()) {
            OptionalDouble index = breakpoint.interpolate(concentration);
            if (index.isPresent()) {
                return OptionalInt.of(roundHalfUp(pollutant, index.getAsDouble(), concentration));
            }
        }
        Breakpoint last = table.last();
        return OptionalInt.of(roundHalfUp(pollutant, last.project(concentration), concentration));
    }

    /**
     * Worst-pollutant aggregation: the maximum of the present sub-indices, or empty when none is present.
     */
    public static OptionalInt overallAqi(Collection<OptionalInt> subIndices) {
        OptionalInt max = OptionalInt.empty();
        for (OptionalInt subIndex : subIndices) {
            if (subIndex == null || subIndex.isEmpty()) {
                continue;
            }
            if (max.isEmpty() || subIndex.getAsInt() > max.getAsInt()) {
                max = subIndex;
            }
        }
        return max;
    }

    /**
     * Full assessment for the present concentrations. Pollutants missing from the map, or mapped to
     * {@code null}, count as no data.
     */
    public static AqiAssessment assess(Map<Pollutant, Double> concentrations) {
        Map<Pollutant, Double> present = new EnumMap<>(Pollutant.class);
        Map<Pollutant, Integer> subIndices = new EnumMap<>(Pollutant.class);
        for (Pollutant pollutant : Pollutant.values()) {
            Double concentration = concentrations.get(pollutant);
            if (concentration == null) {
                continue;
            }
            double value = requireValidConcentration(pollutant, concentration);
            present.put(pollutant, value);
            subIndex(pollutant, value, pollutant.table()).ifPresent(index -> subIndices.put(pollutant, index));
        }

        OptionalInt aqi = overallAqi(subIndices.values().stream().map(OptionalInt::of).toList());
        if (aqi.isEmpty()) {
            return new AqiAssessment(present, subIndices, null, null, null);
        }
        Pollutant dominant = null;
        for (Map.Entry<Pollutant, Integer> entry : subIndices.entrySet()) {
            if (entry.getValue() == aqi.getAsInt()) {
                dominant = entry.getKey();
                break;
            }
        }
        return new AqiAssessment(present, subIndices, aqi.getAsInt(), AqiCategory.forAqi(aqi.getAsInt()), dominant);
    }

    public static AqiAssessment assess(Collection<Measurement> measurements) {
        Map<Pollutant, Double> concentrations = new EnumMap<>(Pollutant.class);
        for (Measurement measurement : measurements) {
            if (concentrations.put(measurement.pollutant(), measurement.concentration()) != null) {
                throw new IllegalArgumentException("Duplicate measurement for " + measurement.pollutant().parameter());
            }
        }
        return assess(concentrations);
    }

    /**
     * Parses a raw concentration. Null or blank input is no data; anything else must be a plain
     * decimal number (optionally with an exponent) that is non-negative and finite.
     */
    public static OptionalDouble parseConcentration(Pollutant pollutant, String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalDouble.empty();
        }
        String trimmed = raw.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            throw new InvalidConcentrationException(pollutant, raw, "not a number");
        }
        return OptionalDouble.of(requireValidConcentration(pollutant, Double.parseDouble(trimmed)));
    }

    /**
     * @return the concentration with negative zero folded to zero
     */
    static double requireValidConcentration(Pollutant pollutant, double concentration) {
        if (Double.isNaN(concentration) || Double.isInfinite(concentration)) {
            throw new InvalidConcentrationException(pollutant, String.valueOf(concentration), "not a finite number");
        }
        if (concentration < 0) {
            throw new InvalidConcentrationException(pollutant, String.valueOf(concentration), "negative concentration");
        }
        return concentration + 0.0;
    }

    private static int roundHalfUp(Pollutant pollutant, double index, double concentration) {
        long rounded = Math.round(index);
        if (rounded > Integer.MAX_VALUE) {
            throw new InvalidConcentrationException(
                    pollutant,
                    String.valueOf(concentration),
                    "sub-index exceeds " + Integer.MAX_VALUE
            );
        }
        return (int) rounded;
    }

    private static Pollutant ownerOf(BreakpointTable table) {
        for (Pollutant pollutant : Pollutant.values()) {
            if (pollutant.table().equals(table)) {
                return pollutant;
            }
        }
        return null;
    }
}
