package com.aqiindia.core.aqi;

/**
 * A concentration that was supplied but cannot be used: non-numeric, negative or non-finite.
 * Distinct from a missing concentration, which is modelled as an empty optional.
 */
public class InvalidConcentrationException extends IllegalArgumentException {
    private final Pollutant pollutant;
    private final String rawValue;

    public InvalidConcentrationException(Pollutant pollutant, String rawValue, String reason) {
        super(describe(pollutant, rawValue, reason));
        this.pollutant = pollutant;
        this.rawValue = rawValue;
    }

    public InvalidConcentrationException(Pollutant pollutant, String rawValue, String reason, Throwable cause) {
        super(describe(pollutant, rawValue, reason), cause);
        this.pollutant = pollutant;
        this.rawValue = rawValue;
    }

    /** May be null when the value was checked without a pollutant. */
    public Pollutant pollutant() {
        return pollutant;
    }

    public String rawValue() {
        return rawValue;
    }

    private static String describe(Pollutant pollutant, String rawValue, String reason) {
        String name = pollutant == null ? "concentration" : pollutant.parameter();
        return "Invalid " + name + " value '" + rawValue + "': " + reason;
    }
}
