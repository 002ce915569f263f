package com.aqiindia.core.aqi;

import java.util.Locale;
import java.util.Optional;

public enum Pollutant {
    PM25("pm25", BreakpointTable.of(
            new Breakpoint(0, 30, 0, 50),
            new Breakpoint(30, 60, 51, 100),
            new Breakpoint(60, 90, 101, 200),
            new Breakpoint(90, 120, 201, 300),
            new Breakpoint(120, 250, 301, 400),
            new Breakpoint(250, 350, 401, 500),
            new Breakpoint(350, 500, 501, 999)
    )),
    PM10("pm10", BreakpointTable.of(
            new Breakpoint(0, 50, 0, 50),
            new Breakpoint(50, 100, 51, 100),
            new Breakpoint(100, 250, 101, 200),
            new Breakpoint(250, 350, 201, 300),
            new Breakpoint(350, 430, 301, 400),
            new Breakpoint(430, 500, 401, 500),
            new Breakpoint(500, 1000, 501, 999)
    ));

    private final String parameter;
    private final BreakpointTable table;

    Pollutant(String parameter, BreakpointTable table) {
        this.parameter = parameter;
        this.table = table;
    }

    /** Provider parameter name, e.g. {@code pm25}. */
    public String parameter() {
        return parameter;
    }

    public BreakpointTable table() {
        return table;
    }

    public static Optional<Pollutant> fromParameter(String parameter) {
        if (parameter == null) {
            return Optional.empty();
        }
        String normalized = parameter.trim().toLowerCase(Locale.ROOT).replace(".", "").replace("_", "");
        for (Pollutant pollutant : values()) {
            if (pollutant.parameter.equals(normalized)) {
                return Optional.of(pollutant);
            }
        }
        return Optional.empty();
    }
}
