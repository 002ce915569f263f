package com.aqiindia.core.aqi;

public enum AqiCategory {
    GOOD("Good", 0, 50),
    SATISFACTORY("Satisfactory", 51, 100),
    MODERATE("Moderate", 101, 200),
    POOR("Poor", 201, 300),
    VERY_POOR("Very Poor", 301, 400),
    SEVERE("Severe", 401, Integer.MAX_VALUE);

    private final String label;
    private final int minAqi;
    private final int maxAqi;

    AqiCategory(String label, int minAqi, int maxAqi) {
        this.label = label;
        this.minAqi = minAqi;
        this.maxAqi = maxAqi;
    }

    public String label() {
        return label;
    }

    public static AqiCategory forAqi(int aqi) {
        if (aqi < 0) {
            throw new IllegalArgumentException("AQI must not be negative: " + aqi);
        }
        for (AqiCategory category : values()) {
            if (aqi >= category.minAqi && aqi <= category.maxAqi) {
                return category;
            }
        }
        return SEVERE;
    }
}
