package com.aqiindia.service.store;

import java.time.Instant;

public record CityAqiRanking(String city, int aqi, String category, Instant observedAt) {
}
