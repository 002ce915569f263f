package com.aqiindia.service.store;

import com.aqiindia.collectors.api.MeasurementStore;

import java.util.List;

public interface ServiceMeasurementStore extends MeasurementStore {
    List<CityAqiRanking> topCities(int limit);
}
