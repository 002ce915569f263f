package com.aqiindia.service.aqi;

public class ProviderUnavailableException extends IllegalStateException {
    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
