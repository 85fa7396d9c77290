package com.weatherbot.domain.model;

public enum WeatherSource {
    LIVE,
    OFFLINE_PLACEHOLDER
}
