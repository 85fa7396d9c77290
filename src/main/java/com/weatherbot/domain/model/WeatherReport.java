package com.weatherbot.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object holding the current conditions for a place, before persistence.
 * The {@link WeatherSource} tells a live provider answer apart from the offline placeholder.
 */
@Getter
@EqualsAndHashCode
@ToString
public class WeatherReport {

    public static final String OFFLINE_DESCRIPTION = "offline placeholder";

    private final String city;
    private final double temperature;
    private final double feelsLike;
    private final String description;
    private final int humidity;
    private final WeatherSource source;

    public WeatherReport(String city, double temperature, double feelsLike, String description,
                         int humidity, WeatherSource source) {
        if (city == null || city.isBlank()) {
            throw new IllegalArgumentException("City must not be blank");
        }
        if (humidity < 0 || humidity > 100) {
            throw new IllegalArgumentException("Humidity must be between 0 and 100");
        }
        this.city = city;
        this.temperature = temperature;
        this.feelsLike = feelsLike;
        this.description = description;
        this.humidity = humidity;
        this.source = source;
    }

    public static WeatherReport live(String city, double temperature, double feelsLike,
                                     String description, int humidity) {
        return new WeatherReport(city, temperature, feelsLike, description, humidity, WeatherSource.LIVE);
    }

    public static WeatherReport offlinePlaceholder(String city) {
        return new WeatherReport(city, 0.0, 0.0, OFFLINE_DESCRIPTION, 0, WeatherSource.OFFLINE_PLACEHOLDER);
    }
}
