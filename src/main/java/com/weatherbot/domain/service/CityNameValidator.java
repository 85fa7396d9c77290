package com.weatherbot.domain.service;

import com.weatherbot.domain.exception.CityValidationException;
import com.weatherbot.domain.model.WeatherRecord;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Domain service for normalizing place names before they reach the weather provider.
 * 
 * Rules:
 * - surrounding whitespace is trimmed
 * - empty and purely numeric names are rejected
 * - names longer than 100 characters are rejected
 * 
 * Nothing else is rewritten: resolving ambiguous names is left to the provider.
 */
@Service
public class CityNameValidator {

    private static final Pattern DIGITS_ONLY = Pattern.compile("^\\d+$");

    /**
     * Normalizes a raw place name.
     * 
     * @param rawCity Place name as received
     * @return Trimmed place name
     * @throws CityValidationException if the name is unusable
     */
    public String normalize(String rawCity) {
        String city = rawCity == null ? "" : rawCity.trim();

        if (city.isEmpty()) {
            throw new CityValidationException("City name cannot be empty");
        }
        if (DIGITS_ONLY.matcher(city).matches()) {
            throw new CityValidationException("City name cannot be a number");
        }
        if (city.length() > WeatherRecord.MAX_CITY_LENGTH) {
            throw new CityValidationException(
                "City name cannot be longer than " + WeatherRecord.MAX_CITY_LENGTH + " characters");
        }
        return city;
    }
}
