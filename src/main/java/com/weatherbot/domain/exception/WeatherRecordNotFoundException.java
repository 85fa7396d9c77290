package com.weatherbot.domain.exception;

/**
 * Thrown when a stored lookup is requested by an ID that does not exist.
 */
public class WeatherRecordNotFoundException extends WeatherBotException {

    public WeatherRecordNotFoundException(Long id) {
        super(ErrorKind.NOT_FOUND, "Weather record not found: " + id);
    }
}
