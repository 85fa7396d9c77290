package com.weatherbot.domain.exception;

/**
 * Thrown when the place name cannot be used for a lookup. The message is user-facing.
 */
public class CityValidationException extends WeatherBotException {

    public CityValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
