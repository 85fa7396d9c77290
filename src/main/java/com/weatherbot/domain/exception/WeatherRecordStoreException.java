package com.weatherbot.domain.exception;

/**
 * Thrown when a lookup record could not be written. The lookup itself may have succeeded.
 */
public class WeatherRecordStoreException extends WeatherBotException {

    public WeatherRecordStoreException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE, message, cause);
    }
}
