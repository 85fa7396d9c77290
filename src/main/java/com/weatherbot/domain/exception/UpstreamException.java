package com.weatherbot.domain.exception;

/**
 * Thrown when the weather provider could not answer, after any retries were exhausted.
 */
public class UpstreamException extends WeatherBotException {

    public UpstreamException(String message) {
        super(ErrorKind.UPSTREAM, message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM, message, cause);
    }
}
