package com.weatherbot.domain.exception;

/**
 * Base class for per-request failures of the lookup pipeline.
 * None of these are fatal to the process.
 */
public abstract class WeatherBotException extends RuntimeException {

    private final ErrorKind kind;

    protected WeatherBotException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WeatherBotException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
