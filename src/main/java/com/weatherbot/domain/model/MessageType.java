package com.weatherbot.domain.model;

/**
 * Classification of an inbound chat message and of the reply sent back.
 * The lower-case label is used as the metrics tag.
 */
public enum MessageType {
    GREETING("greeting"),
    HELP("help"),
    PING("ping"),
    WEATHER_SUCCESS("weather_success"),
    WEATHER_ERROR("weather_error"),
    INVALID_INPUT("invalid_input"),
    DATABASE_ERROR("database_error");

    private final String label;

    MessageType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
