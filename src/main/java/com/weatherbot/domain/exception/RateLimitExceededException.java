package com.weatherbot.domain.exception;

import java.time.Duration;

public class RateLimitExceededException extends WeatherBotException {

    private final String senderKey;
    private final Duration retryAfter;

    public RateLimitExceededException(String senderKey, Duration retryAfter) {
        super(ErrorKind.RATE_LIMITED, "Too many requests, please try again later.");
        this.senderKey = senderKey;
        this.retryAfter = retryAfter;
    }

    public String getSenderKey() {
        return senderKey;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
