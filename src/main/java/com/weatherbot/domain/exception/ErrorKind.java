package com.weatherbot.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * Terminal failure kinds of a lookup request, each mapped to one HTTP status and error code.
 */
public enum ErrorKind {
    AUTHENTICATION(HttpStatus.FORBIDDEN, "FORBIDDEN"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED"),
    VALIDATION(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND"),
    UPSTREAM(HttpStatus.BAD_GATEWAY, "UPSTREAM_ERROR"),
    PERSISTENCE(HttpStatus.SERVICE_UNAVAILABLE, "PERSISTENCE_ERROR");

    private final HttpStatus status;
    private final String code;

    ErrorKind(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
