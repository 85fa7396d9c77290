package com.weatherbot.domain.model;

/**
 * Which persistence backend the process writes to.
 */
public enum StorageBackend {
    /** Single-process H2 file database. */
    EMBEDDED,
    /** Shared PostgreSQL server. */
    NETWORKED;

    public static StorageBackend fromJdbcUrl(String jdbcUrl) {
        if (jdbcUrl != null && jdbcUrl.startsWith("jdbc:postgresql:")) {
            return NETWORKED;
        }
        return EMBEDDED;
    }
}
