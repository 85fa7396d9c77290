package com.weatherbot.infrastructure.config;

import com.weatherbot.domain.model.StorageBackend;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolved datasource settings for one of the two storage backends.
 */
@Getter
@EqualsAndHashCode
public class DatabaseTarget {

    private final StorageBackend backend;
    private final String jdbcUrl;
    private final String username;
    private final String password;

    private DatabaseTarget(StorageBackend backend, String jdbcUrl, String username, String password) {
        this.backend = backend;
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
    }

    public static DatabaseTarget embedded(String jdbcUrl) {
        return new DatabaseTarget(StorageBackend.EMBEDDED, jdbcUrl, "sa", "");
    }

    public static DatabaseTarget networked(String jdbcUrl, String username, String password) {
        return new DatabaseTarget(StorageBackend.NETWORKED, jdbcUrl, username, password);
    }

    /**
     * Spring Boot datasource properties for this target.
     */
    public Map<String, Object> toProperties() {
        Map<String, Object> properties = new HashMap<>();
        properties.put("spring.datasource.url", jdbcUrl);
        if (username != null) {
            properties.put("spring.datasource.username", username);
        }
        if (password != null) {
            properties.put("spring.datasource.password", password);
        }
        return properties;
    }

    @Override
    public String toString() {
        // never print the password
        return "DatabaseTarget{backend=" + backend + ", jdbcUrl=" + jdbcUrl + ", username=" + username + "}";
    }
}
