package com.weatherbot.api.controller;

import com.weatherbot.application.port.out.WeatherProvider;
import com.weatherbot.application.port.out.WeatherRecordStore;
import com.weatherbot.infrastructure.security.TwilioSignatureVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Liveness and configuration overview.
 */
@RestController
public class StatusController {

    private static final Logger logger = LoggerFactory.getLogger(StatusController.class);

    private final WeatherRecordStore weatherRecordStore;
    private final WeatherProvider weatherProvider;
    private final TwilioSignatureVerifier signatureVerifier;
    private final Clock clock;

    public StatusController(
            WeatherRecordStore weatherRecordStore,
            WeatherProvider weatherProvider,
            TwilioSignatureVerifier signatureVerifier,
            Clock clock) {
        this.weatherRecordStore = weatherRecordStore;
        this.weatherProvider = weatherProvider;
        this.signatureVerifier = signatureVerifier;
        this.clock = clock;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "WhatsApp Weather Bot");
        body.put("status", "running");
        return body;
    }

    /**
     * GET /health
     * 
     * Always answers 200; the status field reports whether storage is reachable.
     * The storage check is the only call here that may block, and it is bounded.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseConnected = weatherRecordStore.healthcheck();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", databaseConnected ? "healthy" : "unhealthy");
        body.put("weatherApiConfigured", weatherProvider.isLive());
        body.put("signatureVerificationEnabled", signatureVerifier.isEnabled());
        body.put("databaseConnected", databaseConnected);
        body.put("storageBackend", weatherRecordStore.backend().name().toLowerCase(Locale.ROOT));
        body.put("timestamp", OffsetDateTime.now(clock).toString());

        logger.info("Health check completed: {}", body.get("status"));
        return ResponseEntity.ok(body);
    }
}
