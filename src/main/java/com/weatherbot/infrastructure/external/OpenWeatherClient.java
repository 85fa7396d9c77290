package com.weatherbot.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weatherbot.application.port.out.WeatherProvider;
import com.weatherbot.domain.exception.UpstreamException;
import com.weatherbot.domain.model.WeatherRecord;
import com.weatherbot.domain.model.WeatherReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Client for the OpenWeatherMap current-weather API.
 * 
 * Without an API key the client stays offline and answers every lookup with
 * {@link WeatherReport#offlinePlaceholder(String)}.
 * 
 * Retry policy: timeouts, connection failures, 5xx and 429 are retried with
 * exponential backoff and jitter; any other 4xx fails on the first attempt.
 */
@Service
public class OpenWeatherClient implements WeatherProvider {

    private static final Logger logger = LoggerFactory.getLogger(OpenWeatherClient.class);
    static final String PLACEHOLDER_API_KEY = "your_openweathermap_api_key_here";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final Duration attemptTimeout;
    private final int maxAttempts;
    private final Duration backoffBase;
    private final double jitter;

    public OpenWeatherClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        @Value("${app.weather.api-url:https://api.openweathermap.org/data/2.5}") String apiUrl,
        @Value("${app.weather.api-key:}") String apiKey,
        @Value("${app.weather.timeout-ms:5000}") long timeoutMs,
        @Value("${app.weather.retry.max-attempts:3}") int maxAttempts,
        @Value("${app.weather.retry.base-delay-ms:500}") long baseDelayMs,
        @Value("${app.weather.retry.jitter:0.25}") double jitter
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max-attempts must be at least 1");
        }
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.attemptTimeout = Duration.ofMillis(timeoutMs);
        this.maxAttempts = maxAttempts;
        this.backoffBase = Duration.ofMillis(baseDelayMs);
        this.jitter = jitter;
        this.webClient = webClientBuilder
            .baseUrl(apiUrl)
            .build();

        if (!isLive()) {
            logger.warn("Weather API key not found, running in offline mode");
        }
    }

    @Override
    public boolean isLive() {
        return apiKey != null && !apiKey.isBlank() && !PLACEHOLDER_API_KEY.equals(apiKey);
    }

    /**
     * Fetch current conditions for a city.
     * 
     * @param city Normalized place name
     * @return Live report, or the offline placeholder when no key is configured
     * @throws UpstreamException if the provider rejects the city or stays unavailable
     */
    @Override
    public WeatherReport fetch(String city) {
        if (!isLive()) {
            logger.info("Using offline placeholder weather for {}", city);
            return WeatherReport.offlinePlaceholder(city);
        }

        logger.info("Fetching weather data for {}", city);
        String responseBody;
        try {
            responseBody = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/weather")
                    .queryParam("q", city)
                    .queryParam("appid", apiKey)
                    .queryParam("units", "metric")
                    .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(attemptTimeout)
                .retryWhen(retryPolicy(city))
                .block();
        } catch (WebClientResponseException e) {
            throw new UpstreamException(
                "Weather provider returned " + e.getStatusCode().value() + " for " + city, e);
        } catch (WebClientRequestException e) {
            throw new UpstreamException("Failed to connect to weather provider", e);
        } catch (RuntimeException e) {
            if (e.getCause() instanceof TimeoutException) {
                throw new UpstreamException("Weather provider timed out for " + city, e.getCause());
            }
            throw new UpstreamException("Unexpected error querying weather provider", e);
        }

        WeatherReport report = parseResponse(city, responseBody);
        logger.info("Weather data fetched for {}: {}°C, {}", city, report.getTemperature(), report.getDescription());
        return report;
    }

    private Retry retryPolicy(String city) {
        return Retry.backoff(maxAttempts - 1, backoffBase)
            .jitter(jitter)
            .filter(OpenWeatherClient::isTransient)
            .doBeforeRetry(signal -> logger.warn(
                "Transient error fetching weather for {} (attempt {}/{}): {}",
                city, signal.totalRetries() + 1, maxAttempts, signal.failure().toString()))
            // surface the last real failure instead of Reactor's RetryExhaustedException
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) throwable).getStatusCode().value();
            return status >= 500 || status == HttpStatus.TOO_MANY_REQUESTS.value();
        }
        return throwable instanceof WebClientRequestException
            || throwable instanceof TimeoutException;
    }

    /**
     * Map the provider's JSON into a report for the requested city.
     */
    private WeatherReport parseResponse(String city, String responseBody) {
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            JsonNode main = root.path("main");
            JsonNode conditions = root.path("weather").path(0);

            if (!main.has("temp") || !main.has("humidity")) {
                throw new UpstreamException("Weather provider response missing 'main' readings for " + city);
            }

            double temperature = main.get("temp").asDouble();
            double feelsLike = main.has("feels_like") ? main.get("feels_like").asDouble() : temperature;
            int humidity = Math.max(0, Math.min(100, main.get("humidity").asInt()));
            String description = conditions.path("description").asText("");
            if (description.length() > WeatherRecord.MAX_DESCRIPTION_LENGTH) {
                description = description.substring(0, WeatherRecord.MAX_DESCRIPTION_LENGTH);
            }

            return WeatherReport.live(city, temperature, feelsLike, description, humidity);
        } catch (UpstreamException e) {
            throw e;
        } catch (Exception e) {
            throw new UpstreamException("Failed to parse weather provider response", e);
        }
    }
}
