package com.weatherbot.api.controller;

import com.weatherbot.api.dto.WeatherRequestDto;
import com.weatherbot.api.dto.WeatherResponseDto;
import com.weatherbot.application.dto.LookupResult;
import com.weatherbot.application.mapper.WeatherRecordMapper;
import com.weatherbot.application.port.in.LookupWeatherUseCase;
import com.weatherbot.application.port.in.QueryWeatherUseCase;
import com.weatherbot.domain.exception.WeatherRecordNotFoundException;
import com.weatherbot.domain.model.WeatherRecord;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for the direct weather API.
 * Shares the lookup pipeline with the webhook; errors are rendered as JSON by
 * the global exception handler.
 */
@RestController
@RequestMapping("/weather")
public class WeatherController {

    private static final Logger logger = LoggerFactory.getLogger(WeatherController.class);

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    static final String CLIENT_KEY_PREFIX = "api:";

    private final LookupWeatherUseCase lookupWeatherUseCase;
    private final QueryWeatherUseCase queryWeatherUseCase;
    private final WeatherRecordMapper weatherRecordMapper;

    public WeatherController(
            LookupWeatherUseCase lookupWeatherUseCase,
            QueryWeatherUseCase queryWeatherUseCase,
            WeatherRecordMapper weatherRecordMapper) {
        this.lookupWeatherUseCase = lookupWeatherUseCase;
        this.queryWeatherUseCase = queryWeatherUseCase;
        this.weatherRecordMapper = weatherRecordMapper;
    }

    /**
     * POST /weather
     * 
     * Looks up current conditions for a city and stores the result.
     * 
     * @param request Body with the city name
     * @return The stored record and whether it came from the live provider
     */
    @PostMapping
    public ResponseEntity<WeatherResponseDto> lookup(
            @Valid @RequestBody WeatherRequestDto request,
            HttpServletRequest httpRequest) {
        String clientKey = clientKey(httpRequest);
        logger.info("Weather API requested for city: {} (client {})", request.getCity(), clientKey);

        LookupResult result = lookupWeatherUseCase.lookup(clientKey, request.getCity());
        return ResponseEntity.ok(weatherRecordMapper.toDto(result.getRecord(), result.getSource()));
    }

    /**
     * GET /weather/{id}
     * 
     * Reads back a stored lookup.
     */
    @GetMapping("/{id}")
    public ResponseEntity<WeatherResponseDto> getById(@PathVariable Long id) {
        WeatherRecord record = queryWeatherUseCase.findRecord(id)
                .orElseThrow(() -> new WeatherRecordNotFoundException(id));
        return ResponseEntity.ok(weatherRecordMapper.toDto(record, null));
    }

    /**
     * Rate-limit key for API callers: the first X-Forwarded-For hop, else the peer address.
     */
    static String clientKey(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return CLIENT_KEY_PREFIX + first;
            }
        }
        return CLIENT_KEY_PREFIX + request.getRemoteAddr();
    }
}
