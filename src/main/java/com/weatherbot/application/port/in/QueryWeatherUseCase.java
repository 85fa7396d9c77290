package com.weatherbot.application.port.in;

import com.weatherbot.domain.model.WeatherRecord;

import java.util.Optional;

/**
 * Input port for reading back stored lookups.
 */
public interface QueryWeatherUseCase {

  Optional<WeatherRecord> findRecord(Long id);
}
