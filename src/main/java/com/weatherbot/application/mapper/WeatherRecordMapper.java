package com.weatherbot.application.mapper;

import com.weatherbot.api.dto.WeatherResponseDto;
import com.weatherbot.domain.model.WeatherRecord;
import com.weatherbot.domain.model.WeatherSource;
import org.springframework.stereotype.Component;

/**
 * Mapper for converting between domain models and DTOs.
 */
@Component
public class WeatherRecordMapper {

  /**
   * Maps a stored WeatherRecord to a WeatherResponseDto.
   * 
   * @param record Persisted lookup
   * @param source How the values were obtained, or null when read back from storage
   * @return DTO representation
   */
  public WeatherResponseDto toDto(WeatherRecord record, WeatherSource source) {
    return new WeatherResponseDto(
        record.getId(),
        record.getCity(),
        record.getTemperature(),
        record.getFeelsLike(),
        record.getDescription(),
        record.getHumidity(),
        record.getCreatedAt(),
        source != null ? source.name() : null);
  }
}
