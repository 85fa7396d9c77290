package com.weatherbot.infrastructure.persistence;

import com.weatherbot.domain.model.WeatherRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data repository over the weather_data table.
 * Shared by both store backends; only inserts and reads are used.
 */
@Repository
public interface WeatherRecordJpaRepository extends JpaRepository<WeatherRecord, Long> {
}
