package com.weatherbot.application.port.out;

import com.weatherbot.domain.model.StorageBackend;
import com.weatherbot.domain.model.WeatherRecord;
import com.weatherbot.domain.model.WeatherReport;

import java.util.Optional;

/**
 * Output port for lookup persistence.
 * Implementations only ever insert: records are never updated or deleted here.
 */
public interface WeatherRecordStore {

  /**
   * Insert a record for the given report. The store assigns id and created_at.
   * 
   * @throws com.weatherbot.domain.exception.WeatherRecordStoreException if the write fails
   */
  WeatherRecord save(WeatherReport report);

  Optional<WeatherRecord> findById(Long id);

  /**
   * Bounded connectivity check for the health surface. Never retries.
   */
  boolean healthcheck();

  StorageBackend backend();
}
