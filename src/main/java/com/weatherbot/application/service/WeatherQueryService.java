package com.weatherbot.application.service;

import com.weatherbot.application.port.in.QueryWeatherUseCase;
import com.weatherbot.application.port.out.WeatherRecordStore;
import com.weatherbot.domain.model.WeatherRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Application service for reading stored lookups.
 * Not rate limited; reads go straight to the active store.
 */
@Service
public class WeatherQueryService implements QueryWeatherUseCase {

    private static final Logger logger = LoggerFactory.getLogger(WeatherQueryService.class);

    private final WeatherRecordStore weatherRecordStore;

    public WeatherQueryService(WeatherRecordStore weatherRecordStore) {
        this.weatherRecordStore = weatherRecordStore;
    }

    @Override
    public Optional<WeatherRecord> findRecord(Long id) {
        Optional<WeatherRecord> record = weatherRecordStore.findById(id);
        if (record.isEmpty()) {
            logger.debug("No weather record with ID {} in {} store", id, weatherRecordStore.backend());
        }
        return record;
    }
}
