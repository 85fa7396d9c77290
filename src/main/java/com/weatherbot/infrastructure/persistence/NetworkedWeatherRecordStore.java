package com.weatherbot.infrastructure.persistence;

import com.weatherbot.domain.model.StorageBackend;
import com.weatherbot.domain.model.WeatherRecord;
import com.weatherbot.domain.model.WeatherReport;

import javax.sql.DataSource;

/**
 * PostgreSQL shared by every instance of the service.
 * Concurrent writers are left to the connection pool and the database.
 */
public class NetworkedWeatherRecordStore extends JpaWeatherRecordStore {

    public NetworkedWeatherRecordStore(WeatherRecordJpaRepository repository, DataSource dataSource,
                                       int healthcheckTimeoutSeconds) {
        super(repository, dataSource, healthcheckTimeoutSeconds);
    }

    @Override
    public WeatherRecord save(WeatherReport report) {
        return insert(report);
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.NETWORKED;
    }
}
