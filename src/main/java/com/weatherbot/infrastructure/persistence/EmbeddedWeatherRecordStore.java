package com.weatherbot.infrastructure.persistence;

import com.weatherbot.domain.model.StorageBackend;
import com.weatherbot.domain.model.WeatherRecord;
import com.weatherbot.domain.model.WeatherReport;

import javax.sql.DataSource;
import java.util.concurrent.locks.ReentrantLock;

/**
 * H2 file database owned by this process.
 * Single-writer: inserts from concurrent requests are serialized.
 */
public class EmbeddedWeatherRecordStore extends JpaWeatherRecordStore {

    private final ReentrantLock writeLock = new ReentrantLock();

    public EmbeddedWeatherRecordStore(WeatherRecordJpaRepository repository, DataSource dataSource,
                                      int healthcheckTimeoutSeconds) {
        super(repository, dataSource, healthcheckTimeoutSeconds);
    }

    @Override
    public WeatherRecord save(WeatherReport report) {
        writeLock.lock();
        try {
            return insert(report);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.EMBEDDED;
    }
}
