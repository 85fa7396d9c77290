package com.weatherbot.infrastructure.persistence;

import com.weatherbot.application.port.out.WeatherRecordStore;
import com.weatherbot.domain.exception.WeatherRecordStoreException;
import com.weatherbot.domain.model.WeatherRecord;
import com.weatherbot.domain.model.WeatherReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * JPA-backed store shared by the embedded and networked backends.
 * The backends differ in write concurrency, not in semantics.
 */
public abstract class JpaWeatherRecordStore implements WeatherRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaWeatherRecordStore.class);

    private final WeatherRecordJpaRepository repository;
    private final DataSource dataSource;
    private final int healthcheckTimeoutSeconds;

    protected JpaWeatherRecordStore(WeatherRecordJpaRepository repository, DataSource dataSource,
                                    int healthcheckTimeoutSeconds) {
        this.repository = repository;
        this.dataSource = dataSource;
        this.healthcheckTimeoutSeconds = healthcheckTimeoutSeconds;
    }

    /**
     * Insert without any additional coordination.
     */
    protected WeatherRecord insert(WeatherReport report) {
        try {
            WeatherRecord saved = repository.save(WeatherRecord.from(report));
            logger.info("Weather data stored in {} store for {}, record ID: {}",
                backend(), saved.getCity(), saved.getId());
            return saved;
        } catch (DataAccessException | TransactionException e) {
            throw new WeatherRecordStoreException(
                "Failed to store weather data for " + report.getCity(), e);
        }
    }

    @Override
    public Optional<WeatherRecord> findById(Long id) {
        try {
            return repository.findById(id);
        } catch (DataAccessException | TransactionException e) {
            throw new WeatherRecordStoreException("Failed to read weather record " + id, e);
        }
    }

    @Override
    public boolean healthcheck() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(healthcheckTimeoutSeconds);
        } catch (SQLException e) {
            logger.warn("Database connection test failed for {} store: {}", backend(), e.getMessage());
            return false;
        }
    }
}
