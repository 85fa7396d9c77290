package com.weatherbot.infrastructure.persistence;

import com.weatherbot.application.port.out.WeatherRecordStore;
import com.weatherbot.domain.model.StorageBackend;
import org.hibernate.cfg.AvailableSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.core.io.Resource;

import javax.sql.DataSource;

/**
 * Wires the WeatherRecordStore output port.
 * The backend is chosen once, from the effective JDBC URL, and never swapped afterwards.
 */
@Configuration
public class PersistenceAdapterConfig {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceAdapterConfig.class);

    /**
     * Pins the Hibernate dialect to the configured backend. Without it Hibernate
     * detects the dialect over a live connection and refuses to start while the
     * database is down.
     */
    @Bean
    public HibernatePropertiesCustomizer storageDialectCustomizer(
        @Value("${spring.datasource.url:}") String jdbcUrl,
        @Value("${spring.jpa.database-platform:}") String databasePlatform
    ) {
        return properties -> {
            if (databasePlatform.isEmpty()) {
                properties.putIfAbsent(AvailableSettings.DIALECT, dialectFor(StorageBackend.fromJdbcUrl(jdbcUrl)));
            }
        };
    }

    static String dialectFor(StorageBackend backend) {
        return switch (backend) {
            case NETWORKED -> "org.hibernate.dialect.PostgreSQLDialect";
            case EMBEDDED -> "org.hibernate.dialect.H2Dialect";
        };
    }

    @Bean
    public WeatherSchemaInitializer weatherSchemaInitializer(
        DataSource dataSource,
        @Value("${app.storage.schema-location:classpath:schema.sql}") Resource schema
    ) {
        return new WeatherSchemaInitializer(dataSource, schema);
    }

    @Bean
    @DependsOn("weatherSchemaInitializer")
    public WeatherRecordStore weatherRecordStore(
        WeatherRecordJpaRepository jpaRepository,
        DataSource dataSource,
        @Value("${spring.datasource.url:}") String jdbcUrl,
        @Value("${app.storage.healthcheck-timeout-seconds:2}") int healthcheckTimeoutSeconds
    ) {
        StorageBackend backend = StorageBackend.fromJdbcUrl(jdbcUrl);
        logger.info("Using {} weather record store", backend);
        return switch (backend) {
            case NETWORKED -> new NetworkedWeatherRecordStore(jpaRepository, dataSource, healthcheckTimeoutSeconds);
            case EMBEDDED -> new EmbeddedWeatherRecordStore(jpaRepository, dataSource, healthcheckTimeoutSeconds);
        };
    }
}
