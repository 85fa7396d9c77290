package com.weatherbot.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.io.Resource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Creates the weather_data table at startup.
 * An unreachable database is logged and startup continues; requests then fail
 * with persistence errors and /health reports the store as disconnected.
 */
public class WeatherSchemaInitializer implements InitializingBean {

    private static final Logger logger = LoggerFactory.getLogger(WeatherSchemaInitializer.class);

    private final DataSource dataSource;
    private final Resource schema;

    public WeatherSchemaInitializer(DataSource dataSource, Resource schema) {
        this.dataSource = dataSource;
        this.schema = schema;
    }

    @Override
    public void afterPropertiesSet() {
        try {
            new ResourceDatabasePopulator(schema).execute(dataSource);
            logger.info("Database schema initialized from {}", schema.getDescription());
        } catch (DataAccessException e) {
            logger.error("Database initialization failed, continuing without persistence: {}", e.getMessage(), e);
        }
    }
}
