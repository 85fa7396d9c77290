package com.weatherbot.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Environment post-processor that turns DATABASE_URL into Spring Boot datasource
 * properties before DataSource auto-configuration runs.
 * 
 * An explicit spring.datasource.url always wins and is left untouched.
 */
public class DatabaseTargetEnvironmentPostProcessor implements EnvironmentPostProcessor {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseTargetEnvironmentPostProcessor.class);
    static final String PROPERTY_SOURCE_NAME = "weatherBotDatabase";
    static final String DEFAULT_EMBEDDED_PATH = "./data/weather_bot";

    private final DatabaseTargetResolver resolver;

    public DatabaseTargetEnvironmentPostProcessor() {
        this(new DatabaseTargetResolver());
    }

    DatabaseTargetEnvironmentPostProcessor(DatabaseTargetResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String explicitUrl = environment.getProperty("spring.datasource.url");
        if (explicitUrl != null && !explicitUrl.isEmpty()) {
            logger.debug("spring.datasource.url is set, ignoring DATABASE_URL");
            return;
        }

        String databaseUrl = environment.getProperty("DATABASE_URL");
        String embeddedPath = environment.getProperty("app.storage.embedded-path", DEFAULT_EMBEDDED_PATH);

        DatabaseTarget target = resolver.resolve(databaseUrl, embeddedPath);
        environment.getPropertySources().addFirst(
            new MapPropertySource(PROPERTY_SOURCE_NAME, target.toProperties())
        );
        logger.info("Configured datasource: {}", target);
    }
}
