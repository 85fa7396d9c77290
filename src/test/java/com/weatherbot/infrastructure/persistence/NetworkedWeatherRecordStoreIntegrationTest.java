package com.weatherbot.infrastructure.persistence;

import com.weatherbot.application.port.out.WeatherRecordStore;
import com.weatherbot.domain.model.StorageBackend;
import com.weatherbot.domain.model.WeatherRecord;
import com.weatherbot.module.test.support.TestFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Networked store against a real PostgreSQL server.
 * Skipped when Docker is not available.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class NetworkedWeatherRecordStoreIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES =
        new PostgreSQLContainer<>(DockerImageName.parse("postgres:14-alpine"))
            .withDatabaseName("weather_bot_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    private WeatherRecordStore weatherRecordStore;

    @Test
    void testBackend_PostgresUrlSelectsNetworkedStore() {
        assertThat(weatherRecordStore).isInstanceOf(NetworkedWeatherRecordStore.class);
        assertThat(weatherRecordStore.backend()).isEqualTo(StorageBackend.NETWORKED);
        assertThat(weatherRecordStore.healthcheck()).isTrue();
    }

    @Test
    void testSave_RoundTrip() {
        WeatherRecord first = weatherRecordStore.save(TestFixtures.liveReport("Berlin"));
        WeatherRecord second = weatherRecordStore.save(TestFixtures.liveReport("Hamburg"));

        assertThat(second.getId()).isGreaterThan(first.getId());
        assertThat(second.getCreatedAt()).isAfterOrEqualTo(first.getCreatedAt());

        WeatherRecord loaded = weatherRecordStore.findById(first.getId()).orElseThrow();
        assertThat(loaded.getCity()).isEqualTo("Berlin");
        assertThat(loaded.getHumidity()).isEqualTo(72);
        assertThat(loaded.getCreatedAt().isEqual(first.getCreatedAt())).isTrue();
    }
}
