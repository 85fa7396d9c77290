package com.weatherbot.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * One completed weather lookup.
 * Rows are append-only: there are no setters and Hibernate never issues updates.
 */
@Entity
@Table(name = "weather_data", indexes = {
        @Index(name = "idx_weather_data_city", columnList = "city")
})
@EntityListeners(AuditingEntityListener.class)
@Immutable
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WeatherRecord {

    public static final int MAX_CITY_LENGTH = 100;
    public static final int MAX_DESCRIPTION_LENGTH = 200;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "city", nullable = false, length = MAX_CITY_LENGTH)
    private String city;

    @Column(name = "temperature", nullable = false)
    private Double temperature;

    @Column(name = "feels_like")
    private Double feelsLike;

    @Column(name = "description", length = MAX_DESCRIPTION_LENGTH)
    private String description;

    @Column(name = "humidity")
    private Integer humidity;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public WeatherRecord(String city, double temperature, double feelsLike, String description, int humidity) {
        this.city = city;
        this.temperature = temperature;
        this.feelsLike = feelsLike;
        this.description = description;
        this.humidity = humidity;
    }

    public static WeatherRecord from(WeatherReport report) {
        return new WeatherRecord(
                report.getCity(),
                report.getTemperature(),
                report.getFeelsLike(),
                report.getDescription(),
                report.getHumidity());
    }

    /**
     * Fallback for contexts where auditing is not active.
     */
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
        }
    }
}
