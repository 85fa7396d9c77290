package com.weatherbot.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WeatherResponseDto {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("city")
    private String city;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("feelsLike")
    private Double feelsLike;

    @JsonProperty("description")
    private String description;

    @JsonProperty("humidity")
    private Integer humidity;

    @JsonProperty("createdAt")
    private OffsetDateTime createdAt;

    @JsonProperty("source")
    private String source;
}
