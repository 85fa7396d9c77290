package com.weatherbot.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * DTO for the direct weather API request body.
 * Only presence is checked here; the city rules live in CityNameValidator.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class WeatherRequestDto {

    @NotNull(message = "City is required")
    @JsonProperty("city")
    private String city;
}
