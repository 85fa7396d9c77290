package com.weatherbot.application.dto;

import com.weatherbot.domain.model.WeatherRecord;
import com.weatherbot.domain.model.WeatherSource;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class LookupResult {
    private final WeatherRecord record;
    private final WeatherSource source;
}
