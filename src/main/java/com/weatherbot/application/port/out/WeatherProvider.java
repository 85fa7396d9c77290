package com.weatherbot.application.port.out;

import com.weatherbot.domain.model.WeatherReport;

/**
 * Output port for the upstream weather provider.
 */
public interface WeatherProvider {

  /**
   * Fetch current conditions for a normalized place name.
   * 
   * @throws com.weatherbot.domain.exception.UpstreamException once retries are exhausted
   *         or the provider rejected the request
   */
  WeatherReport fetch(String city);

  /**
   * Whether a provider credential is configured. Without one, {@link #fetch} answers
   * with the offline placeholder.
   */
  boolean isLive();
}
