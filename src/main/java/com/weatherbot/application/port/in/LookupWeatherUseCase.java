package com.weatherbot.application.port.in;

import com.weatherbot.application.dto.LookupResult;

/**
 * Input port for the direct weather API.
 */
public interface LookupWeatherUseCase {

  /**
   * Rate-check, validate, fetch and persist one lookup.
   * 
   * @param senderKey Stable identifier of the caller, used for rate limiting
   * @param rawCity Place name as received
   * @return The persisted record together with how it was sourced
   */
  LookupResult lookup(String senderKey, String rawCity);
}
