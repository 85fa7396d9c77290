package com.weatherbot.application.service;

import com.weatherbot.application.dto.ChatReply;
import com.weatherbot.application.dto.LookupResult;
import com.weatherbot.application.port.in.HandleMessageUseCase;
import com.weatherbot.application.port.in.LookupWeatherUseCase;
import com.weatherbot.application.port.out.WeatherProvider;
import com.weatherbot.application.port.out.WeatherRecordStore;
import com.weatherbot.domain.exception.CityValidationException;
import com.weatherbot.domain.exception.RateLimitExceededException;
import com.weatherbot.domain.exception.UpstreamException;
import com.weatherbot.domain.exception.WeatherRecordStoreException;
import com.weatherbot.domain.model.MessageType;
import com.weatherbot.domain.model.WeatherRecord;
import com.weatherbot.domain.model.WeatherReport;
import com.weatherbot.domain.service.CityNameValidator;
import com.weatherbot.domain.service.MessageRouter;
import com.weatherbot.domain.service.ReplyFormatter;
import com.weatherbot.infrastructure.metrics.LookupMetrics;
import com.weatherbot.infrastructure.ratelimit.SenderRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Application service orchestrating a weather lookup.
 *
 * Request flow (signature verification happens earlier, in the webhook filter):
 * rate-checked -> validated -> fetched -> persisted -> responded
 *
 * Every stage can end the request; nothing is retried here. Retries of the
 * provider call live in the WeatherProvider. Exactly one record is written per
 * successful fetch, offline placeholders included.
 */
@Service
public class WebhookService implements LookupWeatherUseCase, HandleMessageUseCase {

  private static final Logger logger = LoggerFactory.getLogger(WebhookService.class);

  private final SenderRateLimiter rateLimiter;
  private final CityNameValidator cityNameValidator;
  private final WeatherProvider weatherProvider;
  private final WeatherRecordStore weatherRecordStore;
  private final MessageRouter messageRouter;
  private final ReplyFormatter replyFormatter;
  private final LookupMetrics metrics;

  public WebhookService(
      SenderRateLimiter rateLimiter,
      CityNameValidator cityNameValidator,
      WeatherProvider weatherProvider,
      WeatherRecordStore weatherRecordStore,
      MessageRouter messageRouter,
      ReplyFormatter replyFormatter,
      LookupMetrics metrics) {
    this.rateLimiter = rateLimiter;
    this.cityNameValidator = cityNameValidator;
    this.weatherProvider = weatherProvider;
    this.weatherRecordStore = weatherRecordStore;
    this.messageRouter = messageRouter;
    this.replyFormatter = replyFormatter;
    this.metrics = metrics;
  }

  /**
   * Direct API lookup. Failures propagate as exceptions and are mapped to HTTP
   * statuses by the global exception handler.
   */
  @Override
  public LookupResult lookup(String senderKey, String rawCity) {
    checkRateLimit(senderKey);
    return fetchAndStore(rawCity);
  }

  /**
   * Webhook message. Only rate limiting is thrown; lookup failures become error
   * replies so the sender always gets an answer.
   */
  @Override
  public ChatReply handleMessage(String senderKey, String body) {
    checkRateLimit(senderKey);

    ChatReply reply = messageRouter.command(body)
        .map(type -> new ChatReply(type, replyFormatter.command(type)))
        .orElseGet(() -> lookupReply(body));

    metrics.message(reply.getType());
    logger.info("Reply prepared for {}: type={}, length={}",
        senderKey, reply.getType().label(), reply.getText().length());
    return reply;
  }

  private ChatReply lookupReply(String body) {
    try {
      LookupResult result = fetchAndStore(body);
      return new ChatReply(MessageType.WEATHER_SUCCESS, replyFormatter.weather(result.getRecord()));
    } catch (CityValidationException e) {
      logger.warn("Invalid city name: {}", e.getMessage());
      return new ChatReply(MessageType.INVALID_INPUT, replyFormatter.invalidInput(e.getMessage()));
    } catch (UpstreamException e) {
      logger.error("Weather lookup failed for '{}': {}", body.trim(), e.getMessage(), e);
      return new ChatReply(MessageType.WEATHER_ERROR, replyFormatter.weatherError(body.trim()));
    } catch (WeatherRecordStoreException e) {
      logger.error("Weather lookup for '{}' could not be stored", body.trim(), e);
      return new ChatReply(MessageType.DATABASE_ERROR, replyFormatter.storageError());
    }
  }

  private void checkRateLimit(String senderKey) {
    if (!rateLimiter.admit(senderKey)) {
      metrics.rateLimited(senderKey);
      throw new RateLimitExceededException(senderKey, rateLimiter.getWindow());
    }
  }

  /**
   * validated -> fetched -> persisted
   */
  private LookupResult fetchAndStore(String rawCity) {
    String city = cityNameValidator.normalize(rawCity);

    WeatherReport report;
    try {
      report = weatherProvider.fetch(city);
    } catch (UpstreamException e) {
      metrics.lookup(city, "error");
      throw e;
    }

    WeatherRecord record;
    try {
      record = weatherRecordStore.save(report);
    } catch (WeatherRecordStoreException e) {
      metrics.lookup(city, "persistence_error");
      throw e;
    }

    metrics.lookup(city, "success");
    logger.info("Weather lookup completed for {} (source={}, record ID: {})",
        city, report.getSource(), record.getId());
    return new LookupResult(record, report.getSource());
  }
}
