package com.weatherbot.infrastructure.metrics;

import com.weatherbot.domain.model.MessageType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Business counters scraped from /actuator/prometheus.
 * 
 * Exposed as:
 * - webhook_rate_limited_total{sender}
 * - weather_requests_total{city,status}
 * - whatsapp_messages_total{message_type}
 */
@Component
public class LookupMetrics {

    public static final String RATE_LIMITED = "webhook.rate.limited";
    public static final String WEATHER_REQUESTS = "weather.requests";
    public static final String WHATSAPP_MESSAGES = "whatsapp.messages";

    private final MeterRegistry meterRegistry;

    public LookupMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void rateLimited(String senderKey) {
        Counter.builder(RATE_LIMITED)
            .description("Total webhook requests rate-limited")
            .tag("sender", senderKey)
            .register(meterRegistry)
            .increment();
    }

    public void lookup(String city, String status) {
        Counter.builder(WEATHER_REQUESTS)
            .description("Total weather requests")
            .tag("city", city)
            .tag("status", status)
            .register(meterRegistry)
            .increment();
    }

    public void message(MessageType type) {
        Counter.builder(WHATSAPP_MESSAGES)
            .description("Total WhatsApp messages processed")
            .tag("message_type", type.label())
            .register(meterRegistry)
            .increment();
    }
}
