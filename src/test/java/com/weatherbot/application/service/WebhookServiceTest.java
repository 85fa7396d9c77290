package com.weatherbot.application.service;

import com.weatherbot.application.dto.ChatReply;
import com.weatherbot.application.dto.LookupResult;
import com.weatherbot.application.port.out.WeatherProvider;
import com.weatherbot.application.port.out.WeatherRecordStore;
import com.weatherbot.domain.exception.CityValidationException;
import com.weatherbot.domain.exception.RateLimitExceededException;
import com.weatherbot.domain.exception.UpstreamException;
import com.weatherbot.domain.exception.WeatherRecordStoreException;
import com.weatherbot.domain.model.MessageType;
import com.weatherbot.domain.model.WeatherRecord;
import com.weatherbot.domain.model.WeatherReport;
import com.weatherbot.domain.model.WeatherSource;
import com.weatherbot.domain.service.CityNameValidator;
import com.weatherbot.domain.service.MessageRouter;
import com.weatherbot.domain.service.ReplyFormatter;
import com.weatherbot.infrastructure.metrics.LookupMetrics;
import com.weatherbot.infrastructure.ratelimit.SenderRateLimiter;
import com.weatherbot.module.test.support.MutableClock;
import com.weatherbot.module.test.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class WebhookServiceTest {

    private static final String SENDER = "whatsapp:+15550001111";

    private WeatherProvider weatherProvider;
    private WeatherRecordStore weatherRecordStore;
    private SimpleMeterRegistry meterRegistry;
    private WebhookService service;

    @BeforeEach
    void setUp() {
        weatherProvider = mock(WeatherProvider.class);
        weatherRecordStore = mock(WeatherRecordStore.class);
        meterRegistry = new SimpleMeterRegistry();

        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T09:00:00Z"));
        service = new WebhookService(
            new SenderRateLimiter(clock, 5, 60),
            new CityNameValidator(),
            weatherProvider,
            weatherRecordStore,
            new MessageRouter(),
            new ReplyFormatter(),
            new LookupMetrics(meterRegistry));
    }

    private static WeatherRecord stored(WeatherReport report, long id) {
        WeatherRecord record = WeatherRecord.from(report);
        ReflectionTestUtils.setField(record, "id", id);
        ReflectionTestUtils.setField(record, "createdAt", OffsetDateTime.of(2024, 5, 1, 9, 0, 0, 0, ZoneOffset.UTC));
        return record;
    }

    private double counter(String name, String tag, String value) {
        return meterRegistry.get(name).tag(tag, value).counter().count();
    }

    @Test
    void testLookup_FetchesAndPersistsOnce() {
        WeatherReport report = TestFixtures.liveReport("London");
        when(weatherProvider.fetch("London")).thenReturn(report);
        when(weatherRecordStore.save(report)).thenReturn(stored(report, 1L));

        LookupResult result = service.lookup(SENDER, "  London ");

        assertThat(result.getRecord().getId()).isEqualTo(1L);
        assertThat(result.getRecord().getCity()).isEqualTo("London");
        assertThat(result.getSource()).isEqualTo(WeatherSource.LIVE);
        verify(weatherProvider).fetch("London");
        verify(weatherRecordStore, times(1)).save(report);
        assertThat(counter(LookupMetrics.WEATHER_REQUESTS, "status", "success")).isEqualTo(1.0);
    }

    @Test
    void testLookup_InvalidCityNeverReachesProvider() {
        assertThatThrownBy(() -> service.lookup(SENDER, "123"))
            .isInstanceOf(CityValidationException.class);

        verifyNoInteractions(weatherProvider, weatherRecordStore);
    }

    @Test
    void testLookup_UpstreamFailureSkipsPersistence() {
        when(weatherProvider.fetch(anyString())).thenThrow(new UpstreamException("provider returned 404"));

        assertThatThrownBy(() -> service.lookup(SENDER, "Atlantis"))
            .isInstanceOf(UpstreamException.class);

        verifyNoInteractions(weatherRecordStore);
        assertThat(counter(LookupMetrics.WEATHER_REQUESTS, "status", "error")).isEqualTo(1.0);
    }

    @Test
    void testLookup_PersistenceFailureIsSurfaced() {
        WeatherReport report = WeatherReport.offlinePlaceholder("London");
        when(weatherProvider.fetch("London")).thenReturn(report);
        when(weatherRecordStore.save(any())).thenThrow(
            new WeatherRecordStoreException("down", new RuntimeException("connection refused")));

        assertThatThrownBy(() -> service.lookup(SENDER, "London"))
            .isInstanceOf(WeatherRecordStoreException.class);
        assertThat(counter(LookupMetrics.WEATHER_REQUESTS, "status", "persistence_error")).isEqualTo(1.0);
    }

    @Test
    void testLookup_SixthCallRateLimitedBeforeValidation() {
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> service.lookup(SENDER, "123"))
                .isInstanceOf(CityValidationException.class);
        }

        assertThatThrownBy(() -> service.lookup(SENDER, "123"))
            .isInstanceOfSatisfying(RateLimitExceededException.class, e -> {
                assertThat(e.getSenderKey()).isEqualTo(SENDER);
                assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(60));
            });
        assertThat(counter(LookupMetrics.RATE_LIMITED, "sender", SENDER)).isEqualTo(1.0);
    }

    @Test
    void testHandleMessage_CommandsSkipLookup() {
        ChatReply reply = service.handleMessage(SENDER, "ping");

        assertThat(reply.getType()).isEqualTo(MessageType.PING);
        assertThat(reply.getText()).isEqualTo("Weather bot is working!");
        verifyNoInteractions(weatherProvider, weatherRecordStore);
        assertThat(counter(LookupMetrics.WHATSAPP_MESSAGES, "message_type", "ping")).isEqualTo(1.0);
    }

    @Test
    void testHandleMessage_WeatherReply() {
        WeatherReport report = TestFixtures.liveReport("Paris");
        when(weatherProvider.fetch("Paris")).thenReturn(report);
        when(weatherRecordStore.save(report)).thenReturn(stored(report, 7L));

        ChatReply reply = service.handleMessage(SENDER, "Paris");

        assertThat(reply.getType()).isEqualTo(MessageType.WEATHER_SUCCESS);
        assertThat(reply.getText()).startsWith("Weather Update for Paris").contains("Humidity: 72%");
    }

    @Test
    void testHandleMessage_FailuresBecomeDistinctReplies() {
        assertThat(service.handleMessage(SENDER, "123").getType()).isEqualTo(MessageType.INVALID_INPUT);

        when(weatherProvider.fetch("Atlantis")).thenThrow(new UpstreamException("not found"));
        ChatReply upstream = service.handleMessage(SENDER, "Atlantis");
        assertThat(upstream.getType()).isEqualTo(MessageType.WEATHER_ERROR);
        assertThat(upstream.getText()).contains("Atlantis");

        when(weatherProvider.fetch("Oslo")).thenReturn(TestFixtures.liveReport("Oslo"));
        when(weatherRecordStore.save(any())).thenThrow(
            new WeatherRecordStoreException("down", new RuntimeException("disk full")));
        ChatReply storage = service.handleMessage(SENDER, "Oslo");
        assertThat(storage.getType()).isEqualTo(MessageType.DATABASE_ERROR);
        assertThat(storage.getText()).contains("Database not available");
    }

    @Test
    void testHandleMessage_RateLimitIsThrown() {
        for (int i = 0; i < 5; i++) {
            service.handleMessage(SENDER, "hello");
        }

        assertThatThrownBy(() -> service.handleMessage(SENDER, "hello"))
            .isInstanceOf(RateLimitExceededException.class);
        assertThat(service.handleMessage("whatsapp:+15550002222", "hello").getType())
            .isEqualTo(MessageType.GREETING);
    }
}
