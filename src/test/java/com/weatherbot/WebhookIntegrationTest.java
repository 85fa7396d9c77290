package com.weatherbot;

import com.weatherbot.infrastructure.persistence.WeatherRecordJpaRepository;
import com.weatherbot.infrastructure.security.WebhookSecurityFilter;
import com.weatherbot.module.test.support.TestFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.net.URI;

import static com.weatherbot.module.test.support.TestFixtures.Common;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class WebhookIntegrationTest {

        @Autowired
        private MockMvc mockMvc;

        @Autowired
        private WeatherRecordJpaRepository weatherRecordJpaRepository;

        private ResultActions sendSigned(String from, String body) throws Exception {
                return send(from, body, TestFixtures.twilioSignature(Common.WEBHOOK_URL, from, body));
        }

        private ResultActions send(String from, String body, String signature) throws Exception {
                return mockMvc.perform(post("/webhook")
                                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                                .header(WebhookSecurityFilter.SIGNATURE_HEADER, signature)
                                .param("From", from)
                                .param("Body", body));
        }

        @Test
        void testWebhook_PingReturnsTwiml() throws Exception {
                sendSigned(TestFixtures.uniqueSender(), "ping")
                                .andExpect(status().isOk())
                                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_XML))
                                .andExpect(content().string(
                                                "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                                                                + "<Response><Message>Weather bot is working!</Message></Response>"));
        }

        @Test
        void testWebhook_CityLookupIsPersistedAndReplied() throws Exception {
                long before = weatherRecordJpaRepository.count();

                sendSigned(TestFixtures.uniqueSender(), " London ")
                                .andExpect(status().isOk())
                                .andExpect(content().string(containsString("Weather Update for London")))
                                .andExpect(content().string(containsString("Conditions: Offline Placeholder")));

                assertThat(weatherRecordJpaRepository.count()).isEqualTo(before + 1);
        }

        @Test
        void testWebhook_InvalidCityRepliesWithoutLookup() throws Exception {
                long before = weatherRecordJpaRepository.count();

                sendSigned(TestFixtures.uniqueSender(), "123")
                                .andExpect(status().isOk())
                                .andExpect(content().string(containsString("City name cannot be a number")));

                assertThat(weatherRecordJpaRepository.count()).isEqualTo(before);
        }

        @Test
        void testWebhook_ReplyIsXmlEscaped() throws Exception {
                sendSigned(TestFixtures.uniqueSender(), "<b>Rome</b>")
                                .andExpect(status().isOk())
                                .andExpect(content().string(containsString("&lt;b&gt;Rome&lt;/b&gt;")))
                                .andExpect(content().string(not(containsString("<b>"))));
        }

        @Test
        void testWebhook_SixthRequestIsRateLimited() throws Exception {
                String sender = TestFixtures.uniqueSender();
                for (int i = 0; i < 5; i++) {
                        sendSigned(sender, "ping").andExpect(status().isOk());
                }

                sendSigned(sender, "ping")
                                .andExpect(status().isTooManyRequests())
                                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "60"))
                                .andExpect(content().string("Too many requests, please try again later."));

                sendSigned(TestFixtures.uniqueSender(), "ping").andExpect(status().isOk());
        }

        @Test
        void testWebhook_BadSignatureRejected() throws Exception {
                String sender = TestFixtures.uniqueSender();
                String signature = TestFixtures.twilioSignature(Common.WEBHOOK_URL, sender, "London");

                send(sender, "Londom", signature)
                                .andExpect(status().isForbidden())
                                .andExpect(jsonPath("$.error").value("FORBIDDEN"))
                                .andExpect(jsonPath("$.message").value("Invalid webhook signature"));
        }

        @Test
        void testWebhook_MissingSignatureRejected() throws Exception {
                mockMvc.perform(post("/webhook")
                                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                                .param("From", TestFixtures.uniqueSender())
                                .param("Body", "ping"))
                                .andExpect(status().isForbidden());
        }

        @Test
        void testWebhook_RejectedSignaturesDoNotConsumeRateLimit() throws Exception {
                String sender = TestFixtures.uniqueSender();
                for (int i = 0; i < 6; i++) {
                        send(sender, "ping", "bm90LWEtc2lnbmF0dXJl").andExpect(status().isForbidden());
                }

                sendSigned(sender, "ping").andExpect(status().isOk());
        }

        @Test
        void testWebhook_PathParameterDoesNotBypassSignature() throws Exception {
                long before = weatherRecordJpaRepository.count();

                mockMvc.perform(post("/webhook;x=1")
                                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                                .param("From", TestFixtures.uniqueSender())
                                .param("Body", Common.LONDON))
                                .andExpect(status().isForbidden())
                                .andExpect(jsonPath("$.error").value("FORBIDDEN"));

                assertThat(weatherRecordJpaRepository.count()).isEqualTo(before);
        }

        @Test
        void testWebhook_PercentEncodedPathDoesNotBypassSignature() throws Exception {
                long before = weatherRecordJpaRepository.count();

                mockMvc.perform(post(URI.create("http://localhost/%77ebhook"))
                                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                                .param("From", TestFixtures.uniqueSender())
                                .param("Body", Common.LONDON))
                                .andExpect(status().isForbidden())
                                .andExpect(jsonPath("$.error").value("FORBIDDEN"));

                assertThat(weatherRecordJpaRepository.count()).isEqualTo(before);
        }

        @Test
        void testWebhook_CallbackUrlWithQueryStringVerifies() throws Exception {
                String sender = TestFixtures.uniqueSender();
                String signature = TestFixtures.twilioSignature(Common.WEBHOOK_URL + "?src=twilio", sender, "ping");

                mockMvc.perform(post("/webhook?src=twilio")
                                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                                .header(WebhookSecurityFilter.SIGNATURE_HEADER, signature)
                                .param("From", sender)
                                .param("Body", "ping"))
                                .andExpect(status().isOk())
                                .andExpect(content().string(containsString("Weather bot is working!")));
        }
}
