package com.weatherbot.api.controller;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class WeatherControllerTest {

    @Test
    void testClientKey_UsesFirstForwardedHop() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", " 198.51.100.7 , 10.0.0.1");
        request.setRemoteAddr("10.0.0.1");

        assertThat(WeatherController.clientKey(request)).isEqualTo("api:198.51.100.7");
    }

    @Test
    void testClientKey_FallsBackToRemoteAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("192.0.2.10");

        assertThat(WeatherController.clientKey(request)).isEqualTo("api:192.0.2.10");

        request.addHeader("X-Forwarded-For", "  ");
        assertThat(WeatherController.clientKey(request)).isEqualTo("api:192.0.2.10");
    }
}
