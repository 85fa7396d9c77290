package com.weatherbot.domain.service;

import com.weatherbot.domain.model.MessageType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class MessageRouterTest {

    private final MessageRouter router = new MessageRouter();

    @ParameterizedTest
    @ValueSource(strings = {"hello", "HI", " Start "})
    void testCommand_Greetings(String body) {
        assertThat(router.command(body)).contains(MessageType.GREETING);
    }

    @ParameterizedTest
    @ValueSource(strings = {"help", "Help", "?"})
    void testCommand_Help(String body) {
        assertThat(router.command(body)).contains(MessageType.HELP);
    }

    @Test
    void testCommand_Ping() {
        assertThat(router.command("PING")).contains(MessageType.PING);
    }

    @ParameterizedTest
    @ValueSource(strings = {"London", "hello world", "pingtown", ""})
    void testCommand_EverythingElseIsPlaceName(String body) {
        assertThat(router.command(body)).isEmpty();
    }
}
