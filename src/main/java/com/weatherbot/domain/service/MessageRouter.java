package com.weatherbot.domain.service;

import com.weatherbot.domain.model.MessageType;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Recognizes the bot's chat commands. Any other message is treated as a place name.
 */
@Service
public class MessageRouter {

    private static final Set<String> GREETINGS = Set.of("hello", "hi", "start");
    private static final Set<String> HELP = Set.of("help", "?");
    private static final String PING = "ping";

    /**
     * @param body Raw message body
     * @return The command type, or empty when the body should be looked up as a place name
     */
    public Optional<MessageType> command(String body) {
        String message = body == null ? "" : body.trim().toLowerCase(Locale.ROOT);

        if (GREETINGS.contains(message)) {
            return Optional.of(MessageType.GREETING);
        }
        if (HELP.contains(message)) {
            return Optional.of(MessageType.HELP);
        }
        if (PING.equals(message)) {
            return Optional.of(MessageType.PING);
        }
        return Optional.empty();
    }
}
