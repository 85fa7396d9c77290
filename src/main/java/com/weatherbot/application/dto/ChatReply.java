package com.weatherbot.application.dto;

import com.weatherbot.domain.model.MessageType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Text to send back to a chat sender, with its classification for metrics.
 */
@Getter
@AllArgsConstructor
@ToString
public class ChatReply {
    private final MessageType type;
    private final String text;
}
