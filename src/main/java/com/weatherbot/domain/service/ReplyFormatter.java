package com.weatherbot.domain.service;

import com.weatherbot.domain.model.MessageType;
import com.weatherbot.domain.model.WeatherRecord;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders chat replies and wraps them as TwiML for the messaging webhook.
 */
@Service
public class ReplyFormatter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'");

    public String weather(WeatherRecord record) {
        return "Weather Update for " + record.getCity() + "\n\n"
            + "Temperature: " + record.getTemperature() + "°C\n"
            + "Conditions: " + titleCase(record.getDescription()) + "\n"
            + "Feels like: " + record.getFeelsLike() + "°C\n"
            + "Humidity: " + record.getHumidity() + "%\n\n"
            + "Last updated: " + TIMESTAMP.format(record.getCreatedAt().withOffsetSameInstant(ZoneOffset.UTC));
    }

    public String command(MessageType type) {
        return switch (type) {
            case GREETING -> "WhatsApp Weather Bot\n\n"
                + "Commands:\n"
                + "- Send city name for weather (e.g., 'London' or 'New York')\n"
                + "- 'help' for commands\n"
                + "- 'ping' to test\n\n"
                + "Example: London";
            case HELP -> "Available commands:\n"
                + "- Send city name for weather\n"
                + "- 'ping' - test bot\n"
                + "- 'help' - show commands\n\n"
                + "Supported: Any city worldwide";
            case PING -> "Weather bot is working!";
            default -> throw new IllegalArgumentException("Not a command: " + type);
        };
    }

    public String invalidInput(String reason) {
        return "Invalid Input\n\nError: " + reason + "\n\nPlease send a valid city name.";
    }

    public String weatherError(String city) {
        return "Weather Error\n\nCould not fetch weather for: " + city + "\n\nTry a different city name.";
    }

    public String storageError() {
        return "Database not available. Please try again later.";
    }

    /**
     * Wraps a reply as a TwiML messaging response.
     */
    public String twiml(String text) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<Response><Message>" + HtmlUtils.htmlEscape(text, "UTF-8") + "</Message></Response>";
    }

    private String titleCase(String text) {
        if (text == null) {
            return "";
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split(" "))
            .map(StringUtils::capitalize)
            .collect(Collectors.joining(" "));
    }
}
