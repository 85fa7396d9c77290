package com.weatherbot.api.controller;

import com.weatherbot.application.dto.ChatReply;
import com.weatherbot.application.port.in.HandleMessageUseCase;
import com.weatherbot.domain.exception.RateLimitExceededException;
import com.weatherbot.domain.service.ReplyFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;

/**
 * Controller for the messaging webhook.
 * Twilio posts inbound WhatsApp messages here as form fields and expects TwiML back.
 * The signature has already been checked by WebhookSecurityFilter.
 */
@RestController
@RequestMapping("/webhook")
public class WebhookController {

    private static final Logger logger = LoggerFactory.getLogger(WebhookController.class);
    private static final MediaType TWIML = new MediaType("application", "xml", StandardCharsets.UTF_8);

    private final HandleMessageUseCase handleMessageUseCase;
    private final ReplyFormatter replyFormatter;

    public WebhookController(HandleMessageUseCase handleMessageUseCase, ReplyFormatter replyFormatter) {
        this.handleMessageUseCase = handleMessageUseCase;
        this.replyFormatter = replyFormatter;
    }

    /**
     * POST /webhook
     * 
     * @param from Sender address, e.g. whatsapp:+15551234567
     * @param body Message text
     * @return TwiML message reply
     */
    @PostMapping(consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<String> handleWebhook(
            @RequestParam("From") String from,
            @RequestParam(value = "Body", defaultValue = "") String body) {
        logger.info("Webhook received from {}, body length: {}", from, body.length());

        ChatReply reply = handleMessageUseCase.handleMessage(from, body);

        return ResponseEntity.ok()
                .contentType(TWIML)
                .body(replyFormatter.twiml(reply.getText()));
    }

    /**
     * Rate-limited senders get a plain-text 429 rather than a chat reply.
     */
    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<String> handleRateLimited(RateLimitExceededException ex) {
        logger.warn("Rate limit exceeded for sender {}", ex.getSenderKey());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfter().getSeconds()))
                .contentType(MediaType.TEXT_PLAIN)
                .body(ex.getMessage());
    }
}
