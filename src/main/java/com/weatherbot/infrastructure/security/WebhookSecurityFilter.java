package com.weatherbot.infrastructure.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weatherbot.domain.exception.ErrorKind;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Security filter for the messaging webhook.
 * Rejects POST /webhook calls whose X-Twilio-Signature does not match before
 * any rate limiting or lookup happens.
 */
@Component
public class WebhookSecurityFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(WebhookSecurityFilter.class);
    public static final String SIGNATURE_HEADER = "X-Twilio-Signature";
    static final String WEBHOOK_PATH = "/webhook";

    // decodes percent-escapes and strips ;path-parameters the same way request mapping does
    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    private final TwilioSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;
    private final String publicUrl;

    public WebhookSecurityFilter(
        TwilioSignatureVerifier signatureVerifier,
        ObjectMapper objectMapper,
        @Value("${app.webhook.public-url:}") String publicUrl
    ) {
        this.signatureVerifier = signatureVerifier;
        this.objectMapper = objectMapper;
        this.publicUrl = publicUrl;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !"POST".equals(request.getMethod()) || !isWebhookPath(PATH_HELPER.getPathWithinApplication(request));
    }

    static boolean isWebhookPath(String path) {
        return WEBHOOK_PATH.equals(path) || (WEBHOOK_PATH + "/").equals(path);
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {

        String signature = request.getHeader(SIGNATURE_HEADER);
        String url = callbackUrl(request);

        if (!signatureVerifier.verify(url, formParameters(request), signature)) {
            logger.warn("Webhook signature validation failed for url={}", url);
            sendErrorResponse(response, ErrorKind.AUTHENTICATION, "Invalid webhook signature");
            return;
        }

        filterChain.doFilter(request, response);
    }

    /**
     * The URL Twilio signed: the configured public URL, or the URL as received.
     */
    private String callbackUrl(HttpServletRequest request) {
        if (publicUrl != null && !publicUrl.isBlank()) {
            return publicUrl;
        }
        StringBuilder url = new StringBuilder(request.getRequestURL());
        if (request.getQueryString() != null) {
            url.append('?').append(request.getQueryString());
        }
        return url.toString();
    }

    /**
     * Parameters of the form body only. The servlet parameter map also holds the
     * query string, which Twilio signs as part of the URL and not as form fields.
     * Query values come first in the map, so they are dropped from the front.
     */
    static Map<String, String[]> formParameters(HttpServletRequest request) {
        Map<String, String[]> parameters = request.getParameterMap();
        String query = request.getQueryString();
        if (query == null || query.isEmpty()) {
            return parameters;
        }

        Map<String, Integer> queryCounts = new HashMap<>();
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            queryCounts.merge(name, 1, Integer::sum);
        }

        Map<String, String[]> form = new HashMap<>();
        parameters.forEach((name, values) -> {
            int skip = queryCounts.getOrDefault(name, 0);
            if (values.length > skip) {
                form.put(name, Arrays.copyOfRange(values, skip, values.length));
            }
        });
        return form;
    }

    private void sendErrorResponse(HttpServletResponse response, ErrorKind kind, String message) throws IOException {
        response.setStatus(kind.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        Map<String, String> errorBody = Map.of(
            "error", kind.getCode(),
            "message", message
        );

        response.getWriter().write(objectMapper.writeValueAsString(errorBody));
    }
}
