package com.weatherbot.infrastructure.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Verifies the X-Twilio-Signature header of inbound webhook calls.
 * 
 * The expected signature is Base64(HMAC-SHA1(authToken, url + sorted params)),
 * where every form parameter contributes its name followed by its value.
 * When no auth token is configured, verification is disabled.
 */
@Component
public class TwilioSignatureVerifier {

    private static final Logger logger = LoggerFactory.getLogger(TwilioSignatureVerifier.class);
    private static final String HMAC_ALGORITHM = "HmacSHA1";

    private final String authToken;

    public TwilioSignatureVerifier(@Value("${app.webhook.auth-token:}") String authToken) {
        this.authToken = authToken;
        if (!isEnabled()) {
            logger.warn("Webhook auth token not configured: signature verification is DISABLED (insecure mode)");
        }
    }

    public boolean isEnabled() {
        return authToken != null && !authToken.isBlank();
    }

    /**
     * Check a signature header against the callback URL and form parameters.
     * 
     * @param url Full callback URL as Twilio called it
     * @param params Form parameters of the request body
     * @param signature Value of the X-Twilio-Signature header
     * @return true if the signature matches, or verification is disabled
     */
    public boolean verify(String url, Map<String, String[]> params, String signature) {
        if (!isEnabled()) {
            logger.debug("Skipping webhook signature verification (no auth token)");
            return true;
        }
        if (signature == null || signature.isEmpty()) {
            return false;
        }
        byte[] expected = sign(url, params).getBytes(StandardCharsets.UTF_8);
        byte[] actual = signature.getBytes(StandardCharsets.UTF_8);
        // constant-time comparison
        return MessageDigest.isEqual(expected, actual);
    }

    /**
     * Compute the signature Twilio would send for this request.
     */
    public String sign(String url, Map<String, String[]> params) {
        if (!isEnabled()) {
            throw new IllegalStateException("No auth token configured");
        }
        StringBuilder data = new StringBuilder(url);
        List<String> keys = new ArrayList<>(params.keySet());
        Collections.sort(keys);
        for (String key : keys) {
            for (String value : params.get(key)) {
                data.append(key).append(value);
            }
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(authToken.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(data.toString().getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA1 unavailable", e);
        }
    }
}
