package com.gridmaker.api;

import com.gridmaker.config.ExchangeCredentials;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * HMAC-SHA256 request signing.
 *
 * Signed message: {@code instruction=<i>[&k=v sorted by key]&timestamp=<ms>&window=<w>},
 * sent as a lowercase hex digest.
 */
public final class RequestSigner {
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final ExchangeCredentials credentials;
    private final String window;
    private final Clock clock;

    public RequestSigner(ExchangeCredentials credentials, String window, Clock clock) {
        this.credentials = credentials;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Auth headers for a signed REST call.
     */
    public Map<String, String> headers(String instruction, Map<String, String> params) {
        String timestamp = String.valueOf(clock.millis());
        String signature = sign(canonical(instruction, params, timestamp, window));

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-API-KEY", credentials.apiKey());
        headers.put("X-SIGNATURE", signature);
        headers.put("X-TIMESTAMP", timestamp);
        headers.put("X-WINDOW", window);
        return headers;
    }

    /**
     * Signature array for a private stream subscription: [apiKey, signature, timestamp, window].
     */
    public List<String> streamSignature() {
        String timestamp = String.valueOf(clock.millis());
        String signature = sign(canonical("subscribe", Map.of(), timestamp, window));
        return List.of(credentials.apiKey(), signature, timestamp, window);
    }

    static String canonical(String instruction, Map<String, String> params, String timestamp, String window) {
        var message = new StringBuilder("instruction=").append(instruction);
        if (params != null && !params.isEmpty()) {
            String query = new TreeMap<>(params).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
            message.append('&').append(query);
        }
        message.append("&timestamp=").append(timestamp).append("&window=").append(window);
        return message.toString();
    }

    String sign(String message) {
        try {
            Mac hmac = Mac.getInstance(HMAC_ALGORITHM);
            hmac.init(new SecretKeySpec(credentials.secretBytes(), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(hmac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC signing failed", e);
        }
    }

    public String getWindow() {
        return window;
    }
}
