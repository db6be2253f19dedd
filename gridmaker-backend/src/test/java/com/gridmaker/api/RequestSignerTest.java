package com.gridmaker.api;

import com.gridmaker.config.ExchangeCredentials;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RequestSigner Tests")
class RequestSignerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    private final RequestSigner signer = new RequestSigner(new ExchangeCredentials("my-key", "Jefe"), "5000", CLOCK);

    @Test
    @DisplayName("Canonical string should sort parameters and append timestamp and window")
    void canonicalSortsParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", "SOL_USDC");
        params.put("orderId", "42");

        String message = RequestSigner.canonical("orderCancel", params, "1700000000000", "5000");

        assertThat(message).isEqualTo(
            "instruction=orderCancel&orderId=42&symbol=SOL_USDC&timestamp=1700000000000&window=5000");
    }

    @Test
    @DisplayName("Canonical string without parameters should go straight to the timestamp")
    void canonicalWithoutParameters() {
        assertThat(RequestSigner.canonical("balanceQuery", Map.of(), "1", "5000"))
            .isEqualTo("instruction=balanceQuery&timestamp=1&window=5000");
    }

    @Test
    @DisplayName("HMAC should match the RFC 4231 reference digest")
    void hmacMatchesReference() {
        assertThat(signer.sign("what do ya want for nothing?"))
            .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
    }

    @Test
    @DisplayName("Headers should carry key, signature, timestamp and window")
    void headersAreComplete() {
        Map<String, String> params = Map.of("symbol", "SOL_USDC");

        Map<String, String> headers = signer.headers("orderCancelAll", params);

        assertThat(headers).containsOnlyKeys("X-API-KEY", "X-SIGNATURE", "X-TIMESTAMP", "X-WINDOW");
        assertThat(headers.get("X-API-KEY")).isEqualTo("my-key");
        assertThat(headers.get("X-TIMESTAMP")).isEqualTo("1700000000000");
        assertThat(headers.get("X-WINDOW")).isEqualTo("5000");
        assertThat(headers.get("X-SIGNATURE")).isEqualTo(
            signer.sign(RequestSigner.canonical("orderCancelAll", params, "1700000000000", "5000")));
    }

    @Test
    @DisplayName("Stream signature should sign the subscribe instruction")
    void streamSignature() {
        assertThat(signer.streamSignature()).containsExactly(
            "my-key",
            signer.sign("instruction=subscribe&timestamp=1700000000000&window=5000"),
            "1700000000000",
            "5000");
    }
}
