package com.gridmaker.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("ExchangeCredentials Tests")
class ExchangeCredentialsTest {

    @Test
    @DisplayName("Should accept a complete key pair")
    void shouldAcceptCompleteKeyPair() {
        var credentials = new ExchangeCredentials("api-key-123", "secret");

        assertThat(credentials.validate()).isSameAs(credentials);
        assertThat(credentials.secretBytes()).isEqualTo("secret".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should reject blank keys with every violation listed")
    void shouldRejectBlankKeys() {
        var credentials = new ExchangeCredentials(" ", "");

        assertThatThrownBy(credentials::validate)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("apiKey: API key is required")
            .hasMessageContaining("secretKey: Secret key is required");
    }

    @Test
    @DisplayName("Should fall back to config properties when the environment is empty")
    void shouldResolveFromConfig() {
        assumeTrue(System.getenv(ExchangeCredentials.API_KEY_ENV) == null);
        assumeTrue(System.getenv(ExchangeCredentials.SECRET_KEY_ENV) == null);

        Properties props = new Properties();
        props.setProperty(ExchangeCredentials.API_KEY_ENV, " from-config ");
        props.setProperty(ExchangeCredentials.SECRET_KEY_ENV, "config-secret");

        var credentials = ExchangeCredentials.resolve(MakerConfig.forTest(props));

        assertThat(credentials.apiKey()).isEqualTo("from-config");
        assertThat(credentials.secretKey()).isEqualTo("config-secret");
    }

    @Test
    @DisplayName("Should never print the secret")
    void shouldMaskSecretsInToString() {
        var credentials = new ExchangeCredentials("abcdefgh", "super-secret");

        assertThat(credentials.toString())
            .doesNotContain("super-secret")
            .doesNotContain("abcdefgh")
            .contains("abcd****");
    }
}
