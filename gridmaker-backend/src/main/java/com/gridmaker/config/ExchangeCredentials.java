package com.gridmaker.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Backpack API key pair.
 * Loaded from environment variables first, then from the config properties.
 */
public record ExchangeCredentials(
    @NotBlank(message = "API key is required")
    String apiKey,

    @NotBlank(message = "Secret key is required")
    String secretKey
) {
    private static final Logger logger = LoggerFactory.getLogger(ExchangeCredentials.class);

    public static final String API_KEY_ENV = "BACKPACK_API_KEY";
    public static final String SECRET_KEY_ENV = "BACKPACK_SECRET_KEY";

    /**
     * Resolve credentials: environment overrides config.properties.
     */
    public static ExchangeCredentials resolve(MakerConfig config) {
        var key = Optional.ofNullable(System.getenv(API_KEY_ENV))
            .or(() -> Optional.ofNullable(config.getProperty(API_KEY_ENV)))
            .orElse("");
        var secret = Optional.ofNullable(System.getenv(SECRET_KEY_ENV))
            .or(() -> Optional.ofNullable(config.getProperty(SECRET_KEY_ENV)))
            .orElse("");
        logger.debug("Resolved exchange credentials (key present: {})", !key.isBlank());
        return new ExchangeCredentials(key.trim(), secret.trim());
    }

    /**
     * Validate using Bean Validation.
     * Throws IllegalStateException if a key is missing.
     */
    public ExchangeCredentials validate() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        var violations = validator.validate(this);

        if (!violations.isEmpty()) {
            var errorMessages = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList();

            throw new IllegalStateException(
                "Credential validation failed: " + String.join(", ", errorMessages)
            );
        }
        return this;
    }

    /** HMAC key material: the secret as UTF-8 bytes. */
    public byte[] secretBytes() {
        return secretKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "ExchangeCredentials[apiKey=" + mask(apiKey) + ", secretKey=****]";
    }

    private static String mask(String value) {
        if (value == null || value.length() < 6) {
            return "****";
        }
        return value.substring(0, 4) + "****";
    }
}
