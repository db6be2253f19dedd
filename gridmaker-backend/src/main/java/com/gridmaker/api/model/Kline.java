package com.gridmaker.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable record representing a historical bar (OHLCV) from the klines endpoint.
 * Backpack sends prices as strings and {@code start} as "yyyy-MM-dd HH:mm:ss",
 * which sorts chronologically as text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Kline(
    @JsonProperty("start") String start,
    @JsonProperty("open") double open,
    @JsonProperty("high") double high,
    @JsonProperty("low") double low,
    @JsonProperty("close") double close,
    @JsonProperty("volume") double volume
) {
    public Kline {
        if (close <= 0) {
            throw new IllegalArgumentException("Close price must be positive");
        }
    }
}
