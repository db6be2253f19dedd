package com.gridmaker.persistence;

import com.gridmaker.api.model.Side;

import java.time.Instant;

public record TradeRecord(long id, String symbol, Side side, double price, double quantity, Instant executedAt) {
}
