package com.gridmaker.api.model;

/**
 * Order side with Backpack wire names.
 */
public enum Side {
    BID("Bid"),
    ASK("Ask");

    private final String wireName;

    Side(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public Side opposite() {
        return this == BID ? ASK : BID;
    }

    /**
     * Parse a wire value ("Bid"/"Ask", case-insensitive; "buy"/"sell" accepted too).
     */
    public static Side fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Side is required");
        }
        return switch (value.trim().toLowerCase()) {
            case "bid", "buy" -> BID;
            case "ask", "sell" -> ASK;
            default -> throw new IllegalArgumentException("Unknown side: " + value);
        };
    }
}
