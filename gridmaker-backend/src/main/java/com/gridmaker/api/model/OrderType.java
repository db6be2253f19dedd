package com.gridmaker.api.model;

public enum OrderType {
    LIMIT("Limit"),
    MARKET("Market");

    private final String wireName;

    OrderType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static OrderType fromWire(String value) {
        for (OrderType type : values()) {
            if (type.wireName.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown order type: " + value);
    }
}
