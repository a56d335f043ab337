package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a trading condition compares against.
 */
public enum ConditionType {
    PRICE("price"),
    FLOOR_PRICE("floor_price"),
    VOLUME("volume"),
    RARITY("rarity"),
    TIME("time"),
    PORTFOLIO("portfolio"),
    MARKET_SENTIMENT("market_sentiment");

    private final String value;

    ConditionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConditionType fromString(String value) {
        for (ConditionType type : ConditionType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown condition type: " + value);
    }
}
