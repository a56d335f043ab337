package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of recent sale prices for an item.
 */
public enum MarketSentiment {
    BULLISH("bullish"),
    BEARISH("bearish"),
    NEUTRAL("neutral");

    private final String value;

    MarketSentiment(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MarketSentiment fromString(String value) {
        for (MarketSentiment sentiment : MarketSentiment.values()) {
            if (sentiment.value.equalsIgnoreCase(value)) {
                return sentiment;
            }
        }
        throw new IllegalArgumentException("Unknown market sentiment: " + value);
    }
}
