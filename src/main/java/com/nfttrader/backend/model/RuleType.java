package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RuleType {
    BUY("buy"),
    SELL("sell"),
    SWAP("swap"),
    REBALANCE("rebalance");

    private final String value;

    RuleType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RuleType fromString(String value) {
        for (RuleType type : RuleType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown rule type: " + value);
    }
}
