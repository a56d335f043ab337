package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Scanner strategy that produced an opportunity.
 */
public enum OpportunityType {
    ARBITRAGE("arbitrage"),
    FLIP("flip"),
    MOMENTUM("momentum"),
    MEAN_REVERSION("mean_reversion");

    private final String value;

    OpportunityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static OpportunityType fromString(String value) {
        for (OpportunityType type : OpportunityType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown opportunity type: " + value);
    }
}
