package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of an automated trade. Only PENDING and EXECUTING are non-terminal.
 */
public enum TradeStatus {
    PENDING("pending"),
    EXECUTING("executing"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    TradeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING && this != EXECUTING;
    }

    @JsonCreator
    public static TradeStatus fromString(String value) {
        for (TradeStatus type : TradeStatus.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trade status: " + value);
    }
}
