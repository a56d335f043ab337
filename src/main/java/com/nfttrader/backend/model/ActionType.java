package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Actions a trading rule can dispatch.
 */
public enum ActionType {
    BUY("buy"),
    SELL("sell"),
    LIST("list"),
    UNLIST("unlist"),
    OFFER("offer"),
    CANCEL_OFFER("cancel_offer"),
    ALERT("alert"),
    REBALANCE("rebalance");

    private final String value;

    ActionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ActionType fromString(String value) {
        for (ActionType type : ActionType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + value);
    }
}
