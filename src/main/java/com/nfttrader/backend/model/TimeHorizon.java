package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TimeHorizon {
    SHORT("short"),
    MEDIUM("medium"),
    LONG("long");

    private final String value;

    TimeHorizon(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TimeHorizon fromString(String value) {
        for (TimeHorizon type : TimeHorizon.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown time horizon: " + value);
    }
}
