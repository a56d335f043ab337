package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionOperator {
    GT("gt"),
    LT("lt"),
    EQ("eq"),
    GTE("gte"),
    LTE("lte"),
    BETWEEN("between"),
    CONTAINS("contains");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConditionOperator fromString(String value) {
        for (ConditionOperator type : ConditionOperator.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown condition operator: " + value);
    }
}
