package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One comparison in a rule. {@code value} is a number for the scalar operators,
 * a two-element list for BETWEEN and a list of candidates for CONTAINS.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingCondition {
    private ConditionType type;
    private ConditionOperator operator;
    private Object value;
    private String contractAddress;
    private String tokenId;
}
