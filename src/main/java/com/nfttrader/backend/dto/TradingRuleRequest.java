package com.nfttrader.backend.dto;

import com.nfttrader.backend.model.RuleType;
import com.nfttrader.backend.model.TradingAction;
import com.nfttrader.backend.model.TradingCondition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Owner-editable part of a trading rule. Used for creation and for partial updates,
 * where null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingRuleRequest {
    private String name;
    private String description;
    private RuleType type;
    private List<TradingCondition> conditions;
    private List<TradingAction> actions;
    private Boolean enabled;
    private Integer priority;
    private Integer cooldownPeriod;      // minutes
    private Integer maxExecutionsPerDay;
}
