package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owner-scoped automation rule. Execution bookkeeping (lastExecuted, executionCount,
 * recentExecutions, successRate, totalProfit) is written only by the rule engine.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TradingRule {
    private String id;
    private String name;
    private String description;
    private RuleType type;

    @Builder.Default
    private List<TradingCondition> conditions = new ArrayList<>();

    @Builder.Default
    private List<TradingAction> actions = new ArrayList<>();

    private boolean enabled;
    private int priority;
    private int cooldownPeriod;          // minutes
    private int maxExecutionsPerDay;

    private Instant lastExecuted;
    private int executionCount;          // executions inside the current rolling day

    // execution times inside the last 24 h, oldest first
    @Builder.Default
    private List<Instant> recentExecutions = new CopyOnWriteArrayList<>();

    private double successRate;          // percentage of completed trades
    @Builder.Default
    private BigDecimal totalProfit = BigDecimal.ZERO;

    private Instant createdAt;
}
