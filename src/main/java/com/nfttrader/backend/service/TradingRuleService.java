package com.nfttrader.backend.service;

import com.nfttrader.backend.config.CacheConfig;
import com.nfttrader.backend.dto.TradingRuleRequest;
import com.nfttrader.backend.exception.RuleNotFoundException;
import com.nfttrader.backend.model.AutomatedTrade;
import com.nfttrader.backend.model.TradeStatus;
import com.nfttrader.backend.model.TradingAction;
import com.nfttrader.backend.model.TradingRule;
import com.nfttrader.backend.service.events.TradingEventPublisher;
import com.nfttrader.backend.service.events.TradingEventType;
import com.nfttrader.backend.service.rules.ConditionEvaluator;
import com.nfttrader.backend.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Owner-scoped trading rules and their execution. A rule fires when it is enabled,
 * out of cooldown, under its daily quota and all of its conditions hold.
 */
@Service
public class TradingRuleService {

    private static final Logger logger = LoggerFactory.getLogger(TradingRuleService.class);

    static final Duration EXECUTION_WINDOW = Duration.ofHours(24);

    private final StateStore<String, List<TradingRule>> ruleStore;
    private final ConditionEvaluator conditionEvaluator;
    private final TradeExecutionService tradeExecutionService;
    private final TradingEventPublisher eventPublisher;
    private final Clock clock;

    // Guards eligibility checks and statistics of one rule
    private final Map<String, Object> ruleLocks = new ConcurrentHashMap<>();

    @Value("${nft.rules.default-max-executions-per-day:10}")
    private int defaultMaxExecutionsPerDay = 10;

    @Autowired
    public TradingRuleService(
            @Qualifier(CacheConfig.RULE_STORE) StateStore<String, List<TradingRule>> ruleStore,
            ConditionEvaluator conditionEvaluator,
            TradeExecutionService tradeExecutionService,
            TradingEventPublisher eventPublisher,
            Clock clock) {
        this.ruleStore = ruleStore;
        this.conditionEvaluator = conditionEvaluator;
        this.tradeExecutionService = tradeExecutionService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    // ============ RULE MANAGEMENT ============

    public TradingRule createRule(String ownerAddress, TradingRuleRequest request) {
        if (request == null || request.getName() == null || request.getName().isBlank()) {
            throw new IllegalArgumentException("Rule name is required");
        }
        if (request.getType() == null) {
            throw new IllegalArgumentException("Rule type is required");
        }

        TradingRule rule = TradingRule.builder()
            .id("rule-" + UUID.randomUUID())
            .name(request.getName())
            .description(request.getDescription())
            .type(request.getType())
            .conditions(request.getConditions() != null ? new ArrayList<>(request.getConditions()) : new ArrayList<>())
            .actions(request.getActions() != null ? new ArrayList<>(request.getActions()) : new ArrayList<>())
            .enabled(request.getEnabled() == null || request.getEnabled())
            .priority(request.getPriority() != null ? request.getPriority() : 0)
            .cooldownPeriod(request.getCooldownPeriod() != null ? request.getCooldownPeriod() : 0)
            .maxExecutionsPerDay(request.getMaxExecutionsPerDay() != null
                ? request.getMaxExecutionsPerDay() : defaultMaxExecutionsPerDay)
            .executionCount(0)
            .successRate(0)
            .totalProfit(BigDecimal.ZERO)
            .createdAt(clock.instant())
            .build();

        ruleStore.getOrCreate(ownerAddress, key -> new CopyOnWriteArrayList<>()).add(rule);
        logger.info("Created rule {} ({}) for {}", rule.getId(), rule.getName(), ownerAddress);

        Map<String, Object> payload = new HashMap<>();
        payload.put("rule", rule);
        eventPublisher.publish(TradingEventType.RULE_CREATED, ownerAddress, payload);
        return rule;
    }

    /**
     * Copies the non-null fields of the request onto the rule.
     *
     * @return the updated rule, or empty if the owner has no such rule
     * @throws IllegalArgumentException if no updates are given
     */
    public Optional<TradingRule> updateRule(String ownerAddress, String ruleId, TradingRuleRequest updates) {
        if (updates == null) {
            throw new IllegalArgumentException("Rule updates are required");
        }
        Optional<TradingRule> existing = getRule(ownerAddress, ruleId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        TradingRule rule = existing.get();
        synchronized (lockFor(ruleId)) {
            if (updates.getName() != null) rule.setName(updates.getName());
            if (updates.getDescription() != null) rule.setDescription(updates.getDescription());
            if (updates.getType() != null) rule.setType(updates.getType());
            if (updates.getConditions() != null) rule.setConditions(new ArrayList<>(updates.getConditions()));
            if (updates.getActions() != null) rule.setActions(new ArrayList<>(updates.getActions()));
            if (updates.getEnabled() != null) rule.setEnabled(updates.getEnabled());
            if (updates.getPriority() != null) rule.setPriority(updates.getPriority());
            if (updates.getCooldownPeriod() != null) rule.setCooldownPeriod(updates.getCooldownPeriod());
            if (updates.getMaxExecutionsPerDay() != null) rule.setMaxExecutionsPerDay(updates.getMaxExecutionsPerDay());
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("ruleId", ruleId);
        payload.put("updates", updates);
        eventPublisher.publish(TradingEventType.RULE_UPDATED, ownerAddress, payload);
        return Optional.of(rule);
    }

    public boolean deleteRule(String ownerAddress, String ruleId) {
        Optional<List<TradingRule>> rules = ruleStore.get(ownerAddress);
        if (rules.isEmpty() || !rules.get().removeIf(rule -> rule.getId().equals(ruleId))) {
            return false;
        }
        ruleLocks.remove(ruleId);

        logger.info("Deleted rule {} for {}", ruleId, ownerAddress);
        eventPublisher.publish(TradingEventType.RULE_DELETED, ownerAddress, Map.of("ruleId", ruleId));
        return true;
    }

    public List<TradingRule> getRules(String ownerAddress) {
        return ruleStore.get(ownerAddress)
            .<List<TradingRule>>map(ArrayList::new)
            .orElse(Collections.emptyList());
    }

    public Optional<TradingRule> getRule(String ownerAddress, String ruleId) {
        return getRules(ownerAddress).stream()
            .filter(rule -> rule.getId().equals(ruleId))
            .findFirst();
    }

    /**
     * Enabled rules, highest priority first. Rules of equal priority keep creation order.
     */
    public List<TradingRule> getEnabledRulesByPriority(String ownerAddress) {
        return getRules(ownerAddress).stream()
            .filter(TradingRule::isEnabled)
            .sorted(Comparator.comparingInt(TradingRule::getPriority).reversed())
            .collect(Collectors.toList());
    }

    public long countRules() {
        return ruleStore.values().stream().mapToLong(List::size).sum();
    }

    public void clearOwner(String ownerAddress) {
        getRules(ownerAddress).forEach(rule -> ruleLocks.remove(rule.getId()));
        ruleStore.delete(ownerAddress);
    }

    public void clearAll() {
        ruleStore.clear();
        ruleLocks.clear();
    }

    // ============ RULE EXECUTION ============

    /**
     * Runs the rule's actions if it is eligible right now.
     *
     * @return the first trade the rule produced, or empty if it did not fire or every action failed
     * @throws RuleNotFoundException if the owner has no such rule
     */
    public Optional<AutomatedTrade> executeRule(String ownerAddress, String ruleId) {
        TradingRule rule = getRule(ownerAddress, ruleId)
            .orElseThrow(() -> new RuleNotFoundException(ownerAddress, ruleId));

        synchronized (lockFor(ruleId)) {
            Instant now = clock.instant();
            if (!isEligible(rule, now)) {
                return Optional.empty();
            }
            if (!conditionEvaluator.evaluateAll(ownerAddress, rule.getConditions())) {
                return Optional.empty();
            }

            List<AutomatedTrade> trades = new ArrayList<>();
            for (TradingAction action : rule.getActions()) {
                try {
                    trades.add(tradeExecutionService.execute(ownerAddress, ruleId, action));
                } catch (Exception e) {
                    logger.error("Failed to execute {} action for rule {}: {}",
                        action.getType() != null ? action.getType().getValue() : null, ruleId, e.getMessage());
                }
            }

            rule.setLastExecuted(now);
            rule.getRecentExecutions().add(now);
            rule.setExecutionCount(rule.getRecentExecutions().size());
            updateStatistics(ownerAddress, rule);

            logger.info("Rule {} for {} executed: {} trade(s)", ruleId, ownerAddress, trades.size());
            Map<String, Object> payload = new HashMap<>();
            payload.put("ruleId", ruleId);
            payload.put("trades", trades);
            eventPublisher.publish(TradingEventType.RULE_EXECUTED, ownerAddress, payload);

            return trades.isEmpty() ? Optional.empty() : Optional.of(trades.get(0));
        }
    }

    /**
     * Enabled, out of cooldown and under quota. The quota counts executions in the
     * 24 hours before {@code now}; older ones are dropped here.
     */
    boolean isEligible(TradingRule rule, Instant now) {
        if (!rule.isEnabled()) {
            return false;
        }

        if (rule.getRecentExecutions() == null) {
            rule.setRecentExecutions(new CopyOnWriteArrayList<>());
        }
        rule.getRecentExecutions().removeIf(executedAt ->
            Duration.between(executedAt, now).compareTo(EXECUTION_WINDOW) >= 0);
        rule.setExecutionCount(rule.getRecentExecutions().size());

        if (rule.getLastExecuted() != null
                && Duration.between(rule.getLastExecuted(), now).compareTo(Duration.ofMinutes(rule.getCooldownPeriod())) < 0) {
            logger.debug("Rule {} is cooling down", rule.getId());
            return false;
        }

        if (rule.getExecutionCount() >= rule.getMaxExecutionsPerDay()) {
            logger.debug("Rule {} reached its daily limit of {}", rule.getId(), rule.getMaxExecutionsPerDay());
            return false;
        }
        return true;
    }

    /**
     * Success rate and profit over every trade the rule has produced so far.
     */
    private void updateStatistics(String ownerAddress, TradingRule rule) {
        List<AutomatedTrade> trades = tradeExecutionService.getTradesForRule(ownerAddress, rule.getId());
        if (trades.isEmpty()) {
            return;
        }

        long completed = 0;
        BigDecimal profit = BigDecimal.ZERO;
        for (AutomatedTrade trade : trades) {
            if (trade.getStatus() == TradeStatus.COMPLETED) {
                completed++;
                profit = profit.add(trade.getProfitOrZero());
            }
        }
        rule.setSuccessRate(completed * 100.0 / trades.size());
        rule.setTotalProfit(profit);
    }

    private Object lockFor(String ruleId) {
        return ruleLocks.computeIfAbsent(ruleId, id -> new Object());
    }
}
