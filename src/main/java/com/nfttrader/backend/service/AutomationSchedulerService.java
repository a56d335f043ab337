package com.nfttrader.backend.service;

import com.nfttrader.backend.config.SchedulerConfig;
import com.nfttrader.backend.model.AutomationHealth;
import com.nfttrader.backend.model.TradingOpportunity;
import com.nfttrader.backend.model.TradingRule;
import com.nfttrader.backend.service.events.TradingEventPublisher;
import com.nfttrader.backend.service.events.TradingEventType;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic automation per owner: each tick scans for opportunities, then runs the
 * owner's enabled rules in priority order.
 */
@Service
public class AutomationSchedulerService {

    private static final Logger logger = LoggerFactory.getLogger(AutomationSchedulerService.class);

    private final TaskScheduler taskScheduler;
    private final OpportunityScannerService opportunityScannerService;
    private final TradingRuleService tradingRuleService;
    private final TradeExecutionService tradeExecutionService;
    private final ValuationService valuationService;
    private final TradingEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> schedules = new ConcurrentHashMap<>();

    @Value("${nft.automation.default-interval-minutes:15}")
    private int defaultIntervalMinutes = 15;

    @Autowired
    public AutomationSchedulerService(
            @Qualifier(SchedulerConfig.AUTOMATION_SCHEDULER) TaskScheduler taskScheduler,
            OpportunityScannerService opportunityScannerService,
            TradingRuleService tradingRuleService,
            TradeExecutionService tradeExecutionService,
            ValuationService valuationService,
            TradingEventPublisher eventPublisher,
            Clock clock) {
        this.taskScheduler = taskScheduler;
        this.opportunityScannerService = opportunityScannerService;
        this.tradingRuleService = tradingRuleService;
        this.tradeExecutionService = tradeExecutionService;
        this.valuationService = valuationService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public void startAutomation(String ownerAddress) {
        startAutomation(ownerAddress, defaultIntervalMinutes);
    }

    /**
     * Schedules a tick every {@code intervalMinutes}, the first one interval from now.
     * A schedule already running for the owner is cancelled and replaced.
     */
    public void startAutomation(String ownerAddress, int intervalMinutes) {
        if (intervalMinutes <= 0) {
            throw new IllegalArgumentException("Interval must be a positive number of minutes");
        }
        Duration interval = Duration.ofMinutes(intervalMinutes);

        schedules.compute(ownerAddress, (owner, existing) -> {
            if (existing != null) {
                existing.cancel(false);
                logger.info("Replacing automated trading schedule for {}", owner);
            }
            return taskScheduler.scheduleAtFixedRate(() -> tick(owner), clock.instant().plus(interval), interval);
        });
        logger.info("Started automated trading for {} (every {} minutes)", ownerAddress, intervalMinutes);
    }

    /**
     * @return true if a schedule was running
     */
    public boolean stopAutomation(String ownerAddress) {
        ScheduledFuture<?> schedule = schedules.remove(ownerAddress);
        if (schedule == null) {
            return false;
        }
        schedule.cancel(false);
        logger.info("Stopped automated trading for {}", ownerAddress);
        return true;
    }

    public boolean isRunning(String ownerAddress) {
        return schedules.containsKey(ownerAddress);
    }

    /**
     * One automation cycle. Failures are logged so the schedule keeps running.
     */
    void tick(String ownerAddress) {
        try {
            List<TradingOpportunity> opportunities = opportunityScannerService.scanOpportunities(ownerAddress);
            eventPublisher.publish(TradingEventType.AUTOMATION_CYCLE, ownerAddress,
                Map.of("opportunitiesFound", opportunities.size()));

            for (TradingRule rule : tradingRuleService.getEnabledRulesByPriority(ownerAddress)) {
                try {
                    tradingRuleService.executeRule(ownerAddress, rule.getId());
                } catch (Exception e) {
                    logger.error("Rule {} failed during automated cycle for {}: {}", rule.getId(),
                        ownerAddress, e.getMessage());
                }
            }
        } catch (Exception e) {
            logger.error("Error in automated trading cycle for {}", ownerAddress, e);
        }
    }

    public AutomationHealth getHealthStatus() {
        Map<String, Long> cacheSizes = valuationService.getCacheSizes();
        return AutomationHealth.builder()
            .status("healthy")
            .timestamp(clock.instant())
            .activeRules(tradingRuleService.countRules())
            .activeTrades(tradeExecutionService.countTrades())
            .runningSchedules(schedules.size())
            .cachedOpportunities(opportunityScannerService.countOpportunities())
            .cachedValuations(cacheSizes.getOrDefault("valuations", 0L))
            .cachedCollections(cacheSizes.getOrDefault("collections", 0L))
            .build();
    }

    /**
     * Stops the owner's schedule and forgets their rules, trades and opportunities.
     */
    public void clearOwnerData(String ownerAddress) {
        stopAutomation(ownerAddress);
        tradingRuleService.clearOwner(ownerAddress);
        tradeExecutionService.clearOwner(ownerAddress);
        opportunityScannerService.clearOwner(ownerAddress);
        logger.info("Cleared automation data for {}", ownerAddress);
    }

    @PreDestroy
    public void clearAllData() {
        Map<String, ScheduledFuture<?>> running = new HashMap<>(schedules);
        running.keySet().forEach(this::stopAutomation);
        tradingRuleService.clearAll();
        tradeExecutionService.clearAll();
        opportunityScannerService.clearAll();
        logger.info("Cleared automation data for all owners");
    }
}
