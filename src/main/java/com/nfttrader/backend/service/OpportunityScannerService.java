package com.nfttrader.backend.service;

import com.nfttrader.backend.config.CacheConfig;
import com.nfttrader.backend.model.TradingOpportunity;
import com.nfttrader.backend.service.events.TradingEventPublisher;
import com.nfttrader.backend.service.events.TradingEventType;
import com.nfttrader.backend.service.strategy.OpportunityStrategy;
import com.nfttrader.backend.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs every opportunity strategy for an owner and keeps the latest results.
 */
@Service
public class OpportunityScannerService {

    private static final Logger logger = LoggerFactory.getLogger(OpportunityScannerService.class);

    private final List<OpportunityStrategy> strategies;
    private final StateStore<String, List<TradingOpportunity>> opportunityStore;
    private final TradingEventPublisher eventPublisher;

    @Autowired
    public OpportunityScannerService(
            List<OpportunityStrategy> strategies,
            @Qualifier(CacheConfig.OPPORTUNITY_STORE) StateStore<String, List<TradingOpportunity>> opportunityStore,
            TradingEventPublisher eventPublisher) {
        this.strategies = strategies.stream()
            .sorted(Comparator.comparing(OpportunityStrategy::getType))
            .collect(Collectors.toList());
        this.opportunityStore = opportunityStore;
        this.eventPublisher = eventPublisher;
        logger.info("Initialized {} opportunity strategies: {}", this.strategies.size(),
            this.strategies.stream().map(OpportunityStrategy::getName).collect(Collectors.joining(", ")));
    }

    /**
     * Scans with every strategy, replaces the owner's cached opportunities with the result
     * and returns it. A failing strategy contributes nothing.
     */
    public List<TradingOpportunity> scanOpportunities(String ownerAddress) {
        List<TradingOpportunity> opportunities = new ArrayList<>();
        for (OpportunityStrategy strategy : strategies) {
            try {
                List<TradingOpportunity> found = strategy.scan(ownerAddress);
                if (found != null) {
                    opportunities.addAll(found);
                }
            } catch (Exception e) {
                logger.error("Failed to scan {} opportunities for {}: {}", strategy.getType().getValue(),
                    ownerAddress, e.getMessage(), e);
            }
        }

        List<TradingOpportunity> result = Collections.unmodifiableList(opportunities);
        opportunityStore.set(ownerAddress, result);
        logger.info("Found {} opportunities for {}", result.size(), ownerAddress);
        eventPublisher.publish(TradingEventType.OPPORTUNITIES_SCANNED, ownerAddress,
            Map.of("count", result.size()));
        return result;
    }

    /**
     * Result of the owner's most recent scan; empty if none ran yet.
     */
    public List<TradingOpportunity> getOpportunities(String ownerAddress) {
        return opportunityStore.get(ownerAddress).orElse(Collections.emptyList());
    }

    public List<OpportunityStrategy> getStrategies() {
        return Collections.unmodifiableList(strategies);
    }

    public long countOpportunities() {
        return opportunityStore.values().stream().mapToLong(List::size).sum();
    }

    public void clearOwner(String ownerAddress) {
        opportunityStore.delete(ownerAddress);
    }

    public void clearAll() {
        opportunityStore.clear();
    }
}
