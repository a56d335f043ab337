package com.nfttrader.backend.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.nfttrader.backend.model.AutomatedTrade;
import com.nfttrader.backend.model.CollectionAnalytics;
import com.nfttrader.backend.model.TradingOpportunity;
import com.nfttrader.backend.model.TradingRule;
import com.nfttrader.backend.model.Valuation;
import com.nfttrader.backend.store.CaffeineStateStore;
import com.nfttrader.backend.store.StateStore;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Process-wide state stores, each a named cache of the Caffeine cache manager. Valuation
 * and collection entries live until an explicit cache clear; per-owner entries live until
 * the owner's data is cleared. No cache expires or evicts on its own.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String VALUATION_STORE = "valuationStore";
    public static final String COLLECTION_STORE = "collectionAnalyticsStore";
    public static final String RULE_STORE = "tradingRuleStore";
    public static final String TRADE_STORE = "tradeLogStore";
    public static final String OPPORTUNITY_STORE = "opportunityStore";

    @Bean
    public CaffeineCacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setAllowNullValues(false);
        cacheManager.registerCustomCache(VALUATION_STORE, Caffeine.newBuilder().initialCapacity(256).build());
        cacheManager.registerCustomCache(COLLECTION_STORE, Caffeine.newBuilder().initialCapacity(64).build());
        // Keyed by owner address
        cacheManager.registerCustomCache(RULE_STORE, Caffeine.newBuilder().initialCapacity(64).build());
        cacheManager.registerCustomCache(TRADE_STORE, Caffeine.newBuilder().initialCapacity(64).build());
        cacheManager.registerCustomCache(OPPORTUNITY_STORE, Caffeine.newBuilder().initialCapacity(64).build());
        return cacheManager;
    }

    @Bean(VALUATION_STORE)
    public StateStore<String, Valuation> valuationStore(CaffeineCacheManager cacheManager) {
        return store(cacheManager, VALUATION_STORE);
    }

    @Bean(COLLECTION_STORE)
    public StateStore<String, CollectionAnalytics> collectionAnalyticsStore(CaffeineCacheManager cacheManager) {
        return store(cacheManager, COLLECTION_STORE);
    }

    @Bean(RULE_STORE)
    public StateStore<String, List<TradingRule>> tradingRuleStore(CaffeineCacheManager cacheManager) {
        return store(cacheManager, RULE_STORE);
    }

    @Bean(TRADE_STORE)
    public StateStore<String, List<AutomatedTrade>> tradeLogStore(CaffeineCacheManager cacheManager) {
        return store(cacheManager, TRADE_STORE);
    }

    @Bean(OPPORTUNITY_STORE)
    public StateStore<String, List<TradingOpportunity>> opportunityStore(CaffeineCacheManager cacheManager) {
        return store(cacheManager, OPPORTUNITY_STORE);
    }

    private static <V> StateStore<String, V> store(CaffeineCacheManager cacheManager, String name) {
        return new CaffeineStateStore<>((CaffeineCache) cacheManager.getCache(name));
    }
}
