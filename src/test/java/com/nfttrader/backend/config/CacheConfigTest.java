package com.nfttrader.backend.config;

import com.nfttrader.backend.model.TradingRule;
import com.nfttrader.backend.model.Valuation;
import com.nfttrader.backend.store.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.caffeine.CaffeineCacheManager;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CacheConfigTest {

    private CacheConfig cacheConfig;
    private CaffeineCacheManager cacheManager;

    @BeforeEach
    void setUp() {
        cacheConfig = new CacheConfig();
        cacheManager = cacheConfig.cacheManager();
    }

    @Test
    void cacheManager_shouldRegisterEveryStore() {
        assertTrue(cacheManager.getCacheNames().containsAll(List.of(CacheConfig.VALUATION_STORE,
            CacheConfig.COLLECTION_STORE, CacheConfig.RULE_STORE, CacheConfig.TRADE_STORE,
            CacheConfig.OPPORTUNITY_STORE)));
    }

    @Test
    void valuationStore_shouldShareEntriesWithManagedCache() {
        StateStore<String, Valuation> store = cacheConfig.valuationStore(cacheManager);
        Valuation valuation = Valuation.builder().estimatedValue(new BigDecimal("110")).build();

        store.set("0xabc-42", valuation);

        assertEquals(CacheConfig.VALUATION_STORE, store.getName());
        assertNotNull(cacheManager.getCache(CacheConfig.VALUATION_STORE).get("0xabc-42"));

        cacheManager.getCache(CacheConfig.VALUATION_STORE).clear();
        assertTrue(store.get("0xabc-42").isEmpty());
    }

    @Test
    void stores_shouldBeIsolatedFromEachOther() {
        StateStore<String, List<TradingRule>> rules = cacheConfig.tradingRuleStore(cacheManager);
        rules.set("0xowner", List.of());

        assertNull(cacheManager.getCache(CacheConfig.OPPORTUNITY_STORE).get("0xowner"));
        assertEquals(1, rules.size());
    }
}
