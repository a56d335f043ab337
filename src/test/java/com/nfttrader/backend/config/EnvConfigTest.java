package com.nfttrader.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.StandardEnvironment;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class EnvConfigTest {

    @Test
    void dotenvPropertySource_shouldResolveDashedAndNestedPropertyNames() {
        StandardEnvironment environment = new StandardEnvironment();
        environment.getPropertySources().addFirst(EnvConfig.dotenvPropertySource(Map.of(
            "NFT_MARKET_DATA_MAX_CONCURRENT_REQUESTS", "4",
            "NFT_SCANNER_ARBITRAGE_COLLECTION_LIMIT", "25",
            "NFT_AUTOMATION_DEFAULT_INTERVAL_MINUTES", "5",
            "NFT_PROVIDERS_MARKET_DATA", "custom")));

        assertEquals("4", environment.getProperty("nft.market-data.max-concurrent-requests"));
        assertEquals("25", environment.getProperty("nft.scanner.arbitrage.collection-limit"));
        assertEquals("5", environment.getProperty("nft.automation.default-interval-minutes"));
        assertEquals("custom", environment.getProperty("nft.providers.market-data"));
        assertNull(environment.getProperty("nft.scanner.momentum.top-count"));
    }

    @Test
    void dotenvPropertySource_shouldOverrideApplicationProperties() {
        StandardEnvironment environment = new StandardEnvironment();
        environment.getPropertySources().addLast(new MapPropertySource("applicationProperties",
            Map.of("nft.rules.default-max-executions-per-day", "10")));
        environment.getPropertySources().addFirst(EnvConfig.dotenvPropertySource(Map.of(
            "NFT_RULES_DEFAULT_MAX_EXECUTIONS_PER_DAY", "3")));

        assertEquals("3", environment.getProperty("nft.rules.default-max-executions-per-day"));
    }
}
