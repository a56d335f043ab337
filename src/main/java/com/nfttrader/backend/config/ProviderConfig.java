package com.nfttrader.backend.config;

import com.nfttrader.backend.service.provider.MarketDataProvider;
import com.nfttrader.backend.service.provider.MarketTrendsProvider;
import com.nfttrader.backend.service.provider.MarketplaceExecutor;
import com.nfttrader.backend.service.provider.NoOpMarketDataProvider;
import com.nfttrader.backend.service.provider.NoOpMarketTrendsProvider;
import com.nfttrader.backend.service.provider.NoOpMarketplaceExecutor;
import com.nfttrader.backend.service.provider.NoOpPortfolioProvider;
import com.nfttrader.backend.service.provider.PortfolioProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback collaborators for deployments without marketplace integrations. A host that
 * ships its own beans sets the matching {@code nft.providers.*} property to its name.
 */
@Configuration
public class ProviderConfig {

    @Bean
    @ConditionalOnProperty(name = "nft.providers.market-data", havingValue = "none", matchIfMissing = true)
    public MarketDataProvider noOpMarketDataProvider() {
        return new NoOpMarketDataProvider();
    }

    @Bean
    @ConditionalOnProperty(name = "nft.providers.portfolio", havingValue = "none", matchIfMissing = true)
    public PortfolioProvider noOpPortfolioProvider() {
        return new NoOpPortfolioProvider();
    }

    @Bean
    @ConditionalOnProperty(name = "nft.providers.market-trends", havingValue = "none", matchIfMissing = true)
    public MarketTrendsProvider noOpMarketTrendsProvider() {
        return new NoOpMarketTrendsProvider();
    }

    @Bean
    @ConditionalOnProperty(name = "nft.providers.executor", havingValue = "none", matchIfMissing = true)
    public MarketplaceExecutor noOpMarketplaceExecutor() {
        return new NoOpMarketplaceExecutor();
    }
}
