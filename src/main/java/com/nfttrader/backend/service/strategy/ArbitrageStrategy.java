package com.nfttrader.backend.service.strategy;

import com.nfttrader.backend.config.SchedulerConfig;
import com.nfttrader.backend.model.ActionType;
import com.nfttrader.backend.model.MarketListing;
import com.nfttrader.backend.model.OpportunityMarketData;
import com.nfttrader.backend.model.OpportunityType;
import com.nfttrader.backend.model.RiskLevel;
import com.nfttrader.backend.model.TimeHorizon;
import com.nfttrader.backend.model.TradingAction;
import com.nfttrader.backend.model.TradingOpportunity;
import com.nfttrader.backend.model.TrendingCollection;
import com.nfttrader.backend.service.provider.MarketDataProvider;
import com.nfttrader.backend.service.provider.MarketTrendsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Buys where the same item is listed noticeably cheaper on one marketplace than on another.
 */
@Component
public class ArbitrageStrategy implements OpportunityStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ArbitrageStrategy.class);

    static final BigDecimal MIN_SPREAD = new BigDecimal("0.05");
    static final BigDecimal MEDIUM_RISK_SPREAD = new BigDecimal("0.10");
    static final BigDecimal HIGH_RISK_SPREAD = new BigDecimal("0.20");
    // Share of the spread left after marketplace fees
    static final BigDecimal FEE_ADJUSTMENT = new BigDecimal("0.9");

    private final MarketTrendsProvider marketTrendsProvider;
    private final List<MarketDataProvider> marketDataProviders;
    private final ExecutorService marketDataExecutor;
    private final Clock clock;
    private final int collectionLimit;

    @Autowired
    public ArbitrageStrategy(
            MarketTrendsProvider marketTrendsProvider,
            List<MarketDataProvider> marketDataProviders,
            @Qualifier(SchedulerConfig.MARKET_DATA_EXECUTOR) ExecutorService marketDataExecutor,
            Clock clock,
            @Value("${nft.scanner.arbitrage.collection-limit:10}") int collectionLimit) {
        this.marketTrendsProvider = marketTrendsProvider;
        this.marketDataProviders = marketDataProviders;
        this.marketDataExecutor = marketDataExecutor;
        this.clock = clock;
        this.collectionLimit = collectionLimit;
    }

    @Override
    public OpportunityType getType() {
        return OpportunityType.ARBITRAGE;
    }

    @Override
    public String getName() {
        return "Cross-Marketplace Arbitrage";
    }

    @Override
    public String getDescription() {
        return "Compares listings of trending items across marketplaces and buys where the price spread exceeds 5%";
    }

    @Override
    public List<TradingOpportunity> scan(String ownerAddress) {
        List<TrendingCollection> collections = marketTrendsProvider.getTrendingCollections();
        if (collections == null || collections.isEmpty()) {
            return Collections.emptyList();
        }

        List<TradingOpportunity> opportunities = new ArrayList<>();
        for (TrendingCollection collection : collections.stream().limit(collectionLimit).collect(Collectors.toList())) {
            try {
                if (collection.getSampleTokenId() == null) {
                    continue;
                }
                List<MarketListing> listings = fetchListings(collection.getContractAddress(), collection.getSampleTokenId());
                TradingOpportunity opportunity = evaluate(collection, listings);
                if (opportunity != null) {
                    opportunities.add(opportunity);
                }
            } catch (Exception e) {
                logger.error("Failed to scan arbitrage for {}: {}", collection.getContractAddress(), e.getMessage());
            }
        }
        return opportunities;
    }

    /**
     * Listings for one item from every marketplace, requested concurrently. A failing
     * marketplace contributes no listings.
     */
    List<MarketListing> fetchListings(String contractAddress, String tokenId) {
        List<CompletableFuture<List<MarketListing>>> futures = marketDataProviders.stream()
            .map(provider -> CompletableFuture
                .supplyAsync(() -> provider.getAssetListings(contractAddress, tokenId), marketDataExecutor)
                .exceptionally(e -> {
                    logger.warn("Listings from {} unavailable for {}/{}: {}", provider.getSourceName(),
                        contractAddress, tokenId, e.getMessage());
                    return Collections.emptyList();
                }))
            .collect(Collectors.toList());

        List<MarketListing> listings = new ArrayList<>();
        for (CompletableFuture<List<MarketListing>> future : futures) {
            List<MarketListing> result = future.join();
            if (result != null) {
                listings.addAll(result);
            }
        }
        return listings;
    }

    TradingOpportunity evaluate(TrendingCollection collection, List<MarketListing> listings) {
        List<MarketListing> priced = listings.stream()
            .filter(listing -> listing.getPrice() != null && listing.getPrice().signum() > 0)
            .collect(Collectors.toList());
        if (priced.size() < 2) {
            return null;
        }

        MarketListing cheapest = priced.stream().min(Comparator.comparing(MarketListing::getPrice)).get();
        BigDecimal minPrice = cheapest.getPrice();
        BigDecimal maxPrice = priced.stream().map(MarketListing::getPrice).max(Comparator.naturalOrder()).get();

        BigDecimal difference = maxPrice.subtract(minPrice);
        BigDecimal spread = difference.divide(minPrice, 8, RoundingMode.HALF_UP);
        if (spread.compareTo(MIN_SPREAD) <= 0) {
            return null;
        }

        RiskLevel risk = spread.compareTo(HIGH_RISK_SPREAD) > 0 ? RiskLevel.HIGH
            : spread.compareTo(MEDIUM_RISK_SPREAD) > 0 ? RiskLevel.MEDIUM
            : RiskLevel.LOW;
        double spreadPercent = spread.doubleValue() * 100;

        List<String> reasoning = new ArrayList<>();
        reasoning.add(String.format(Locale.ROOT, "Price spread of %.1f%% between marketplaces", spreadPercent));
        reasoning.add(String.format(Locale.ROOT, "Buy at %.2f, sell at %.2f", minPrice, maxPrice));
        reasoning.add(String.format(Locale.ROOT, "Potential profit: %.2f", difference));

        Map<String, Object> parameters = new HashMap<>();
        parameters.put("contractAddress", collection.getContractAddress());
        parameters.put("tokenId", collection.getSampleTokenId());
        parameters.put("maxPrice", minPrice.toPlainString());
        parameters.put("marketplace", cheapest.getMarketplace());

        return TradingOpportunity.builder()
            .id("arbitrage-" + collection.getContractAddress() + "-" + clock.millis())
            .type(OpportunityType.ARBITRAGE)
            .contractAddress(collection.getContractAddress())
            .tokenId(collection.getSampleTokenId())
            .expectedReturn(difference.multiply(FEE_ADJUSTMENT))
            .confidence(Math.min(spreadPercent, 95))
            .riskLevel(risk)
            .timeHorizon(TimeHorizon.SHORT)
            .reasoning(reasoning)
            .suggestedAction(TradingAction.builder()
                .type(ActionType.BUY)
                .parameters(parameters)
                .marketplace("auto")
                .build())
            .marketData(OpportunityMarketData.builder()
                .floorPrice(minPrice)
                .listingsCount(priced.size())
                .offersCount(0)
                .build())
            .discoveredAt(clock.instant())
            .build();
    }
}
