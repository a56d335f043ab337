package com.nfttrader.backend.service;

import com.nfttrader.backend.config.CacheConfig;
import com.nfttrader.backend.config.SchedulerConfig;
import com.nfttrader.backend.exception.AssetNotFoundException;
import com.nfttrader.backend.exception.CollectionNotFoundException;
import com.nfttrader.backend.model.AssetInfo;
import com.nfttrader.backend.model.CollectionAnalytics;
import com.nfttrader.backend.model.CollectionStats;
import com.nfttrader.backend.model.MarketListing;
import com.nfttrader.backend.model.MarketOffer;
import com.nfttrader.backend.model.MarketSnapshot;
import com.nfttrader.backend.model.SaleRecord;
import com.nfttrader.backend.model.Valuation;
import com.nfttrader.backend.service.provider.MarketDataProvider;
import com.nfttrader.backend.service.util.ValuationMath;
import com.nfttrader.backend.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Item valuations and collection analytics derived from marketplace data.
 * Results are cached until {@link #clearCaches()} is called.
 */
@Service
public class ValuationService {

    private static final Logger logger = LoggerFactory.getLogger(ValuationService.class);

    static final Duration RECENT_SALE_WINDOW = Duration.ofDays(30);
    static final double WASH_TRADING_PLACEHOLDER = 10.0;

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final List<MarketDataProvider> providers;
    private final StateStore<String, Valuation> valuationStore;
    private final StateStore<String, CollectionAnalytics> collectionStore;
    private final ExecutorService marketDataExecutor;
    private final Clock clock;

    @Value("${nft.valuation.trade-history-limit:20}")
    private int tradeHistoryLimit = 20;

    @Autowired
    public ValuationService(
            List<MarketDataProvider> providers,
            @Qualifier(CacheConfig.VALUATION_STORE) StateStore<String, Valuation> valuationStore,
            @Qualifier(CacheConfig.COLLECTION_STORE) StateStore<String, CollectionAnalytics> collectionStore,
            @Qualifier(SchedulerConfig.MARKET_DATA_EXECUTOR) ExecutorService marketDataExecutor,
            Clock clock) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("At least one MarketDataProvider is required");
        }
        this.providers = providers;
        this.valuationStore = valuationStore;
        this.collectionStore = collectionStore;
        this.marketDataExecutor = marketDataExecutor;
        this.clock = clock;
    }

    // ============ ITEM VALUATION ============

    /**
     * Cached valuation of one item, computed on first request.
     *
     * @throws AssetNotFoundException if no market-data source knows the item
     */
    public Valuation getValuation(String contractAddress, String tokenId) {
        String cacheKey = Valuation.cacheKey(contractAddress, tokenId);
        Optional<Valuation> cached = valuationStore.get(cacheKey);
        if (cached.isPresent()) {
            return cached.get();
        }

        Valuation valuation = computeValuation(contractAddress, tokenId);
        valuationStore.set(cacheKey, valuation);
        return valuation;
    }

    /**
     * Fresh valuation from a new market snapshot. Does not touch the cache.
     */
    public Valuation computeValuation(String contractAddress, String tokenId) {
        try {
            return computeValuationAsync(contractAddress, tokenId).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * Non-blocking {@link #computeValuation}. Completes on a market-data thread once every
     * lookup has finished, or exceptionally with {@link AssetNotFoundException} for unknown items.
     */
    public CompletableFuture<Valuation> computeValuationAsync(String contractAddress, String tokenId) {
        return loadSnapshotAsync(contractAddress, tokenId)
            .thenApply(snapshot -> buildValuation(contractAddress, tokenId, snapshot));
    }

    Valuation buildValuation(String contractAddress, String tokenId, MarketSnapshot snapshot) {
        AssetInfo asset = snapshot.getAsset();
        List<BigDecimal> prices = snapshot.pricedSales();

        Valuation valuation = Valuation.builder()
            .contractAddress(contractAddress)
            .tokenId(tokenId)
            .currentFloorPrice(snapshot.getFloorPrice())
            .estimatedValue(calculateEstimatedValue(snapshot))
            .confidence(calculateConfidence(snapshot))
            .lastSalePrice(snapshot.getLastSalePrice())
            .lastSaleDate(snapshot.mostRecentSaleTime())
            .priceHistory(new ArrayList<>(snapshot.getPriceHistory()))
            .volatility(ValuationMath.volatility(prices))
            .liquidityScore(calculateLiquidityScore(contractAddress, snapshot.getListings().size()))
            .rarityScore(ValuationMath.rarityScore(asset.getRarity()))
            .marketSentiment(ValuationMath.sentiment(prices))
            .listingsCount(snapshot.getListings().size())
            .offersCount(snapshot.getOffers().size())
            .valuedAt(clock.instant())
            .build();

        logger.debug("Valued {}/{} at {} (confidence {}, liquidity {})", contractAddress, tokenId,
            valuation.getEstimatedValue(), valuation.getConfidence(), valuation.getLiquidityScore());
        return valuation;
    }

    /**
     * Gathers everything known about an item. Lookups across sources run concurrently;
     * a failing source contributes nothing instead of failing the snapshot.
     */
    CompletableFuture<MarketSnapshot> loadSnapshotAsync(String contractAddress, String tokenId) {
        MarketDataProvider primary = providers.get(0);

        List<CompletableFuture<Optional<AssetInfo>>> assetFutures = new ArrayList<>();
        List<CompletableFuture<List<MarketListing>>> listingFutures = new ArrayList<>();
        List<CompletableFuture<List<MarketOffer>>> offerFutures = new ArrayList<>();
        for (MarketDataProvider provider : providers) {
            String source = provider.getSourceName();
            assetFutures.add(fetch(() -> provider.getAsset(contractAddress, tokenId),
                Optional.empty(), "asset", source, contractAddress));
            listingFutures.add(fetch(() -> provider.getAssetListings(contractAddress, tokenId),
                Collections.emptyList(), "listings", source, contractAddress));
            offerFutures.add(fetch(() -> provider.getAssetOffers(contractAddress, tokenId),
                Collections.emptyList(), "offers", source, contractAddress));
        }
        CompletableFuture<BigDecimal> floorFuture = fetch(() -> primary.getFloorPrice(contractAddress),
            null, "floor price", primary.getSourceName(), contractAddress);
        CompletableFuture<List<SaleRecord>> tradesFuture = fetch(
            () -> primary.getAssetTrades(contractAddress, tokenId, tradeHistoryLimit),
            Collections.emptyList(), "trades", primary.getSourceName(), contractAddress);

        List<CompletableFuture<?>> all = new ArrayList<>();
        all.addAll(assetFutures);
        all.addAll(listingFutures);
        all.addAll(offerFutures);
        all.add(floorFuture);
        all.add(tradesFuture);
        return CompletableFuture.allOf(all.toArray(new CompletableFuture[0]))
            .thenApply(done -> assembleSnapshot(contractAddress, tokenId, assetFutures, listingFutures,
                offerFutures, floorFuture, tradesFuture));
    }

    // Only called once every future has completed, so the joins below never wait
    private MarketSnapshot assembleSnapshot(
            String contractAddress,
            String tokenId,
            List<CompletableFuture<Optional<AssetInfo>>> assetFutures,
            List<CompletableFuture<List<MarketListing>>> listingFutures,
            List<CompletableFuture<List<MarketOffer>>> offerFutures,
            CompletableFuture<BigDecimal> floorFuture,
            CompletableFuture<List<SaleRecord>> tradesFuture) {
        AssetInfo asset = assetFutures.stream()
            .map(CompletableFuture::join)
            .filter(Objects::nonNull)
            .filter(Optional::isPresent)
            .map(Optional::get)
            .findFirst()
            .orElseThrow(() -> new AssetNotFoundException(contractAddress, tokenId));

        MarketSnapshot.MarketSnapshotBuilder snapshot = MarketSnapshot.builder()
            .asset(asset)
            .floorPrice(floorFuture.join() != null ? floorFuture.join() : BigDecimal.ZERO)
            .lastSalePrice(asset.getLastSalePrice());
        List<SaleRecord> trades = tradesFuture.join();
        if (trades != null) {
            trades.stream().filter(Objects::nonNull).forEach(snapshot::sale);
        }
        listingFutures.forEach(f -> nullSafe(f.join()).forEach(snapshot::listing));
        offerFutures.forEach(f -> nullSafe(f.join()).forEach(snapshot::offer));
        return snapshot.build();
    }

    /**
     * Floor price, averaged with the last sale when that sale is recent, plus a rarity premium.
     */
    BigDecimal calculateEstimatedValue(MarketSnapshot snapshot) {
        BigDecimal value = snapshot.getFloorPrice() != null ? snapshot.getFloorPrice() : BigDecimal.ZERO;

        Instant lastSaleTime = snapshot.mostRecentSaleTime();
        if (snapshot.getLastSalePrice() != null && lastSaleTime != null
                && Duration.between(lastSaleTime, clock.instant()).compareTo(RECENT_SALE_WINDOW) < 0) {
            value = value.add(snapshot.getLastSalePrice()).divide(TWO, 8, RoundingMode.HALF_UP);
        }

        BigDecimal premium = ValuationMath.rarityPremium(snapshot.getAsset().getRarity());
        if (premium.compareTo(BigDecimal.ONE) != 0) {
            value = value.multiply(premium).setScale(8, RoundingMode.HALF_UP);
        }
        return value;
    }

    /**
     * 0.5 base plus 0.1 per supporting signal, capped at 1.
     */
    double calculateConfidence(MarketSnapshot snapshot) {
        AssetInfo asset = snapshot.getAsset();
        int signals = 0;
        if (snapshot.getLastSalePrice() != null) signals++;
        if (!snapshot.getPriceHistory().isEmpty()) signals++;
        if (asset.getRarity() != null && asset.getRarity() > 0) signals++;
        if (asset.hasTraits()) signals++;
        if (asset.getCollectionSupply() != null && asset.getCollectionSupply() > 100) signals++;

        return ValuationMath.clamp(0.5 + signals / 10.0, 0, 1);
    }

    double calculateLiquidityScore(String contractAddress, int listingsCount) {
        double score = 0;
        if (listingsCount >= 1) score += 20;
        if (listingsCount >= 3) score += 20;

        try {
            CollectionAnalytics collection = getCollectionAnalytics(contractAddress);
            if (collection.getVolume24h() != null && collection.getVolume24h().signum() != 0) score += 30;
            if (collection.getListingsCount() > 10) score += 20;
            if (collection.getHoldersCount() > 100) score += 10;
        } catch (Exception e) {
            logger.warn("Collection stats unavailable for liquidity of {}: {}", contractAddress, e.getMessage());
        }

        return ValuationMath.clamp(score, 0, 100);
    }

    // ============ COLLECTION ANALYTICS ============

    /**
     * Cached analytics for a collection.
     *
     * @throws CollectionNotFoundException if the primary source has no stats for it
     */
    public CollectionAnalytics getCollectionAnalytics(String contractAddress) {
        Optional<CollectionAnalytics> cached = collectionStore.get(contractAddress);
        if (cached.isPresent()) {
            return cached.get();
        }

        CollectionStats stats = providers.get(0).getCollectionStats(contractAddress)
            .orElseThrow(() -> new CollectionNotFoundException(contractAddress));

        CollectionAnalytics analytics = CollectionAnalytics.builder()
            .contractAddress(contractAddress)
            .name(stats.getName())
            .totalSupply(stats.getTotalSupply())
            .holdersCount(stats.getNumOwners())
            .floorPrice(orZero(stats.getFloorPrice()))
            .marketCap(orZero(stats.getMarketCap()))
            .volume24h(orZero(stats.getOneDayVolume()))
            .volume7d(orZero(stats.getSevenDayVolume()))
            .volume30d(orZero(stats.getThirtyDayVolume()))
            .change24h(stats.getOneDayChange())
            .change7d(stats.getSevenDayChange())
            .change30d(stats.getThirtyDayChange())
            .averagePrice(orZero(stats.getAveragePrice()))
            .sales24h(stats.getOneDaySales())
            .sales7d(stats.getSevenDaySales())
            .sales30d(stats.getThirtyDaySales())
            .listingsCount(stats.getListingsCount())
            .offersCount(stats.getOffersCount())
            .uniqueBuyers24h(0)     // needs per-trade data
            .uniqueSellers24h(0)
            .washTradingScore(calculateWashTradingScore(stats))
            .blueChipScore(calculateBlueChipScore(stats))
            .computedAt(clock.instant())
            .build();

        collectionStore.set(contractAddress, analytics);
        return analytics;
    }

    /**
     * Placeholder until trade-graph analysis exists: a fixed low score.
     */
    double calculateWashTradingScore(CollectionStats stats) {
        logger.debug("Wash trading score for {} uses the fixed placeholder", stats.getContractAddress());
        return WASH_TRADING_PLACEHOLDER;
    }

    double calculateBlueChipScore(CollectionStats stats) {
        double score = 0;

        BigDecimal marketCap = orZero(stats.getMarketCap());
        if (marketCap.compareTo(BigDecimal.valueOf(1_000_000)) > 0) score += 30;
        else if (marketCap.compareTo(BigDecimal.valueOf(100_000)) > 0) score += 20;

        if (stats.getNumOwners() > 1000) score += 25;
        else if (stats.getNumOwners() > 100) score += 15;

        BigDecimal volume = orZero(stats.getTotalVolume());
        if (volume.compareTo(BigDecimal.valueOf(100_000)) > 0) score += 25;
        else if (volume.compareTo(BigDecimal.valueOf(10_000)) > 0) score += 15;

        // Social proof
        if (stats.getTwitterUsername() != null && !stats.getTwitterUsername().isBlank()) score += 5;
        if (stats.getDiscordUrl() != null && !stats.getDiscordUrl().isBlank()) score += 5;

        return ValuationMath.clamp(score, 0, 100);
    }

    // ============ CACHE LIFECYCLE ============

    public void clearCaches() {
        valuationStore.clear();
        collectionStore.clear();
        logger.info("NFT valuation caches cleared");
    }

    public Map<String, Long> getCacheSizes() {
        Map<String, Long> sizes = new HashMap<>();
        sizes.put("valuations", valuationStore.size());
        sizes.put("collections", collectionStore.size());
        return sizes;
    }

    // ============ HELPERS ============

    private <T> CompletableFuture<T> fetch(Supplier<T> call, T fallback, String what, String source, String contractAddress) {
        return CompletableFuture.supplyAsync(call, marketDataExecutor)
            .exceptionally(e -> {
                logger.warn("Failed to fetch {} from {} for {}: {}", what, source, contractAddress,
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                return fallback;
            });
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
