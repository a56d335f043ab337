package com.nfttrader.backend.service.provider;

import com.nfttrader.backend.model.AssetInfo;
import com.nfttrader.backend.model.CollectionStats;
import com.nfttrader.backend.model.MarketListing;
import com.nfttrader.backend.model.MarketOffer;
import com.nfttrader.backend.model.SaleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Registered when the host supplies no marketplace integration. Resolves nothing,
 * so every valuation ends in a not-found error.
 */
public class NoOpMarketDataProvider implements MarketDataProvider {

    private static final Logger logger = LoggerFactory.getLogger(NoOpMarketDataProvider.class);

    public NoOpMarketDataProvider() {
        logger.info("No marketplace data provider configured. Valuations will not resolve any asset.");
    }

    @Override
    public String getSourceName() {
        return "none";
    }

    @Override
    public Optional<AssetInfo> getAsset(String contractAddress, String tokenId) {
        logger.debug("No-op: getAsset called for {}/{}", contractAddress, tokenId);
        return Optional.empty();
    }

    @Override
    public BigDecimal getFloorPrice(String contractAddress) {
        return null;
    }

    @Override
    public List<MarketListing> getAssetListings(String contractAddress, String tokenId) {
        return Collections.emptyList();
    }

    @Override
    public List<MarketOffer> getAssetOffers(String contractAddress, String tokenId) {
        return Collections.emptyList();
    }

    @Override
    public List<SaleRecord> getAssetTrades(String contractAddress, String tokenId, int limit) {
        return Collections.emptyList();
    }

    @Override
    public Optional<CollectionStats> getCollectionStats(String contractAddress) {
        return Optional.empty();
    }
}
