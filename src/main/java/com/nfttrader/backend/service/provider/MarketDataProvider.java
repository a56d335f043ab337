package com.nfttrader.backend.service.provider;

import com.nfttrader.backend.model.AssetInfo;
import com.nfttrader.backend.model.CollectionStats;
import com.nfttrader.backend.model.MarketListing;
import com.nfttrader.backend.model.MarketOffer;
import com.nfttrader.backend.model.SaleRecord;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Read access to one NFT marketplace. Implementations wrap a marketplace API
 * (OpenSea, Zora, ...); the first registered provider is treated as primary.
 */
public interface MarketDataProvider {

    /**
     * Short marketplace identifier, e.g. "opensea"
     */
    String getSourceName();

    /**
     * Resolves a single item, or empty when this source does not know it
     */
    Optional<AssetInfo> getAsset(String contractAddress, String tokenId);

    /**
     * Current collection floor, or null when unknown
     */
    BigDecimal getFloorPrice(String contractAddress);

    List<MarketListing> getAssetListings(String contractAddress, String tokenId);

    List<MarketOffer> getAssetOffers(String contractAddress, String tokenId);

    /**
     * Sale history of an item, most recent first
     */
    List<SaleRecord> getAssetTrades(String contractAddress, String tokenId, int limit);

    Optional<CollectionStats> getCollectionStats(String contractAddress);
}
