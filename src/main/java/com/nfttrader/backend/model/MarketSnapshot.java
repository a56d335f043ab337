package com.nfttrader.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable market view of one item, assembled once per valuation.
 * Price history is ordered most-recent-first.
 */
@Value
@Builder
public class MarketSnapshot {
    AssetInfo asset;
    BigDecimal floorPrice;
    BigDecimal lastSalePrice;
    @Singular("sale")
    List<SaleRecord> priceHistory;
    @Singular
    List<MarketListing> listings;
    @Singular
    List<MarketOffer> offers;

    /**
     * Prices of the recorded sales that carry a price, most-recent-first.
     */
    public List<BigDecimal> pricedSales() {
        return priceHistory.stream()
            .map(SaleRecord::getPrice)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    public Instant mostRecentSaleTime() {
        return priceHistory.isEmpty() ? null : priceHistory.get(0).getTimestamp();
    }
}
