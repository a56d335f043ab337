package com.nfttrader.backend.service.provider;

import com.nfttrader.backend.model.MarketMover;
import com.nfttrader.backend.model.TrendingCollection;

import java.util.Collections;
import java.util.List;

/**
 * Market-wide aggregates. All methods are best effort.
 */
public interface MarketTrendsProvider {

    /**
     * Collections with the largest recent floor gains, strongest first
     */
    List<MarketMover> getTopGainers();

    /**
     * Collections with the largest recent floor declines, steepest first
     */
    List<MarketMover> getTopLosers();

    /**
     * Collections worth checking for cross-marketplace spreads. Aggregating trending
     * collections needs market-wide volume data that no source provides yet, so the
     * default is empty.
     */
    default List<TrendingCollection> getTrendingCollections() {
        return Collections.emptyList();
    }
}
