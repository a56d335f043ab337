package com.nfttrader.backend.service.provider;

import com.nfttrader.backend.model.MarketMover;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Market trends need aggregation over many collections; until a source provides it,
 * gainers and losers are empty.
 */
public class NoOpMarketTrendsProvider implements MarketTrendsProvider {

    private static final Logger logger = LoggerFactory.getLogger(NoOpMarketTrendsProvider.class);

    @Override
    public List<MarketMover> getTopGainers() {
        logger.debug("No-op: market trends require market-wide data aggregation");
        return Collections.emptyList();
    }

    @Override
    public List<MarketMover> getTopLosers() {
        return Collections.emptyList();
    }
}
