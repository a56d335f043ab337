package com.nfttrader.backend.service.provider;

import com.nfttrader.backend.model.PortfolioSummary;
import com.nfttrader.backend.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

public class NoOpPortfolioProvider implements PortfolioProvider {

    private static final Logger logger = LoggerFactory.getLogger(NoOpPortfolioProvider.class);

    public NoOpPortfolioProvider() {
        logger.info("No portfolio provider configured. Owners will appear to hold nothing.");
    }

    @Override
    public List<Position> getPositions(String ownerAddress) {
        return Collections.emptyList();
    }

    @Override
    public PortfolioSummary getPortfolioSummary(String ownerAddress) {
        return PortfolioSummary.builder().ownerAddress(ownerAddress).build();
    }
}
