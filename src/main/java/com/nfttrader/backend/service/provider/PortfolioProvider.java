package com.nfttrader.backend.service.provider;

import com.nfttrader.backend.model.PortfolioSummary;
import com.nfttrader.backend.model.Position;

import java.util.List;

public interface PortfolioProvider {

    List<Position> getPositions(String ownerAddress);

    PortfolioSummary getPortfolioSummary(String ownerAddress);
}
