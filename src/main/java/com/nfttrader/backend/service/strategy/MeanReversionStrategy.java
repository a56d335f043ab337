package com.nfttrader.backend.service.strategy;

import com.nfttrader.backend.model.ActionType;
import com.nfttrader.backend.model.MarketMover;
import com.nfttrader.backend.model.OpportunityMarketData;
import com.nfttrader.backend.model.OpportunityType;
import com.nfttrader.backend.model.RiskLevel;
import com.nfttrader.backend.model.TimeHorizon;
import com.nfttrader.backend.model.TradingAction;
import com.nfttrader.backend.model.TradingOpportunity;
import com.nfttrader.backend.service.provider.MarketTrendsProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Buys collections that dropped sharply, at a discount to floor, expecting a rebound.
 */
@Component
public class MeanReversionStrategy implements OpportunityStrategy {

    static final double MIN_DECLINE = 20;
    static final BigDecimal EXPECTED_REBOUND = new BigDecimal("0.15");
    static final BigDecimal ENTRY_DISCOUNT = new BigDecimal("0.9");

    private final MarketTrendsProvider marketTrendsProvider;
    private final Clock clock;
    private final int topCount;

    @Autowired
    public MeanReversionStrategy(
            MarketTrendsProvider marketTrendsProvider,
            Clock clock,
            @Value("${nft.scanner.mean-reversion.top-count:3}") int topCount) {
        this.marketTrendsProvider = marketTrendsProvider;
        this.clock = clock;
        this.topCount = topCount;
    }

    @Override
    public OpportunityType getType() {
        return OpportunityType.MEAN_REVERSION;
    }

    @Override
    public String getName() {
        return "Mean Reversion";
    }

    @Override
    public String getDescription() {
        return "Buys top losing collections that declined more than 20% at 10% below floor";
    }

    @Override
    public List<TradingOpportunity> scan(String ownerAddress) {
        List<MarketMover> losers = marketTrendsProvider.getTopLosers();
        if (losers == null) {
            return Collections.emptyList();
        }

        List<TradingOpportunity> opportunities = new ArrayList<>();
        for (MarketMover loser : losers.subList(0, Math.min(topCount, losers.size()))) {
            double decline = Math.abs(loser.getChangePercent());
            if (decline > MIN_DECLINE) {
                opportunities.add(toOpportunity(loser, decline));
            }
        }
        return opportunities;
    }

    TradingOpportunity toOpportunity(MarketMover loser, double decline) {
        BigDecimal floorPrice = loser.getFloorPrice() != null ? loser.getFloorPrice() : BigDecimal.ZERO;

        List<String> reasoning = new ArrayList<>();
        reasoning.add(String.format(Locale.ROOT, "Collection declined %.1f%% recently", decline));
        reasoning.add("Potential mean reversion opportunity");
        reasoning.add("Floor price: " + floorPrice.toPlainString());

        Map<String, Object> parameters = new HashMap<>();
        parameters.put("contractAddress", loser.getContractAddress());
        parameters.put("maxPrice", floorPrice.multiply(ENTRY_DISCOUNT).toPlainString());

        return TradingOpportunity.builder()
            .id("mean-reversion-" + loser.getContractAddress() + "-" + clock.millis())
            .type(OpportunityType.MEAN_REVERSION)
            .contractAddress(loser.getContractAddress())
            .expectedReturn(floorPrice.multiply(EXPECTED_REBOUND))
            .confidence(Math.min(decline, 80))
            .riskLevel(RiskLevel.MEDIUM)
            .timeHorizon(TimeHorizon.MEDIUM)
            .reasoning(reasoning)
            .suggestedAction(TradingAction.builder()
                .type(ActionType.BUY)
                .parameters(parameters)
                .marketplace("auto")
                .build())
            .marketData(OpportunityMarketData.builder()
                .floorPrice(floorPrice)
                .build())
            .discoveredAt(clock.instant())
            .build();
    }
}
