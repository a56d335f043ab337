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
 * Buys into the collections with the strongest recent floor gains.
 */
@Component
public class MomentumStrategy implements OpportunityStrategy {

    static final BigDecimal EXPECTED_RETURN_RATIO = new BigDecimal("0.10");
    static final BigDecimal MAX_PRICE_RATIO = new BigDecimal("1.05");
    static final double HIGH_RISK_CHANGE = 50;

    private final MarketTrendsProvider marketTrendsProvider;
    private final Clock clock;
    private final int topCount;

    @Autowired
    public MomentumStrategy(
            MarketTrendsProvider marketTrendsProvider,
            Clock clock,
            @Value("${nft.scanner.momentum.top-count:3}") int topCount) {
        this.marketTrendsProvider = marketTrendsProvider;
        this.clock = clock;
        this.topCount = topCount;
    }

    @Override
    public OpportunityType getType() {
        return OpportunityType.MOMENTUM;
    }

    @Override
    public String getName() {
        return "Momentum";
    }

    @Override
    public String getDescription() {
        return "Buys the top gaining collections up to 5% above floor, expecting a further 10%";
    }

    @Override
    public List<TradingOpportunity> scan(String ownerAddress) {
        List<MarketMover> gainers = marketTrendsProvider.getTopGainers();
        if (gainers == null) {
            return Collections.emptyList();
        }

        List<TradingOpportunity> opportunities = new ArrayList<>();
        for (MarketMover gainer : gainers.subList(0, Math.min(topCount, gainers.size()))) {
            opportunities.add(toOpportunity(gainer));
        }
        return opportunities;
    }

    TradingOpportunity toOpportunity(MarketMover gainer) {
        BigDecimal floorPrice = gainer.getFloorPrice() != null ? gainer.getFloorPrice() : BigDecimal.ZERO;
        double change = gainer.getChangePercent();

        List<String> reasoning = new ArrayList<>();
        reasoning.add(String.format(Locale.ROOT, "Collection gained %.1f%% recently", change));
        reasoning.add("Strong upward momentum detected");
        reasoning.add("Floor price: " + floorPrice.toPlainString());

        Map<String, Object> parameters = new HashMap<>();
        parameters.put("contractAddress", gainer.getContractAddress());
        parameters.put("maxPrice", floorPrice.multiply(MAX_PRICE_RATIO).toPlainString());

        return TradingOpportunity.builder()
            .id("momentum-" + gainer.getContractAddress() + "-" + clock.millis())
            .type(OpportunityType.MOMENTUM)
            .contractAddress(gainer.getContractAddress())
            .expectedReturn(floorPrice.multiply(EXPECTED_RETURN_RATIO))
            .confidence(Math.min(change * 2, 85))
            .riskLevel(change > HIGH_RISK_CHANGE ? RiskLevel.HIGH : RiskLevel.MEDIUM)
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
