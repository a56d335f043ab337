package com.nfttrader.backend.service.strategy;

import com.nfttrader.backend.model.ActionType;
import com.nfttrader.backend.model.OpportunityMarketData;
import com.nfttrader.backend.model.OpportunityType;
import com.nfttrader.backend.model.Position;
import com.nfttrader.backend.model.RiskLevel;
import com.nfttrader.backend.model.TimeHorizon;
import com.nfttrader.backend.model.TradingAction;
import com.nfttrader.backend.model.TradingOpportunity;
import com.nfttrader.backend.model.Valuation;
import com.nfttrader.backend.service.ValuationService;
import com.nfttrader.backend.service.provider.PortfolioProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Sells recently acquired items that are now valued well above what was paid.
 */
@Component
public class FlipStrategy implements OpportunityStrategy {

    private static final Logger logger = LoggerFactory.getLogger(FlipStrategy.class);

    static final double MIN_MARGIN = 0.5;
    static final int MAX_HOLDING_DAYS = 30;
    static final int SHORT_HOLDING_DAYS = 7;
    static final BigDecimal SELL_SLIPPAGE = new BigDecimal("0.95");

    private final PortfolioProvider portfolioProvider;
    private final ValuationService valuationService;
    private final Clock clock;

    @Autowired
    public FlipStrategy(
            PortfolioProvider portfolioProvider,
            ValuationService valuationService,
            Clock clock) {
        this.portfolioProvider = portfolioProvider;
        this.valuationService = valuationService;
        this.clock = clock;
    }

    @Override
    public OpportunityType getType() {
        return OpportunityType.FLIP;
    }

    @Override
    public String getName() {
        return "Portfolio Flip";
    }

    @Override
    public String getDescription() {
        return "Sells positions held under 30 days whose current valuation is more than 50% above the acquisition price";
    }

    @Override
    public List<TradingOpportunity> scan(String ownerAddress) {
        List<Position> positions = portfolioProvider.getPositions(ownerAddress);
        if (positions == null || positions.isEmpty()) {
            return Collections.emptyList();
        }

        // Scan-time valuations are computed fresh and never cached
        List<CompletableFuture<Valuation>> valuations = new ArrayList<>();
        for (Position position : positions) {
            valuations.add(valuationService
                .computeValuationAsync(position.getContractAddress(), position.getTokenId())
                .exceptionally(e -> {
                    logger.error("Failed to value position {} ({}/{}): {}", position.getId(),
                        position.getContractAddress(), position.getTokenId(),
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                    return null;
                }));
        }

        List<TradingOpportunity> opportunities = new ArrayList<>();
        for (int i = 0; i < positions.size(); i++) {
            Valuation valuation = valuations.get(i).join();
            if (valuation != null) {
                TradingOpportunity opportunity = evaluate(positions.get(i), valuation);
                if (opportunity != null) {
                    opportunities.add(opportunity);
                }
            }
        }
        return opportunities;
    }

    TradingOpportunity evaluate(Position position, Valuation valuation) {
        BigDecimal acquisitionPrice = position.getAcquisitionPrice();
        BigDecimal currentValue = valuation.getEstimatedValue();
        if (acquisitionPrice == null || acquisitionPrice.signum() <= 0 || currentValue == null) {
            return null;
        }

        BigDecimal profit = currentValue.subtract(acquisitionPrice);
        double margin = profit.divide(acquisitionPrice, 8, RoundingMode.HALF_UP).doubleValue();
        if (margin <= MIN_MARGIN || position.getHoldingPeriod() >= MAX_HOLDING_DAYS) {
            return null;
        }

        List<String> reasoning = new ArrayList<>();
        reasoning.add("Held for " + position.getHoldingPeriod() + " days");
        reasoning.add(String.format(Locale.ROOT, "Current value: %.2f", currentValue));
        reasoning.add(String.format(Locale.ROOT, "Profit potential: %.1f%%", margin * 100));
        reasoning.add("Market sentiment: " + (valuation.getMarketSentiment() != null
            ? valuation.getMarketSentiment().getValue() : "neutral"));

        Map<String, Object> parameters = new HashMap<>();
        parameters.put("contractAddress", position.getContractAddress());
        parameters.put("tokenId", position.getTokenId());
        parameters.put("minPrice", currentValue.multiply(SELL_SLIPPAGE).toPlainString());

        return TradingOpportunity.builder()
            .id("flip-" + position.getContractAddress() + "-" + position.getTokenId())
            .type(OpportunityType.FLIP)
            .contractAddress(position.getContractAddress())
            .tokenId(position.getTokenId())
            .expectedReturn(profit)
            .confidence(Math.min(margin * 50, 90))
            .riskLevel(position.getHoldingPeriod() < SHORT_HOLDING_DAYS ? RiskLevel.HIGH : RiskLevel.MEDIUM)
            .timeHorizon(TimeHorizon.SHORT)
            .reasoning(reasoning)
            .suggestedAction(TradingAction.builder()
                .type(ActionType.SELL)
                .parameters(parameters)
                .marketplace("auto")
                .build())
            .marketData(OpportunityMarketData.builder()
                .floorPrice(valuation.getCurrentFloorPrice())
                .lastSalePrice(valuation.getLastSalePrice())
                .listingsCount(valuation.getListingsCount())
                .offersCount(valuation.getOffersCount())
                .build())
            .discoveredAt(clock.instant())
            .build();
    }
}
