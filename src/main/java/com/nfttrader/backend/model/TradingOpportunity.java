package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingOpportunity {
    private String id;
    private OpportunityType type;
    private String contractAddress;
    private String tokenId;
    private BigDecimal expectedReturn;
    private double confidence;           // 0..100
    private RiskLevel riskLevel;
    private TimeHorizon timeHorizon;

    @Builder.Default
    private List<String> reasoning = new ArrayList<>();

    private TradingAction suggestedAction;
    private OpportunityMarketData marketData;
    private Instant discoveredAt;
}
