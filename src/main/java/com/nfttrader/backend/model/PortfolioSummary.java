package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioSummary {
    private String ownerAddress;
    @Builder.Default
    private BigDecimal totalValue = BigDecimal.ZERO;
    private int totalNfts;
    private int uniqueCollections;
    private double averageHoldingPeriod;
}
