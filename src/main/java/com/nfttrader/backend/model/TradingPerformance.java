package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Aggregate results over an owner's completed trades.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingPerformance {
    private String ownerAddress;
    private int totalTrades;
    private int successfulTrades;
    private BigDecimal totalProfit;
    private double winRate;              // percentage
    private BigDecimal averageProfit;
    private BigDecimal bestTrade;
    private BigDecimal worstTrade;
}
