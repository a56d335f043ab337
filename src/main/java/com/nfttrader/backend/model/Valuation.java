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
public class Valuation {
    private String contractAddress;
    private String tokenId;
    private BigDecimal currentFloorPrice;
    private BigDecimal estimatedValue;
    private double confidence;           // 0..1
    private BigDecimal lastSalePrice;
    private Instant lastSaleDate;
    @Builder.Default
    private List<SaleRecord> priceHistory = new ArrayList<>();
    private double volatility;
    private double liquidityScore;       // 0..100
    private double rarityScore;          // 0..100
    private MarketSentiment marketSentiment;
    private int listingsCount;
    private int offersCount;
    private Instant valuedAt;

    public static String cacheKey(String contractAddress, String tokenId) {
        return contractAddress + "-" + tokenId;
    }
}
