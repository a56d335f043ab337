package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionAnalytics {
    private String contractAddress;
    private String name;
    private int totalSupply;
    private int holdersCount;
    private BigDecimal floorPrice;
    private BigDecimal marketCap;
    private BigDecimal volume24h;
    private BigDecimal volume7d;
    private BigDecimal volume30d;
    private double change24h;
    private double change7d;
    private double change30d;
    private BigDecimal averagePrice;
    private int sales24h;
    private int sales7d;
    private int sales30d;
    private int listingsCount;
    private int offersCount;
    private int uniqueBuyers24h;
    private int uniqueSellers24h;
    private double washTradingScore;     // 0..100, higher = more wash trading
    private double blueChipScore;        // 0..100, higher = more established
    private Instant computedAt;
}
