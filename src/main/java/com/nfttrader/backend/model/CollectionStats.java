package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Raw collection statistics as reported by a market-data source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CollectionStats {
    private String contractAddress;
    private String name;
    private int totalSupply;
    private int numOwners;
    private BigDecimal floorPrice;
    private BigDecimal marketCap;
    private BigDecimal totalVolume;
    private BigDecimal oneDayVolume;
    private BigDecimal sevenDayVolume;
    private BigDecimal thirtyDayVolume;
    private double oneDayChange;
    private double sevenDayChange;
    private double thirtyDayChange;
    private BigDecimal averagePrice;
    private int oneDaySales;
    private int sevenDaySales;
    private int thirtyDaySales;
    private int listingsCount;
    private int offersCount;
    private String twitterUsername;
    private String discordUrl;
}
