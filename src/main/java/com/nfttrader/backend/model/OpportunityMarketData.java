package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Market figures captured when an opportunity was discovered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpportunityMarketData {
    private BigDecimal floorPrice;
    private BigDecimal lastSalePrice;
    @Builder.Default
    private BigDecimal volume24h = BigDecimal.ZERO;
    private int listingsCount;
    private int offersCount;
}
