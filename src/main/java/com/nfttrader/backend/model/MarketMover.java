package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A collection among the top gainers or losers. {@code changePercent} is signed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketMover {
    private String contractAddress;
    private String name;
    private double changePercent;
    private BigDecimal floorPrice;
}
