package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An NFT held in an owner's portfolio.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Position {
    private String id;
    private String contractAddress;
    private String tokenId;
    private String name;
    private String marketplace;
    private Instant acquisitionDate;
    private BigDecimal acquisitionPrice;
    private String acquisitionCurrency;
    private int holdingPeriod;           // days
}
