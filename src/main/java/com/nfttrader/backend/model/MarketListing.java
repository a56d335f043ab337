package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An active ask for one item on one marketplace.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketListing {
    private String marketplace;
    private String listingId;
    private String contractAddress;
    private String tokenId;
    private BigDecimal price;
    private String paymentToken;
    private String seller;
    private Instant listingTime;
    private Instant expirationTime;
}
