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
public class SaleRecord {
    private Instant timestamp;
    private BigDecimal price;
    private String paymentToken;
    private String marketplace;
    private String transactionHash;
}
