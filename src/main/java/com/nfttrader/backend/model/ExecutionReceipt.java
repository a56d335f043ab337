package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * What a marketplace executor reports back for a submitted order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionReceipt {
    private String transactionHash;
    private BigDecimal executedPrice;
    private BigDecimal profit;
    private BigDecimal gasCost;
}
