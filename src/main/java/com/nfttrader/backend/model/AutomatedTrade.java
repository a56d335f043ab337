package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A trade dispatched by a rule. Identity fields are fixed at creation; only the
 * status and the fields written on a terminal transition change afterwards.
 */
@Getter
public class AutomatedTrade {
    private final String id;
    private final String ruleId;
    private final ActionType actionType;
    private final String contractAddress;
    private final String tokenId;
    private final BigDecimal price;
    private final String marketplace;
    private final Instant createdAt;
    private final Map<String, Object> metadata;

    private volatile TradeStatus status;
    private volatile Instant executedAt;
    private volatile BigDecimal profit;
    private volatile String transactionHash;
    private volatile String error;

    @Builder
    private AutomatedTrade(String id, String ruleId, ActionType actionType, String contractAddress,
                           String tokenId, BigDecimal price, String marketplace, Instant createdAt,
                           Map<String, Object> metadata) {
        this.id = id;
        this.ruleId = ruleId;
        this.actionType = actionType;
        this.contractAddress = contractAddress;
        this.tokenId = tokenId;
        this.price = price != null ? price : BigDecimal.ZERO;
        this.marketplace = marketplace != null ? marketplace : "auto";
        this.createdAt = createdAt;
        this.metadata = metadata != null ? Collections.unmodifiableMap(new HashMap<>(metadata)) : Collections.emptyMap();
        this.status = TradeStatus.PENDING;
    }

    public synchronized void markExecuting() {
        requireOpen();
        this.status = TradeStatus.EXECUTING;
    }

    public synchronized void markCompleted(Instant at, ExecutionReceipt receipt) {
        requireOpen();
        if (receipt != null) {
            this.transactionHash = receipt.getTransactionHash();
            this.profit = receipt.getProfit();
        }
        this.executedAt = at;
        this.status = TradeStatus.COMPLETED;
    }

    public synchronized void markFailed(Instant at, String error) {
        requireOpen();
        this.error = error != null ? error : "Unknown error";
        this.executedAt = at;
        this.status = TradeStatus.FAILED;
    }

    public synchronized void markCancelled(Instant at, String reason) {
        requireOpen();
        this.error = reason;
        this.executedAt = at;
        this.status = TradeStatus.CANCELLED;
    }

    @JsonIgnore
    public BigDecimal getProfitOrZero() {
        return profit != null ? profit : BigDecimal.ZERO;
    }

    private void requireOpen() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Trade " + id + " is already " + status.getValue());
        }
    }
}
