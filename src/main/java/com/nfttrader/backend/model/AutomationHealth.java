package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationHealth {
    private String status;
    private Instant timestamp;
    private long activeRules;
    private long activeTrades;
    private long runningSchedules;
    private long cachedOpportunities;
    private long cachedValuations;
    private long cachedCollections;
}
