package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingAction {
    private ActionType type;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    private String marketplace;          // opensea, zora or auto
    private Double maxSlippage;
    private RiskLevel priority;          // execution urgency hint, reuses low/medium/high

    public String getStringParameter(String key) {
        Object value = parameters == null ? null : parameters.get(key);
        return value == null ? null : value.toString();
    }

    public BigDecimal getDecimalParameter(String key) {
        String value = getStringParameter(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
