package com.nfttrader.backend.service.events;

public enum TradingEventType {
    RULE_CREATED("rule:created"),
    RULE_UPDATED("rule:updated"),
    RULE_DELETED("rule:deleted"),
    RULE_EXECUTED("rule:executed"),
    TRADE_EXECUTED("trade:executed"),
    OPPORTUNITIES_SCANNED("opportunities:scanned"),
    AUTOMATION_CYCLE("automated:cycle"),
    REBALANCE_REQUESTED("rebalance:requested"),
    ALERT_TRIGGERED("alert:triggered");

    private final String value;

    TradingEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
