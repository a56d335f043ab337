package com.nfttrader.backend.exception;

public class RuleNotFoundException extends RuntimeException {

    public RuleNotFoundException(String ownerAddress, String ruleId) {
        super("Rule " + ruleId + " not found for owner " + ownerAddress);
    }
}
