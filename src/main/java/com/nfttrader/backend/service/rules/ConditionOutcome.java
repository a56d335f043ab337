package com.nfttrader.backend.service.rules;

/**
 * Result of evaluating one rule condition. Only {@link #SATISFIED} lets a rule fire.
 */
public enum ConditionOutcome {
    SATISFIED,
    NOT_SATISFIED,
    /** Condition type has no data source yet (volume, rarity, market sentiment). */
    UNSUPPORTED,
    /** Missing scope, non-numeric value or an operator/value mismatch. */
    MALFORMED,
    /** A collaborator failed while fetching the current value. */
    ERROR;

    public boolean isSatisfied() {
        return this == SATISFIED;
    }
}
