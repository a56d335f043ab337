package com.nfttrader.backend.exception;

/**
 * A marketplace executor rejected or failed to carry out a trading action.
 */
public class RuleExecutionException extends RuntimeException {

    public RuleExecutionException(String message) {
        super(message);
    }

    public RuleExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
