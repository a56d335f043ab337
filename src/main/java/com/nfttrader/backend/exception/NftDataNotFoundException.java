package com.nfttrader.backend.exception;

/**
 * No market data could be resolved for the requested item or collection.
 */
public class NftDataNotFoundException extends RuntimeException {

    public NftDataNotFoundException(String message) {
        super(message);
    }
}
