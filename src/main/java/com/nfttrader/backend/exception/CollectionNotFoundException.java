package com.nfttrader.backend.exception;

public class CollectionNotFoundException extends NftDataNotFoundException {

    public CollectionNotFoundException(String contractAddress) {
        super("Collection not found: " + contractAddress);
    }
}
