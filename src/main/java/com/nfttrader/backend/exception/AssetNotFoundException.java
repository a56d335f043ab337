package com.nfttrader.backend.exception;

public class AssetNotFoundException extends NftDataNotFoundException {

    public AssetNotFoundException(String contractAddress, String tokenId) {
        super("Asset not found: " + contractAddress + "/" + tokenId);
    }
}
