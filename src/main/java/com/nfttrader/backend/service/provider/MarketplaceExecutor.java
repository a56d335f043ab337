package com.nfttrader.backend.service.provider;

import com.nfttrader.backend.model.AutomatedTrade;
import com.nfttrader.backend.model.ExecutionReceipt;

/**
 * Places orders on a marketplace on behalf of an owner. Implementations throw
 * {@link com.nfttrader.backend.exception.RuleExecutionException} (or any runtime
 * exception) when the order cannot be placed.
 */
public interface MarketplaceExecutor {

    ExecutionReceipt submitBuy(String ownerAddress, AutomatedTrade trade);

    ExecutionReceipt submitSell(String ownerAddress, AutomatedTrade trade);

    ExecutionReceipt submitListing(String ownerAddress, AutomatedTrade trade);
}
