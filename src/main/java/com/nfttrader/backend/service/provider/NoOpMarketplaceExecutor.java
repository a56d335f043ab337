package com.nfttrader.backend.service.provider;

import com.nfttrader.backend.exception.RuleExecutionException;
import com.nfttrader.backend.model.AutomatedTrade;
import com.nfttrader.backend.model.ExecutionReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects every order. Used when no marketplace execution integration is configured,
 * so automated rules never report trades that did not happen.
 */
public class NoOpMarketplaceExecutor implements MarketplaceExecutor {

    private static final Logger logger = LoggerFactory.getLogger(NoOpMarketplaceExecutor.class);

    public NoOpMarketplaceExecutor() {
        logger.info("No marketplace executor configured. Buy, sell and list actions will fail.");
    }

    @Override
    public ExecutionReceipt submitBuy(String ownerAddress, AutomatedTrade trade) {
        throw notConfigured(trade);
    }

    @Override
    public ExecutionReceipt submitSell(String ownerAddress, AutomatedTrade trade) {
        throw notConfigured(trade);
    }

    @Override
    public ExecutionReceipt submitListing(String ownerAddress, AutomatedTrade trade) {
        throw notConfigured(trade);
    }

    private RuleExecutionException notConfigured(AutomatedTrade trade) {
        return new RuleExecutionException("No marketplace executor configured for "
            + trade.getActionType().getValue() + " on " + trade.getContractAddress());
    }
}
