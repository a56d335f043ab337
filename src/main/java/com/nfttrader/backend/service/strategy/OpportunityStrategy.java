package com.nfttrader.backend.service.strategy;

import com.nfttrader.backend.model.OpportunityType;
import com.nfttrader.backend.model.TradingOpportunity;

import java.util.List;

/**
 * A source of trading opportunities. Strategies are discovered from the Spring context
 * and run by the opportunity scanner in {@link OpportunityType} declaration order.
 */
public interface OpportunityStrategy {

    /**
     * The kind of opportunity this strategy produces. Also its unique id.
     */
    OpportunityType getType();

    String getName();

    /**
     * Gets the strategy description
     *
     * @return what the strategy looks for and how it scores it
     */
    String getDescription();

    /**
     * Looks for opportunities for one owner. Implementations skip items whose data cannot
     * be loaded; an exception means the whole strategy failed for this scan.
     *
     * @param ownerAddress wallet the scan runs for; only portfolio-based strategies use it
     * @return opportunities in discovery order, possibly empty
     */
    List<TradingOpportunity> scan(String ownerAddress);
}
