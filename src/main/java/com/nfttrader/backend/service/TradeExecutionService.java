package com.nfttrader.backend.service;

import com.nfttrader.backend.config.CacheConfig;
import com.nfttrader.backend.exception.RuleExecutionException;
import com.nfttrader.backend.model.AutomatedTrade;
import com.nfttrader.backend.model.ExecutionReceipt;
import com.nfttrader.backend.model.TradingAction;
import com.nfttrader.backend.service.events.TradingEventPublisher;
import com.nfttrader.backend.service.events.TradingEventType;
import com.nfttrader.backend.service.provider.MarketplaceExecutor;
import com.nfttrader.backend.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Turns rule actions into trade records and carries them to a terminal status.
 */
@Service
public class TradeExecutionService {

    private static final Logger logger = LoggerFactory.getLogger(TradeExecutionService.class);

    private final MarketplaceExecutor marketplaceExecutor;
    private final StateStore<String, List<AutomatedTrade>> tradeStore;
    private final TradingEventPublisher eventPublisher;
    private final Clock clock;

    @Autowired
    public TradeExecutionService(
            MarketplaceExecutor marketplaceExecutor,
            @Qualifier(CacheConfig.TRADE_STORE) StateStore<String, List<AutomatedTrade>> tradeStore,
            TradingEventPublisher eventPublisher,
            Clock clock) {
        this.marketplaceExecutor = marketplaceExecutor;
        this.tradeStore = tradeStore;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Records a trade for the action and executes it.
     *
     * @return the trade in its terminal state
     * @throws RuleExecutionException if the marketplace rejected the order; the trade is
     *         recorded as FAILED before the exception is thrown
     */
    public AutomatedTrade execute(String ownerAddress, String ruleId, TradingAction action) {
        if (action == null || action.getType() == null) {
            throw new IllegalArgumentException("Trading action type is required");
        }

        AutomatedTrade trade = AutomatedTrade.builder()
            .id("trade-" + UUID.randomUUID())
            .ruleId(ruleId)
            .actionType(action.getType())
            .contractAddress(action.getStringParameter("contractAddress"))
            .tokenId(action.getStringParameter("tokenId"))
            .price(resolvePrice(action))
            .marketplace(action.getMarketplace())
            .createdAt(clock.instant())
            .metadata(action.getParameters())
            .build();

        tradeStore.getOrCreate(ownerAddress, key -> new CopyOnWriteArrayList<>()).add(trade);
        trade.markExecuting();

        try {
            switch (action.getType()) {
                case BUY:
                    trade.markCompleted(clock.instant(), marketplaceExecutor.submitBuy(ownerAddress, trade));
                    break;
                case SELL:
                    trade.markCompleted(clock.instant(), marketplaceExecutor.submitSell(ownerAddress, trade));
                    break;
                case LIST:
                    trade.markCompleted(clock.instant(), marketplaceExecutor.submitListing(ownerAddress, trade));
                    break;
                case REBALANCE:
                    eventPublisher.publish(TradingEventType.REBALANCE_REQUESTED, ownerAddress,
                        Map.of("ruleId", String.valueOf(ruleId), "parameters", trade.getMetadata()));
                    trade.markCompleted(clock.instant(), null);
                    break;
                case ALERT:
                    eventPublisher.publish(TradingEventType.ALERT_TRIGGERED, ownerAddress, tradePayload(trade));
                    trade.markCompleted(clock.instant(), null);
                    break;
                case UNLIST:
                case OFFER:
                case CANCEL_OFFER:
                default:
                    trade.markCancelled(clock.instant(),
                        "No execution support for " + action.getType().getValue() + " actions");
                    break;
            }
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            trade.markFailed(clock.instant(), message);
            logger.error("Trade {} ({}) for {} failed: {}", trade.getId(), action.getType().getValue(),
                ownerAddress, message);
            eventPublisher.publish(TradingEventType.TRADE_EXECUTED, ownerAddress, tradePayload(trade));
            throw e instanceof RuleExecutionException
                ? (RuleExecutionException) e
                : new RuleExecutionException(message, e);
        }

        logger.info("Trade {} ({}) for {} ended {}", trade.getId(), action.getType().getValue(),
            ownerAddress, trade.getStatus().getValue());
        eventPublisher.publish(TradingEventType.TRADE_EXECUTED, ownerAddress, tradePayload(trade));
        return trade;
    }

    /**
     * Every trade recorded for the owner, in dispatch order.
     */
    public List<AutomatedTrade> getActiveTrades(String ownerAddress) {
        return tradeStore.get(ownerAddress)
            .<List<AutomatedTrade>>map(ArrayList::new)
            .orElse(Collections.emptyList());
    }

    public List<AutomatedTrade> getTradesForRule(String ownerAddress, String ruleId) {
        List<AutomatedTrade> trades = new ArrayList<>();
        for (AutomatedTrade trade : getActiveTrades(ownerAddress)) {
            if (ruleId.equals(trade.getRuleId())) {
                trades.add(trade);
            }
        }
        return trades;
    }

    public long countTrades() {
        return tradeStore.values().stream().mapToLong(List::size).sum();
    }

    public void clearOwner(String ownerAddress) {
        tradeStore.delete(ownerAddress);
    }

    public void clearAll() {
        tradeStore.clear();
    }

    /**
     * Explicit price first, then the limit prices that suggested actions carry.
     */
    private BigDecimal resolvePrice(TradingAction action) {
        for (String key : new String[] {"price", "maxPrice", "minPrice"}) {
            BigDecimal price = action.getDecimalParameter(key);
            if (price != null) {
                return price;
            }
        }
        return BigDecimal.ZERO;
    }

    private Map<String, Object> tradePayload(AutomatedTrade trade) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("trade", trade);
        payload.put("ruleId", trade.getRuleId());
        payload.put("status", trade.getStatus().getValue());
        return payload;
    }
}
