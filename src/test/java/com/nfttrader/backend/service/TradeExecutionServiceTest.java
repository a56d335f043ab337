package com.nfttrader.backend.service;

import com.nfttrader.backend.exception.RuleExecutionException;
import com.nfttrader.backend.model.ActionType;
import com.nfttrader.backend.model.AutomatedTrade;
import com.nfttrader.backend.model.ExecutionReceipt;
import com.nfttrader.backend.model.TradeStatus;
import com.nfttrader.backend.model.TradingAction;
import com.nfttrader.backend.service.events.TradingEvent;
import com.nfttrader.backend.service.events.TradingEventPublisher;
import com.nfttrader.backend.service.events.TradingEventType;
import com.nfttrader.backend.service.provider.MarketplaceExecutor;
import com.nfttrader.backend.store.CaffeineStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class TradeExecutionServiceTest {

    private static final String OWNER = "0xowner";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private MarketplaceExecutor marketplaceExecutor;

    private TradeExecutionService tradeExecutionService;
    private final List<TradingEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        TradingEventPublisher publisher = new TradingEventPublisher(clock);
        publisher.subscribe(events::add);
        tradeExecutionService = new TradeExecutionService(marketplaceExecutor, new CaffeineStateStore<>("trades"),
            publisher, clock);
    }

    @Test
    void execute_buyShouldCompleteWithReceipt() {
        when(marketplaceExecutor.submitBuy(eq(OWNER), any(AutomatedTrade.class)))
            .thenReturn(ExecutionReceipt.builder().transactionHash("0xhash").profit(new BigDecimal("0.2")).build());

        AutomatedTrade trade = tradeExecutionService.execute(OWNER, "rule-1", action(ActionType.BUY, "1.25"));

        assertEquals(TradeStatus.COMPLETED, trade.getStatus());
        assertEquals("0xhash", trade.getTransactionHash());
        assertEquals(NOW, trade.getExecutedAt());
        assertEquals(0, trade.getPrice().compareTo(new BigDecimal("1.25")));
        assertEquals("0xabc", trade.getContractAddress());
        assertEquals(List.of(TradingEventType.TRADE_EXECUTED), eventTypes());
        assertEquals(1, tradeExecutionService.getActiveTrades(OWNER).size());
    }

    @Test
    void execute_failedOrderShouldBeRecordedAndRethrown() {
        when(marketplaceExecutor.submitSell(eq(OWNER), any(AutomatedTrade.class)))
            .thenThrow(new RuleExecutionException("insufficient balance"));

        assertThrows(RuleExecutionException.class,
            () -> tradeExecutionService.execute(OWNER, "rule-1", action(ActionType.SELL, null)));

        AutomatedTrade trade = tradeExecutionService.getActiveTrades(OWNER).get(0);
        assertEquals(TradeStatus.FAILED, trade.getStatus());
        assertEquals("insufficient balance", trade.getError());
        assertEquals(NOW, trade.getExecutedAt());
        assertEquals(List.of(TradingEventType.TRADE_EXECUTED), eventTypes());
    }

    @Test
    void execute_unexpectedExecutorErrorShouldBeWrapped() {
        when(marketplaceExecutor.submitListing(eq(OWNER), any(AutomatedTrade.class)))
            .thenThrow(new IllegalStateException("timeout"));

        RuleExecutionException error = assertThrows(RuleExecutionException.class,
            () -> tradeExecutionService.execute(OWNER, "rule-1", action(ActionType.LIST, "3")));

        assertEquals("timeout", error.getMessage());
        assertEquals(TradeStatus.FAILED, tradeExecutionService.getActiveTrades(OWNER).get(0).getStatus());
    }

    @Test
    void execute_alertShouldPublishAndComplete() {
        AutomatedTrade trade = tradeExecutionService.execute(OWNER, "rule-1", action(ActionType.ALERT, null));

        assertEquals(TradeStatus.COMPLETED, trade.getStatus());
        assertEquals(List.of(TradingEventType.ALERT_TRIGGERED, TradingEventType.TRADE_EXECUTED), eventTypes());
        verifyNoInteractions(marketplaceExecutor);
    }

    @Test
    void execute_rebalanceShouldRequestRebalanceAndComplete() {
        AutomatedTrade trade = tradeExecutionService.execute(OWNER, "rule-1", action(ActionType.REBALANCE, null));

        assertEquals(TradeStatus.COMPLETED, trade.getStatus());
        assertEquals(TradingEventType.REBALANCE_REQUESTED, events.get(0).getType());
        assertEquals(OWNER, events.get(0).getOwnerAddress());
    }

    @Test
    void execute_actionsWithoutExecutorSupportShouldBeCancelled() {
        for (ActionType type : List.of(ActionType.UNLIST, ActionType.OFFER, ActionType.CANCEL_OFFER)) {
            AutomatedTrade trade = tradeExecutionService.execute(OWNER, "rule-1", action(type, null));

            assertEquals(TradeStatus.CANCELLED, trade.getStatus());
            assertEquals("No execution support for " + type.getValue() + " actions", trade.getError());
        }
        verifyNoInteractions(marketplaceExecutor);
    }

    @Test
    void execute_shouldFallBackToLimitPrice() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("contractAddress", "0xabc");
        parameters.put("maxPrice", "2.5");
        TradingAction action = TradingAction.builder().type(ActionType.ALERT).parameters(parameters).build();

        AutomatedTrade trade = tradeExecutionService.execute(OWNER, "rule-1", action);

        assertEquals(0, trade.getPrice().compareTo(new BigDecimal("2.5")));
        assertEquals("auto", trade.getMarketplace());
        assertNull(trade.getTokenId());
    }

    @Test
    void getTradesForRule_shouldFilterByRule() {
        tradeExecutionService.execute(OWNER, "rule-1", action(ActionType.ALERT, null));
        tradeExecutionService.execute(OWNER, "rule-2", action(ActionType.ALERT, null));

        assertEquals(1, tradeExecutionService.getTradesForRule(OWNER, "rule-2").size());
        assertEquals(2, tradeExecutionService.countTrades());

        tradeExecutionService.clearOwner(OWNER);
        assertEquals(0, tradeExecutionService.getActiveTrades(OWNER).size());
    }

    private TradingAction action(ActionType type, String price) {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("contractAddress", "0xabc");
        parameters.put("tokenId", "7");
        if (price != null) {
            parameters.put("price", price);
        }
        return TradingAction.builder().type(type).parameters(parameters).build();
    }

    private List<TradingEventType> eventTypes() {
        return events.stream().map(TradingEvent::getType).collect(Collectors.toList());
    }
}
