package com.nfttrader.backend.service;

import com.nfttrader.backend.model.OpportunityType;
import com.nfttrader.backend.model.TradingOpportunity;
import com.nfttrader.backend.service.events.TradingEvent;
import com.nfttrader.backend.service.events.TradingEventPublisher;
import com.nfttrader.backend.service.events.TradingEventType;
import com.nfttrader.backend.service.strategy.OpportunityStrategy;
import com.nfttrader.backend.store.CaffeineStateStore;
import com.nfttrader.backend.store.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class OpportunityScannerServiceTest {

    @Mock
    private OpportunityStrategy flipStrategy;

    @Mock
    private OpportunityStrategy arbitrageStrategy;

    private StateStore<String, List<TradingOpportunity>> opportunityStore;
    private List<TradingEvent> events;
    private OpportunityScannerService scannerService;

    @BeforeEach
    void setUp() {
        lenient().when(flipStrategy.getType()).thenReturn(OpportunityType.FLIP);
        lenient().when(flipStrategy.getName()).thenReturn("Flip");
        lenient().when(arbitrageStrategy.getType()).thenReturn(OpportunityType.ARBITRAGE);
        lenient().when(arbitrageStrategy.getName()).thenReturn("Arbitrage");

        opportunityStore = new CaffeineStateStore<>("opportunities");
        TradingEventPublisher publisher = new TradingEventPublisher(
            Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
        events = new ArrayList<>();
        publisher.subscribe(events::add);

        scannerService = new OpportunityScannerService(List.of(flipStrategy, arbitrageStrategy),
            opportunityStore, publisher);
    }

    @Test
    void getStrategies_shouldBeOrderedByOpportunityType() {
        assertEquals(List.of(OpportunityType.ARBITRAGE, OpportunityType.FLIP),
            scannerService.getStrategies().stream().map(OpportunityStrategy::getType).collect(Collectors.toList()));
    }

    @Test
    void scanOpportunities_shouldConcatenateResultsInStrategyOrder() {
        when(arbitrageStrategy.scan("0xowner")).thenReturn(List.of(opportunity("arb-1", OpportunityType.ARBITRAGE)));
        when(flipStrategy.scan("0xowner")).thenReturn(List.of(
            opportunity("flip-1", OpportunityType.FLIP), opportunity("flip-2", OpportunityType.FLIP)));

        List<TradingOpportunity> result = scannerService.scanOpportunities("0xowner");

        assertEquals(List.of("arb-1", "flip-1", "flip-2"),
            result.stream().map(TradingOpportunity::getId).collect(Collectors.toList()));
        assertEquals(result, scannerService.getOpportunities("0xowner"));
        assertEquals(3, scannerService.countOpportunities());

        assertEquals(1, events.size());
        assertEquals(TradingEventType.OPPORTUNITIES_SCANNED, events.get(0).getType());
        assertEquals(3, events.get(0).getPayload().get("count"));
    }

    @Test
    void scanOpportunities_shouldIsolateFailingStrategy() {
        when(arbitrageStrategy.scan("0xowner")).thenThrow(new IllegalStateException("marketplace down"));
        when(flipStrategy.scan("0xowner")).thenReturn(List.of(opportunity("flip-1", OpportunityType.FLIP)));

        List<TradingOpportunity> result = scannerService.scanOpportunities("0xowner");

        assertEquals(1, result.size());
        assertEquals("flip-1", result.get(0).getId());
    }

    @Test
    void scanOpportunities_shouldReplacePreviousResults() {
        when(arbitrageStrategy.scan("0xowner"))
            .thenReturn(List.of(opportunity("arb-1", OpportunityType.ARBITRAGE)))
            .thenReturn(List.of());
        when(flipStrategy.scan("0xowner")).thenReturn(List.of());

        scannerService.scanOpportunities("0xowner");
        scannerService.scanOpportunities("0xowner");

        assertTrue(scannerService.getOpportunities("0xowner").isEmpty());
    }

    @Test
    void getOpportunities_shouldBeEmptyBeforeFirstScanAndAfterClear() {
        assertTrue(scannerService.getOpportunities("0xowner").isEmpty());

        when(arbitrageStrategy.scan("0xowner")).thenReturn(List.of(opportunity("arb-1", OpportunityType.ARBITRAGE)));
        when(flipStrategy.scan("0xowner")).thenReturn(List.of());
        scannerService.scanOpportunities("0xowner");
        scannerService.clearOwner("0xowner");

        assertTrue(scannerService.getOpportunities("0xowner").isEmpty());
    }

    private TradingOpportunity opportunity(String id, OpportunityType type) {
        return TradingOpportunity.builder().id(id).type(type).contractAddress("0xc").build();
    }
}
