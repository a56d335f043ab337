package com.nfttrader.backend.service.rules;

import com.nfttrader.backend.exception.CollectionNotFoundException;
import com.nfttrader.backend.model.CollectionAnalytics;
import com.nfttrader.backend.model.ConditionOperator;
import com.nfttrader.backend.model.ConditionType;
import com.nfttrader.backend.model.PortfolioSummary;
import com.nfttrader.backend.model.TradingCondition;
import com.nfttrader.backend.model.Valuation;
import com.nfttrader.backend.service.ValuationService;
import com.nfttrader.backend.service.provider.PortfolioProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ConditionEvaluatorTest {

    private static final String OWNER = "0xowner";
    private static final String CONTRACT = "0xabc";

    @Mock
    private ValuationService valuationService;

    @Mock
    private PortfolioProvider portfolioProvider;

    private ConditionEvaluator conditionEvaluator;

    @BeforeEach
    void setUp() {
        // 14:30 UTC
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T14:30:00Z"), ZoneOffset.UTC);
        conditionEvaluator = new ConditionEvaluator(valuationService, portfolioProvider, clock);
    }

    @Test
    void price_shouldCompareEstimatedValue() {
        when(valuationService.getValuation(CONTRACT, "1"))
            .thenReturn(Valuation.builder().estimatedValue(new BigDecimal("2.5")).build());

        TradingCondition condition = condition(ConditionType.PRICE, ConditionOperator.GT, 2);
        condition.setTokenId("1");

        assertEquals(ConditionOutcome.SATISFIED, conditionEvaluator.evaluate(OWNER, condition));
    }

    @Test
    void price_shouldBeMalformedWithoutToken() {
        TradingCondition condition = condition(ConditionType.PRICE, ConditionOperator.GT, 2);

        assertEquals(ConditionOutcome.MALFORMED, conditionEvaluator.evaluate(OWNER, condition));
        verifyNoInteractions(valuationService);
    }

    @Test
    void floorPrice_shouldCompareCollectionFloor() {
        when(valuationService.getCollectionAnalytics(CONTRACT))
            .thenReturn(CollectionAnalytics.builder().floorPrice(new BigDecimal("10")).build());

        assertEquals(ConditionOutcome.NOT_SATISFIED,
            conditionEvaluator.evaluate(OWNER, condition(ConditionType.FLOOR_PRICE, ConditionOperator.LT, "9.5")));
    }

    @Test
    void floorPrice_shouldReportErrorWhenCollectionIsUnknown() {
        when(valuationService.getCollectionAnalytics(CONTRACT))
            .thenThrow(new CollectionNotFoundException(CONTRACT));

        assertEquals(ConditionOutcome.ERROR,
            conditionEvaluator.evaluate(OWNER, condition(ConditionType.FLOOR_PRICE, ConditionOperator.GTE, 1)));
    }

    @Test
    void portfolio_shouldCompareTotalValue() {
        when(portfolioProvider.getPortfolioSummary(OWNER))
            .thenReturn(PortfolioSummary.builder().ownerAddress(OWNER).totalValue(new BigDecimal("50")).build());

        TradingCondition condition = TradingCondition.builder()
            .type(ConditionType.PORTFOLIO)
            .operator(ConditionOperator.BETWEEN)
            .value(List.of(40, 60))
            .build();

        assertEquals(ConditionOutcome.SATISFIED, conditionEvaluator.evaluate(OWNER, condition));
    }

    @Test
    void time_shouldUseHourOfInjectedClock() {
        assertTrue(conditionEvaluator.isSatisfied(OWNER, timeCondition(ConditionOperator.EQ, 14)));
        assertTrue(conditionEvaluator.isSatisfied(OWNER, timeCondition(ConditionOperator.LTE, 14)));
        assertFalse(conditionEvaluator.isSatisfied(OWNER, timeCondition(ConditionOperator.GT, 14)));
        assertTrue(conditionEvaluator.isSatisfied(OWNER, timeCondition(ConditionOperator.CONTAINS, List.of(9, 14, 18))));
        assertFalse(conditionEvaluator.isSatisfied(OWNER, timeCondition(ConditionOperator.CONTAINS, List.of(9, 18))));
    }

    @Test
    void between_shouldBeMalformedWithoutNumericPair() {
        assertEquals(ConditionOutcome.MALFORMED,
            conditionEvaluator.evaluate(OWNER, timeCondition(ConditionOperator.BETWEEN, 10)));
        assertEquals(ConditionOutcome.MALFORMED,
            conditionEvaluator.evaluate(OWNER, timeCondition(ConditionOperator.BETWEEN, List.of(10))));
        assertEquals(ConditionOutcome.MALFORMED,
            conditionEvaluator.evaluate(OWNER, timeCondition(ConditionOperator.BETWEEN, List.of("a", "b"))));
        assertFalse(conditionEvaluator.isSatisfied(OWNER, timeCondition(ConditionOperator.BETWEEN, List.of(10))));
    }

    @Test
    void scalarOperator_shouldBeMalformedForNonNumericValue() {
        assertEquals(ConditionOutcome.MALFORMED,
            conditionEvaluator.evaluate(OWNER, timeCondition(ConditionOperator.GT, "noon")));
        assertEquals(ConditionOutcome.MALFORMED,
            conditionEvaluator.evaluate(OWNER, timeCondition(ConditionOperator.CONTAINS, 14)));
    }

    @Test
    void unsupportedTypes_shouldNeverBeSatisfied() {
        assertEquals(ConditionOutcome.UNSUPPORTED,
            conditionEvaluator.evaluate(OWNER, condition(ConditionType.VOLUME, ConditionOperator.GT, 0)));
        assertEquals(ConditionOutcome.UNSUPPORTED,
            conditionEvaluator.evaluate(OWNER, condition(ConditionType.RARITY, ConditionOperator.GT, 0)));
        assertEquals(ConditionOutcome.UNSUPPORTED,
            conditionEvaluator.evaluate(OWNER, condition(ConditionType.MARKET_SENTIMENT, ConditionOperator.EQ, 1)));
    }

    @Test
    void evaluateAll_shouldShortCircuitOnFirstFailure() {
        List<TradingCondition> conditions = List.of(
            timeCondition(ConditionOperator.LT, 10),
            condition(ConditionType.FLOOR_PRICE, ConditionOperator.GT, 1));

        assertFalse(conditionEvaluator.evaluateAll(OWNER, conditions));
        verify(valuationService, never()).getCollectionAnalytics(CONTRACT);
    }

    @Test
    void evaluateAll_shouldAcceptEmptyConditions() {
        assertTrue(conditionEvaluator.evaluateAll(OWNER, List.of()));
    }

    private TradingCondition condition(ConditionType type, ConditionOperator operator, Object value) {
        return TradingCondition.builder()
            .type(type)
            .operator(operator)
            .value(value)
            .contractAddress(CONTRACT)
            .build();
    }

    private TradingCondition timeCondition(ConditionOperator operator, Object value) {
        return TradingCondition.builder()
            .type(ConditionType.TIME)
            .operator(operator)
            .value(value)
            .build();
    }
}
