package com.nfttrader.backend.service.rules;

import com.nfttrader.backend.model.ConditionOperator;
import com.nfttrader.backend.model.TradingCondition;
import com.nfttrader.backend.service.ValuationService;
import com.nfttrader.backend.service.provider.PortfolioProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Evaluates rule conditions against live market, portfolio and clock data.
 * Evaluation never throws; problems are reported through {@link ConditionOutcome}.
 */
@Component
public class ConditionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final ValuationService valuationService;
    private final PortfolioProvider portfolioProvider;
    private final Clock clock;

    @Autowired
    public ConditionEvaluator(ValuationService valuationService, PortfolioProvider portfolioProvider, Clock clock) {
        this.valuationService = valuationService;
        this.portfolioProvider = portfolioProvider;
        this.clock = clock;
    }

    /**
     * AND over all conditions, stopping at the first one that is not satisfied.
     * An empty list is satisfied.
     */
    public boolean evaluateAll(String ownerAddress, List<TradingCondition> conditions) {
        if (conditions == null) {
            return true;
        }
        for (TradingCondition condition : conditions) {
            ConditionOutcome outcome = evaluate(ownerAddress, condition);
            if (!outcome.isSatisfied()) {
                logger.debug("Condition {} for {} evaluated to {}",
                    condition != null ? condition.getType() : null, ownerAddress, outcome);
                return false;
            }
        }
        return true;
    }

    public boolean isSatisfied(String ownerAddress, TradingCondition condition) {
        return evaluate(ownerAddress, condition).isSatisfied();
    }

    public ConditionOutcome evaluate(String ownerAddress, TradingCondition condition) {
        if (condition == null || condition.getType() == null || condition.getOperator() == null) {
            return ConditionOutcome.MALFORMED;
        }

        BigDecimal current;
        try {
            switch (condition.getType()) {
                case PRICE:
                    if (isBlank(condition.getContractAddress()) || isBlank(condition.getTokenId())) {
                        return ConditionOutcome.MALFORMED;
                    }
                    current = valuationService.getValuation(condition.getContractAddress(), condition.getTokenId())
                        .getEstimatedValue();
                    break;
                case FLOOR_PRICE:
                    if (isBlank(condition.getContractAddress())) {
                        return ConditionOutcome.MALFORMED;
                    }
                    current = valuationService.getCollectionAnalytics(condition.getContractAddress()).getFloorPrice();
                    break;
                case PORTFOLIO:
                    current = portfolioProvider.getPortfolioSummary(ownerAddress).getTotalValue();
                    break;
                case TIME:
                    current = BigDecimal.valueOf(ZonedDateTime.now(clock).getHour());
                    break;
                case VOLUME:
                case RARITY:
                case MARKET_SENTIMENT:
                default:
                    return ConditionOutcome.UNSUPPORTED;
            }
        } catch (Exception e) {
            logger.warn("Failed to evaluate {} condition for {}: {}",
                condition.getType().getValue(), ownerAddress, e.getMessage());
            return ConditionOutcome.ERROR;
        }

        if (current == null) {
            return ConditionOutcome.ERROR;
        }
        return compare(current, condition.getOperator(), condition.getValue());
    }

    /**
     * Applies an operator to the current value and the condition's target.
     */
    static ConditionOutcome compare(BigDecimal current, ConditionOperator operator, Object target) {
        switch (operator) {
            case BETWEEN: {
                if (!(target instanceof List) || ((List<?>) target).size() != 2) {
                    return ConditionOutcome.MALFORMED;
                }
                List<?> bounds = (List<?>) target;
                BigDecimal low = toDecimal(bounds.get(0));
                BigDecimal high = toDecimal(bounds.get(1));
                if (low == null || high == null) {
                    return ConditionOutcome.MALFORMED;
                }
                return outcome(current.compareTo(low) >= 0 && current.compareTo(high) <= 0);
            }
            case CONTAINS: {
                if (!(target instanceof Collection)) {
                    return ConditionOutcome.MALFORMED;
                }
                for (Object candidate : (Collection<?>) target) {
                    BigDecimal value = toDecimal(candidate);
                    if (value != null && value.compareTo(current) == 0) {
                        return ConditionOutcome.SATISFIED;
                    }
                }
                return ConditionOutcome.NOT_SATISFIED;
            }
            default:
                break;
        }

        BigDecimal value = toDecimal(target);
        if (value == null) {
            return ConditionOutcome.MALFORMED;
        }
        int cmp = current.compareTo(value);
        switch (operator) {
            case GT:  return outcome(cmp > 0);
            case LT:  return outcome(cmp < 0);
            case EQ:  return outcome(cmp == 0);
            case GTE: return outcome(cmp >= 0);
            case LTE: return outcome(cmp <= 0);
            default:  return ConditionOutcome.MALFORMED;
        }
    }

    private static ConditionOutcome outcome(boolean satisfied) {
        return satisfied ? ConditionOutcome.SATISFIED : ConditionOutcome.NOT_SATISFIED;
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number || value instanceof String) {
            try {
                return new BigDecimal(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
