package com.nfttrader.backend.service;

import com.nfttrader.backend.model.AutomatedTrade;
import com.nfttrader.backend.model.TradeStatus;
import com.nfttrader.backend.model.TradingPerformance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class TradingPerformanceService {

    private static final Logger logger = LoggerFactory.getLogger(TradingPerformanceService.class);

    private final TradeExecutionService tradeExecutionService;

    public TradingPerformanceService(TradeExecutionService tradeExecutionService) {
        this.tradeExecutionService = tradeExecutionService;
    }

    /**
     * Statistics over the owner's COMPLETED trades. A trade counts as successful when its
     * profit is positive; trades without a reported profit count as zero.
     */
    public TradingPerformance getTradingPerformance(String ownerAddress) {
        List<BigDecimal> profits = tradeExecutionService.getActiveTrades(ownerAddress).stream()
            .filter(trade -> trade.getStatus() == TradeStatus.COMPLETED)
            .map(AutomatedTrade::getProfitOrZero)
            .collect(Collectors.toList());

        int totalTrades = profits.size();
        int successfulTrades = (int) profits.stream()
            .filter(profit -> profit.compareTo(BigDecimal.ZERO) > 0)
            .count();

        BigDecimal totalProfit = profits.stream().reduce(BigDecimal.ZERO, BigDecimal::add);

        // Win rate
        double winRate = 0;
        BigDecimal averageProfit = BigDecimal.ZERO;
        if (totalTrades > 0) {
            winRate = BigDecimal.valueOf(successfulTrades)
                .divide(BigDecimal.valueOf(totalTrades), 4, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(100))
                .doubleValue();
            averageProfit = totalProfit.divide(BigDecimal.valueOf(totalTrades), 8, RoundingMode.HALF_UP);
        }

        // Largest win/loss
        BigDecimal bestTrade = profits.stream().max(BigDecimal::compareTo).orElse(BigDecimal.ZERO);
        BigDecimal worstTrade = profits.stream().min(BigDecimal::compareTo).orElse(BigDecimal.ZERO);

        logger.debug("Performance for {}: {} completed trades, win rate {}%", ownerAddress, totalTrades, winRate);
        return TradingPerformance.builder()
            .ownerAddress(ownerAddress)
            .totalTrades(totalTrades)
            .successfulTrades(successfulTrades)
            .totalProfit(totalProfit)
            .winRate(winRate)
            .averageProfit(averageProfit)
            .bestTrade(bestTrade)
            .worstTrade(worstTrade)
            .build();
    }
}
