package com.nfttrader.backend.service.util;

import com.nfttrader.backend.model.MarketSentiment;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure scoring functions behind item valuations. All bounded scores are clamped.
 */
public final class ValuationMath {

    public static final int SENTIMENT_WINDOW = 7;
    public static final double SENTIMENT_THRESHOLD = 0.10;
    public static final double DEFAULT_RARITY_SCORE = 50.0;

    private ValuationMath() {
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Population standard deviation of sequential percentage returns.
     *
     * @param mostRecentFirst sale prices, newest first
     * @return 0 when fewer than two usable prices exist or every return is identical
     */
    public static double volatility(List<BigDecimal> mostRecentFirst) {
        if (mostRecentFirst == null || mostRecentFirst.size() < 2) {
            return 0.0;
        }
        List<BigDecimal> chronological = new ArrayList<>(mostRecentFirst);
        Collections.reverse(chronological);

        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < chronological.size(); i++) {
            double previous = chronological.get(i - 1).doubleValue();
            double current = chronological.get(i).doubleValue();
            if (previous <= 0) {
                continue;
            }
            returns.add((current - previous) / previous);
        }
        if (returns.isEmpty()) {
            return 0.0;
        }

        double first = returns.get(0);
        if (returns.stream().allMatch(r -> r == first)) {
            return 0.0;
        }
        double[] values = returns.stream().mapToDouble(Double::doubleValue).toArray();
        return new StandardDeviation(false).evaluate(values);
    }

    /**
     * Compares the mean of the latest {@value #SENTIMENT_WINDOW} sales with the mean of the
     * {@value #SENTIMENT_WINDOW} before them.
     */
    public static MarketSentiment sentiment(List<BigDecimal> mostRecentFirst) {
        if (mostRecentFirst == null || mostRecentFirst.size() < SENTIMENT_WINDOW * 2) {
            return MarketSentiment.NEUTRAL;
        }
        double recentMean = mean(mostRecentFirst.subList(0, SENTIMENT_WINDOW));
        double priorMean = mean(mostRecentFirst.subList(SENTIMENT_WINDOW, SENTIMENT_WINDOW * 2));
        if (priorMean == 0) {
            return MarketSentiment.NEUTRAL;
        }

        double change = (recentMean - priorMean) / priorMean;
        if (change > SENTIMENT_THRESHOLD) {
            return MarketSentiment.BULLISH;
        }
        if (change < -SENTIMENT_THRESHOLD) {
            return MarketSentiment.BEARISH;
        }
        return MarketSentiment.NEUTRAL;
    }

    /**
     * Rarity in [0,1] mapped to [0,100]; absent rarity is treated as average.
     */
    public static double rarityScore(Double rarity) {
        if (rarity == null || rarity.isNaN()) {
            return DEFAULT_RARITY_SCORE;
        }
        return clamp(rarity * 100, 0, 100);
    }

    /**
     * Multiplier for items rarer than average: linear from 1.0 at rarity 0.5 to 1.25 at 1.0.
     */
    public static BigDecimal rarityPremium(Double rarity) {
        if (rarity == null || rarity.isNaN() || rarity <= 0.5) {
            return BigDecimal.ONE;
        }
        double capped = Math.min(rarity, 1.0);
        return BigDecimal.valueOf(1 + (capped - 0.5) * 0.5);
    }

    private static double mean(List<BigDecimal> prices) {
        double[] values = prices.stream().mapToDouble(BigDecimal::doubleValue).toArray();
        return new Mean().evaluate(values);
    }
}
