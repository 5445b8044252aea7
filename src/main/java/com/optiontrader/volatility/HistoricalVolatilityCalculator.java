package com.optiontrader.volatility;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Rolling close-to-close volatility and its self-referential percentile rank.
 *
 * <p>Stateless; all methods are pure functions of their input.
 */
public final class HistoricalVolatilityCalculator {

    private HistoricalVolatilityCalculator() {}

    /**
     * Computes the annualised rolling volatility series, in percent.
     *
     * <p>Daily simple returns are taken between consecutive closes; each output value is
     * the sample standard deviation of {@code window} consecutive returns, scaled by
     * sqrt(tradingDaysPerYear) and 100. A history of n closes yields n - window values,
     * so 20 closes with a 20-return window produce an empty series.
     */
    public static List<Double> rollingVolatility(List<Double> closes, int window, int tradingDaysPerYear) {
        if (window < 2) {
            throw new IllegalArgumentException("window must be at least 2, was " + window);
        }
        int returnCount = closes.size() - 1;
        if (returnCount < window) {
            return List.of();
        }

        double[] returns = new double[returnCount];
        for (int i = 0; i < returnCount; i++) {
            returns[i] = closes.get(i + 1) / closes.get(i) - 1.0;
        }

        StandardDeviation stdDev = new StandardDeviation(true);
        double annualisation = Math.sqrt(tradingDaysPerYear) * 100.0;
        List<Double> series = new ArrayList<>(returnCount - window + 1);
        for (int end = window; end <= returnCount; end++) {
            series.add(stdDev.evaluate(returns, end - window, window) * annualisation);
        }
        return series;
    }

    /**
     * Percentile rank of {@code current} within {@code series}: the share of values strictly
     * below it, times 100. The series normally contains {@code current} as its last element,
     * so the top value of a series ranks just under 100.
     */
    public static double percentileRank(List<Double> series, double current) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("series must not be empty");
        }
        long below = series.stream().filter(value -> value < current).count();
        return (double) below / series.size() * 100.0;
    }
}
