package com.optiontrader.indicator;

/**
 * MACD line, signal line and histogram at the last bar.
 *
 * <p>{@code crossover} is a proximity heuristic: the two lines are within the configured
 * tolerance of each other. It does not detect an actual sign change.
 */
public record MacdResult(double macd, double signal, double histogram, SignalDirection trend, boolean crossover) {

    public static MacdResult of(double macd, double signal, double crossoverTolerance) {
        double histogram = macd - signal;
        SignalDirection trend;
        if (macd > signal && histogram > 0) {
            trend = SignalDirection.BULLISH;
        } else if (macd < signal && histogram < 0) {
            trend = SignalDirection.BEARISH;
        } else {
            trend = SignalDirection.NEUTRAL;
        }
        return new MacdResult(macd, signal, histogram, trend, Math.abs(macd - signal) < crossoverTolerance);
    }
}
