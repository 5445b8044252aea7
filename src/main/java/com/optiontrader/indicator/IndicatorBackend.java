package com.optiontrader.indicator;

/**
 * Raw indicator primitives over numeric sequences, oldest value first.
 *
 * <p>Each method returns the indicator's value at the last element. Implementations do
 * not check warm-up lengths; callers only invoke them with enough samples.
 */
public interface IndicatorBackend {

    double rsi(double[] closes, int period);

    BandValues bollinger(double[] closes, int period, double multiplier);

    MacdValues macd(double[] closes, int fastPeriod, int slowPeriod, int signalPeriod);

    double atr(double[] highs, double[] lows, double[] closes, int period);

    /** Bollinger band levels at the last bar. */
    record BandValues(double upper, double middle, double lower) {}

    /** MACD line and its signal line at the last bar. */
    record MacdValues(double macd, double signal) {}
}
