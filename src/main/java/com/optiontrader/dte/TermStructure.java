package com.optiontrader.dte;

/**
 * Shape of the volatility term structure, read from the near-term to three-month
 * volatility index ratio (VIX / VIX3M).
 */
public enum TermStructure {
    /** Ratio below 0.95: calm market, upward-sloping curve. */
    CONTANGO,
    /** Ratio above 1.05: stressed market, inverted curve. */
    BACKWARDATION,
    NEUTRAL,
    /** Ratio not available. */
    UNKNOWN;

    static final double CONTANGO_BELOW = 0.95;
    static final double BACKWARDATION_ABOVE = 1.05;

    public static TermStructure classify(Double ratio) {
        if (ratio == null || !Double.isFinite(ratio) || ratio <= 0) {
            return UNKNOWN;
        }
        if (ratio > BACKWARDATION_ABOVE) {
            return BACKWARDATION;
        }
        if (ratio < CONTANGO_BELOW) {
            return CONTANGO;
        }
        return NEUTRAL;
    }
}
