package com.optiontrader.indicator;

/**
 * Classification of the price's position inside its Bollinger bands.
 *
 * <p>Boundaries are inclusive to NEUTRAL: a position of exactly 0.2 or 0.8 is NEUTRAL.
 */
public enum BandSignal {
    OVERSOLD,
    OVERBOUGHT,
    NEUTRAL;

    static final double OVERSOLD_BELOW = 0.2;
    static final double OVERBOUGHT_ABOVE = 0.8;

    public static BandSignal classify(double position) {
        if (position < OVERSOLD_BELOW) {
            return OVERSOLD;
        }
        if (position > OVERBOUGHT_ABOVE) {
            return OVERBOUGHT;
        }
        return NEUTRAL;
    }
}
