package com.optiontrader.indicator;

/** Threshold breaches and classifications reported by a technical analysis. */
public enum SignalTag {
    RSI_OVERSOLD,
    RSI_OVERBOUGHT,
    BB_OVERSOLD,
    BB_OVERBOUGHT,
    BB_NEUTRAL,
    MACD_BULLISH,
    MACD_BEARISH,
    MACD_NEUTRAL;

    public static SignalTag forBand(BandSignal signal) {
        return switch (signal) {
            case OVERSOLD -> BB_OVERSOLD;
            case OVERBOUGHT -> BB_OVERBOUGHT;
            case NEUTRAL -> BB_NEUTRAL;
        };
    }

    public static SignalTag forTrend(SignalDirection trend) {
        return switch (trend) {
            case BULLISH -> MACD_BULLISH;
            case BEARISH -> MACD_BEARISH;
            case NEUTRAL -> MACD_NEUTRAL;
        };
    }
}
