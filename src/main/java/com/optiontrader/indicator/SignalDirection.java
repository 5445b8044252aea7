package com.optiontrader.indicator;

/** Directional read of the market, used for the MACD trend and the overall signal. */
public enum SignalDirection {
    BULLISH,
    BEARISH,
    NEUTRAL
}
