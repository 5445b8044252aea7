package com.optiontrader.marketdata;

import java.time.LocalDate;

/**
 * One daily sample of an underlying's price history.
 *
 * <p>High and low are optional; close-only histories are enough for volatility
 * and most indicators, ATR needs both.
 */
public record PriceBar(LocalDate date, double close, Double high, Double low) {

    public static PriceBar ofClose(LocalDate date, double close) {
        return new PriceBar(date, close, null, null);
    }

    public boolean hasHighLow() {
        return high != null && low != null;
    }
}
