package com.optiontrader.marketdata;

import java.time.LocalDate;

/**
 * Source of daily price history for underlyings.
 *
 * <p>Implementations may throw on transport or vendor errors; consumers treat any
 * exception, and any sparse result, as insufficient data.
 */
public interface MarketDataProvider {

    /**
     * Returns the bars for {@code symbol} dated within [startDate, endDate].
     *
     * @return the history, empty when the symbol is unknown
     */
    PriceSeries getHistory(String symbol, LocalDate startDate, LocalDate endDate);
}
