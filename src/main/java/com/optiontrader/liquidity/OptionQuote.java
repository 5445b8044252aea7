package com.optiontrader.liquidity;

/**
 * A bid/ask quote for one option contract. Symbol and strike are informational.
 */
public record OptionQuote(String symbol, Double strike, double bid, double ask) {

    public static OptionQuote of(double bid, double ask) {
        return new OptionQuote(null, null, bid, ask);
    }
}
