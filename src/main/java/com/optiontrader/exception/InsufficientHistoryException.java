package com.optiontrader.exception;

import java.util.Map;

/** Too few closes for the requested lookback to yield a volatility rank. */
public class InsufficientHistoryException extends OptionTraderException {

    public InsufficientHistoryException(String symbol, int lookbackDays) {
        super(
                ErrorCode.INSUFFICIENT_HISTORY,
                String.format("Not enough price history to rank %s over %d days", symbol, lookbackDays),
                Map.<String, Object>of("symbol", symbol, "lookbackDays", lookbackDays));
    }
}
