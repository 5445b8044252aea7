package com.optiontrader.exception;

import java.util.Map;

public class UnknownSymbolException extends OptionTraderException {

    public UnknownSymbolException(String symbol) {
        super(ErrorCode.UNKNOWN_SYMBOL, "No price history stored for " + symbol, Map.<String, Object>of("symbol", symbol));
    }
}
