package com.optiontrader.liquidity;

public enum SpreadAction {
    PROCEED,
    SKIP
}
