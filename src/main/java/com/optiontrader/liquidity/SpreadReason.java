package com.optiontrader.liquidity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome codes of a spread check, in evaluation order. The first failing check wins.
 */
@Getter
@RequiredArgsConstructor
public enum SpreadReason {
    BID_TOO_LOW("bid too low"),
    INVALID_PRICES("invalid prices"),
    CROSSED_MARKET("data error"),
    SPREAD_TOO_WIDE_PCT("spread too wide (%)"),
    SPREAD_TOO_WIDE_DOLLARS("spread too wide ($)"),
    ACCEPTABLE("spread acceptable");

    private final String label;
}
