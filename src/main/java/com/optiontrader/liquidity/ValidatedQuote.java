package com.optiontrader.liquidity;

/** A quote paired with its spread verdict. */
public record ValidatedQuote(OptionQuote option, SpreadVerdict validation) {}
