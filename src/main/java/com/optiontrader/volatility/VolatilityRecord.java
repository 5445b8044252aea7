package com.optiontrader.volatility;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Result of one historical-volatility rank computation for a (symbol, lookback) pair.
 *
 * <p>{@code ivRank} is the percentile of the latest 20-day historical volatility within
 * its own trailing series. It approximates, but is not, an option-implied volatility
 * rank. All volatility figures are annualised percentages.
 *
 * <p>Records are immutable; an expired record is replaced, never updated.
 */
@Getter
@Builder
public class VolatilityRecord {

    private final String symbol;
    private final int lookbackDays;
    private final Instant computedAt;

    /** Rolling volatility values, oldest first, one per full window. Never empty. */
    private final List<Double> historicalVolSeries;

    private final double currentHv;

    /** Percent of the series strictly below {@link #currentHv}, 0-100. */
    private final double ivRank;

    private final double hvMean;
    private final double hvStd;
    private final double hvMin;
    private final double hvMax;

    /** Current volatility above mean + one standard deviation. */
    private final boolean highIv;

    /** Current volatility below mean - one standard deviation. */
    private final boolean lowIv;
}
