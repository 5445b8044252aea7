package com.optiontrader.volatility;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the historical-volatility rank, bound from application.yml under
 * {@code optiontrader.volatility}.
 */
@Data
@ConfigurationProperties(prefix = "optiontrader.volatility")
public class VolatilityConfig {

    /** How long a computed rank is reused for the same (symbol, lookback) key. */
    private Duration cacheTtl = Duration.ofHours(1);

    /** Default lookback in calendar days. */
    private int lookbackDays = 252;

    /** Minimum number of price samples in the lookback window. */
    private int minSamples = 20;

    /** Rolling window, in returns, for each volatility estimate. */
    private int window = 20;

    /** Annualisation factor. */
    private int tradingDaysPerYear = 252;
}
