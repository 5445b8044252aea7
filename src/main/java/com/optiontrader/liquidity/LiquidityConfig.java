package com.optiontrader.liquidity;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spread limits for tradable quotes, bound from application.yml under
 * {@code optiontrader.liquidity}.
 */
@Data
@ConfigurationProperties(prefix = "optiontrader.liquidity")
public class LiquidityConfig {

    /** Maximum spread as a fraction of mid (0.20 = 20%). */
    private double maxSpreadPct = 0.20;

    /** Maximum absolute spread in dollars. */
    private double maxSpreadDollars = 0.50;

    /** Bids below this are treated as untradable. */
    private double minBid = 0.05;

    /** Valid quotes a chain needs before it is considered tradable. */
    private int requiredValid = 2;
}
