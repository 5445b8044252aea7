package com.optiontrader.decision;

import com.optiontrader.dte.DTEWindow;
import com.optiontrader.dte.OptimizerMode;
import com.optiontrader.dte.RegimeFeatures;
import com.optiontrader.indicator.IndicatorSnapshot;
import com.optiontrader.liquidity.ChainValidationResult;
import com.optiontrader.volatility.VolatilityRecord;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Combined output of one pass through the decision pipeline for an underlying.
 */
@Getter
@Builder
public class TradeDecision {

    private final String symbol;

    /** Null when the history was too short to rank. */
    private final VolatilityRecord volatility;

    private final IndicatorSnapshot indicators;
    private final RegimeFeatures regime;
    private final DTEWindow dteWindow;
    private final OptimizerMode optimizerMode;

    /** Null when no quotes were supplied. */
    private final ChainValidationResult liquidity;

    /** True only when quotes were supplied and enough of them passed the spread check. */
    private final boolean proceed;

    private final Instant decidedAt;
}
