package com.optiontrader.decision;

import com.optiontrader.dte.DTEOptimizer;
import com.optiontrader.dte.DTEWindow;
import com.optiontrader.dte.RegimeFeatures;
import com.optiontrader.indicator.IndicatorSnapshot;
import com.optiontrader.indicator.TechnicalSignalEngine;
import com.optiontrader.liquidity.ChainValidationResult;
import com.optiontrader.liquidity.OptionQuote;
import com.optiontrader.liquidity.SpreadValidator;
import com.optiontrader.marketdata.MarketDataProvider;
import com.optiontrader.marketdata.PriceSeries;
import com.optiontrader.volatility.IVRankEngine;
import com.optiontrader.volatility.VolatilityConfig;
import com.optiontrader.volatility.VolatilityRecord;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Threads the four decision stages together for one underlying.
 *
 * <p>Order: volatility rank and technical analysis run independently on the symbol's
 * history; the rank and the VIX term structure feed the DTE optimizer; the spread check
 * runs last over the candidate quotes. The stages never call each other, only this
 * service composes them.
 */
@Service
public class TradeDecisionService {

    private static final Logger log = LoggerFactory.getLogger(TradeDecisionService.class);

    private final IVRankEngine ivRankEngine;
    private final TechnicalSignalEngine technicalSignalEngine;
    private final DTEOptimizer dteOptimizer;
    private final SpreadValidator spreadValidator;
    private final MarketDataProvider marketDataProvider;
    private final VolatilityConfig volatilityConfig;

    public TradeDecisionService(
            IVRankEngine ivRankEngine,
            TechnicalSignalEngine technicalSignalEngine,
            DTEOptimizer dteOptimizer,
            SpreadValidator spreadValidator,
            MarketDataProvider marketDataProvider,
            VolatilityConfig volatilityConfig) {
        this.ivRankEngine = ivRankEngine;
        this.technicalSignalEngine = technicalSignalEngine;
        this.dteOptimizer = dteOptimizer;
        this.spreadValidator = spreadValidator;
        this.marketDataProvider = marketDataProvider;
        this.volatilityConfig = volatilityConfig;
    }

    /**
     * Runs the pipeline.
     *
     * @param symbol        the underlying
     * @param lookbackDays  lookback for rank and indicators, null for the configured default
     * @param vix           spot volatility index level, may be null
     * @param vix3m         three-month volatility index level, may be null
     * @param quotes        candidate option quotes, may be null or empty
     * @param requiredValid valid quotes needed, null for the configured default
     */
    public TradeDecision decide(
            String symbol, Integer lookbackDays, Double vix, Double vix3m, List<OptionQuote> quotes, Integer requiredValid) {
        int lookback = lookbackDays != null ? lookbackDays : volatilityConfig.getLookbackDays();

        VolatilityRecord volatility = ivRankEngine.getIVDetails(symbol, lookback);
        IndicatorSnapshot indicators = analyzeHistory(symbol, lookback);

        RegimeFeatures regime =
                RegimeFeatures.fromVixLevels(vix, vix3m, volatility != null ? volatility.getIvRank() : null);
        DTEWindow window = dteOptimizer.predictOptimalDTE(regime);

        ChainValidationResult liquidity = null;
        if (quotes != null && !quotes.isEmpty()) {
            liquidity = requiredValid != null
                    ? spreadValidator.validateOptionsChain(quotes, requiredValid)
                    : spreadValidator.validateOptionsChain(quotes);
        }
        boolean proceed = liquidity != null && liquidity.isValid();

        log.info(
                "Decision for {}: ivRank={}, signal={}, regime={}, dte={}-{}, proceed={}",
                symbol,
                volatility != null ? String.format("%.1f", volatility.getIvRank()) : "n/a",
                indicators.getOverallSignal(),
                regime.structureLabel(),
                window.minDte(),
                window.maxDte(),
                proceed);

        return TradeDecision.builder()
                .symbol(symbol)
                .volatility(volatility)
                .indicators(indicators)
                .regime(regime)
                .dteWindow(window)
                .optimizerMode(dteOptimizer.getMode())
                .liquidity(liquidity)
                .proceed(proceed)
                .decidedAt(Instant.now())
                .build();
    }

    private IndicatorSnapshot analyzeHistory(String symbol, int lookbackDays) {
        try {
            LocalDate endDate = LocalDate.now();
            PriceSeries history = marketDataProvider.getHistory(symbol, endDate.minusDays(lookbackDays), endDate);
            return technicalSignalEngine.analyze(history);
        } catch (Exception e) {
            log.error("Could not load history for technical analysis of {}", symbol, e);
            return IndicatorSnapshot.unavailable("price history unavailable");
        }
    }
}
