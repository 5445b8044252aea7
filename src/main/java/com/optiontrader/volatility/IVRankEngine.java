package com.optiontrader.volatility;

import com.optiontrader.marketdata.MarketDataProvider;
import com.optiontrader.marketdata.PriceSeries;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Computes and caches the volatility rank of an underlying.
 *
 * <p>The rank is derived from the underlying's own close-to-close history: a rolling
 * 20-return volatility series is built over the lookback window and the latest value is
 * ranked against the whole series. No option-implied volatility surface is consulted, so
 * the result is a historical-volatility rank used as a proxy for IV rank.
 *
 * <p>Cache behavior:
 * <ul>
 *   <li>Records are keyed by (symbol, lookbackDays) and reused while younger than the
 *       configured TTL (one hour by default)</li>
 *   <li>Expiry is checked on read only; new price data does not invalidate an entry</li>
 *   <li>{@link #clearCache()} wipes every entry</li>
 *   <li>Two concurrent misses on the same key may both compute; the later write wins</li>
 * </ul>
 *
 * <p>Insufficient data, an empty volatility series and provider failures all yield
 * {@code null}; no exception escapes this class.
 */
@Service
@EnableConfigurationProperties(VolatilityConfig.class)
public class IVRankEngine {

    private static final Logger log = LoggerFactory.getLogger(IVRankEngine.class);

    private final MarketDataProvider marketDataProvider;
    private final VolatilityConfig volatilityConfig;

    private final Map<CacheKey, CachedVolatilityRecord> cache = new ConcurrentHashMap<>();

    public IVRankEngine(MarketDataProvider marketDataProvider, VolatilityConfig volatilityConfig) {
        this.marketDataProvider = marketDataProvider;
        this.volatilityConfig = volatilityConfig;
    }

    /** Returns the rank over the configured default lookback. */
    public Double getIVRank(String symbol) {
        return getIVRank(symbol, volatilityConfig.getLookbackDays());
    }

    /**
     * Returns the volatility rank (0-100) of a symbol over a lookback window.
     *
     * @param symbol       the underlying
     * @param lookbackDays lookback in calendar days
     * @return the rank, or null when there is not enough usable history
     */
    public Double getIVRank(String symbol, int lookbackDays) {
        VolatilityRecord record = resolve(symbol, lookbackDays);
        return record != null ? record.getIvRank() : null;
    }

    /** Returns the full record over the configured default lookback. */
    public VolatilityRecord getIVDetails(String symbol) {
        return getIVDetails(symbol, volatilityConfig.getLookbackDays());
    }

    /**
     * Returns the volatility record with series statistics and the high/low regime flags.
     *
     * @return the record, or null when there is not enough usable history
     */
    public VolatilityRecord getIVDetails(String symbol, int lookbackDays) {
        return resolve(symbol, lookbackDays);
    }

    /** Drops every cached record. */
    public void clearCache() {
        cache.clear();
        log.info("IV rank cache cleared");
    }

    /** Number of cached entries, expired ones included. */
    public int getCacheSize() {
        return cache.size();
    }

    // ---- Internal ----

    private VolatilityRecord resolve(String symbol, int lookbackDays) {
        if (symbol == null || symbol.isBlank() || lookbackDays <= 0) {
            log.warn("Cannot rank volatility for symbol='{}', lookbackDays={}", symbol, lookbackDays);
            return null;
        }

        CacheKey key = new CacheKey(symbol, lookbackDays);
        CachedVolatilityRecord cached = cache.get(key);
        if (cached != null && !cached.isExpired(volatilityConfig.getCacheTtl())) {
            log.debug("IV rank cache hit for {} ({}d)", symbol, lookbackDays);
            return cached.getRecord();
        }

        VolatilityRecord record = compute(symbol, lookbackDays);
        if (record != null) {
            cache.put(key, new CachedVolatilityRecord(record, record.getComputedAt()));
        }
        return record;
    }

    private VolatilityRecord compute(String symbol, int lookbackDays) {
        try {
            LocalDate endDate = LocalDate.now();
            LocalDate startDate = endDate.minusDays(lookbackDays);
            PriceSeries history = marketDataProvider.getHistory(symbol, startDate, endDate);

            if (history == null || history.size() < volatilityConfig.getMinSamples()) {
                log.warn(
                        "Insufficient data for {} IV rank: {} samples, need {}",
                        symbol,
                        history == null ? 0 : history.size(),
                        volatilityConfig.getMinSamples());
                return null;
            }

            List<Double> hvSeries = HistoricalVolatilityCalculator.rollingVolatility(
                    history.closes(), volatilityConfig.getWindow(), volatilityConfig.getTradingDaysPerYear());
            if (hvSeries.isEmpty()) {
                log.warn("Volatility series for {} is empty after a {}-return window", symbol, volatilityConfig.getWindow());
                return null;
            }

            double currentHv = hvSeries.get(hvSeries.size() - 1);
            if (!Double.isFinite(currentHv)) {
                log.warn("Current volatility for {} is not finite ({}), check the price history", symbol, currentHv);
                return null;
            }

            return buildRecord(symbol, lookbackDays, hvSeries, currentHv);

        } catch (Exception e) {
            log.error("Error calculating IV rank for {}", symbol, e);
            return null;
        }
    }

    private VolatilityRecord buildRecord(String symbol, int lookbackDays, List<Double> hvSeries, double currentHv) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        hvSeries.forEach(stats::addValue);

        double mean = stats.getMean();
        // Sample deviation is NaN for a single value; no band exists around one point
        double std = hvSeries.size() > 1 ? stats.getStandardDeviation() : 0.0;
        double ivRank = HistoricalVolatilityCalculator.percentileRank(hvSeries, currentHv);

        VolatilityRecord record = VolatilityRecord.builder()
                .symbol(symbol)
                .lookbackDays(lookbackDays)
                .computedAt(Instant.now())
                .historicalVolSeries(List.copyOf(hvSeries))
                .currentHv(currentHv)
                .ivRank(ivRank)
                .hvMean(mean)
                .hvStd(std)
                .hvMin(stats.getMin())
                .hvMax(stats.getMax())
                .highIv(currentHv > mean + std)
                .lowIv(currentHv < mean - std)
                .build();

        log.info(
                "{} IV Rank: {}% (Current HV: {}%)",
                symbol,
                String.format("%.1f", ivRank),
                String.format("%.1f", currentHv));
        return record;
    }

    private record CacheKey(String symbol, int lookbackDays) {}
}
