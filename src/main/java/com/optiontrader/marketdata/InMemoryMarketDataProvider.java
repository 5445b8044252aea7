package com.optiontrader.marketdata;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link MarketDataProvider} backed by histories pushed in by the caller.
 *
 * <p>There is no vendor integration: an orchestrating process (or the market-data REST
 * endpoint) seeds each symbol's daily bars, and every store replaces the previous
 * history wholesale. Symbols are matched case-insensitively.
 */
@Component
public class InMemoryMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMarketDataProvider.class);

    private final Map<String, PriceSeries> histories = new ConcurrentHashMap<>();

    /**
     * Replaces the stored history for a symbol. Bars are sorted by date before storing.
     *
     * @throws IllegalArgumentException if two bars share a date
     */
    public PriceSeries store(String symbol, List<PriceBar> bars) {
        String key = normalize(symbol);
        List<PriceBar> sorted =
                bars.stream().sorted(Comparator.comparing(PriceBar::date)).toList();
        PriceSeries series = new PriceSeries(key, sorted);
        histories.put(key, series);
        log.info("Stored {} bars for {}", series.size(), key);
        return series;
    }

    /** Returns the full stored history for a symbol, if any. */
    public Optional<PriceSeries> find(String symbol) {
        return Optional.ofNullable(histories.get(normalize(symbol)));
    }

    public boolean contains(String symbol) {
        return histories.containsKey(normalize(symbol));
    }

    @Override
    public PriceSeries getHistory(String symbol, LocalDate startDate, LocalDate endDate) {
        String key = normalize(symbol);
        PriceSeries series = histories.get(key);
        if (series == null) {
            log.debug("No stored history for {}", key);
            return PriceSeries.empty(key);
        }
        return series.between(startDate, endDate);
    }

    private static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
