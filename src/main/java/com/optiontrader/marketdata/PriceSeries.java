package com.optiontrader.marketdata;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Immutable, date-ascending price history for one symbol.
 *
 * <p>Construction rejects unordered or duplicate dates, so every consumer can rely on
 * index order being time order.
 */
public final class PriceSeries {

    @Getter
    private final String symbol;

    @Getter
    private final List<PriceBar> bars;

    public PriceSeries(String symbol, List<PriceBar> bars) {
        this.symbol = symbol;
        List<PriceBar> copy = new ArrayList<>(bars);
        for (int i = 1; i < copy.size(); i++) {
            if (!copy.get(i).date().isAfter(copy.get(i - 1).date())) {
                throw new IllegalArgumentException("Price bars for " + symbol
                        + " must be strictly ascending by date, found " + copy.get(i - 1).date() + " then "
                        + copy.get(i).date());
            }
        }
        this.bars = Collections.unmodifiableList(copy);
    }

    public static PriceSeries empty(String symbol) {
        return new PriceSeries(symbol, List.of());
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    /** Returns the bars whose date lies within [from, to], inclusive. */
    public PriceSeries between(LocalDate from, LocalDate to) {
        List<PriceBar> window = bars.stream()
                .filter(bar -> !bar.date().isBefore(from) && !bar.date().isAfter(to))
                .toList();
        return new PriceSeries(symbol, window);
    }

    public List<Double> closes() {
        return bars.stream().map(PriceBar::close).toList();
    }

    /** True when every bar carries both a high and a low. */
    public boolean hasHighLow() {
        return !bars.isEmpty() && bars.stream().allMatch(PriceBar::hasHighLow);
    }

    /** Highs in date order, or null when any bar lacks one. */
    public List<Double> highs() {
        return hasHighLow() ? bars.stream().map(PriceBar::high).toList() : null;
    }

    /** Lows in date order, or null when any bar lacks one. */
    public List<Double> lows() {
        return hasHighLow() ? bars.stream().map(PriceBar::low).toList() : null;
    }
}
