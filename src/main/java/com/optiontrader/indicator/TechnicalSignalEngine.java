package com.optiontrader.indicator;

import com.optiontrader.marketdata.PriceSeries;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Computes RSI, Bollinger position, MACD and ATR for a price series and reduces them to
 * one directional signal.
 *
 * <p>Nothing is cached: every call recomputes from the supplied prices. Each indicator
 * returns null when the series is shorter than its warm-up, and the aggregate carries a
 * single error marker when no {@link IndicatorBackend} is available.
 *
 * <p>Aggregation: RSI below 30 or above 70, the band classification and the MACD trend
 * each add a {@link SignalTag}. The overall signal follows MACD alone.
 */
@Service
@EnableConfigurationProperties(IndicatorConfig.class)
public class TechnicalSignalEngine {

    private static final Logger log = LoggerFactory.getLogger(TechnicalSignalEngine.class);

    static final String BACKEND_UNAVAILABLE = "indicator backend not available";

    private final IndicatorConfig indicatorConfig;
    private final IndicatorBackend backend;

    private final AtomicBoolean unavailableWarned = new AtomicBoolean();

    public TechnicalSignalEngine(IndicatorConfig indicatorConfig, Optional<IndicatorBackend> backend) {
        this.indicatorConfig = indicatorConfig;
        this.backend = backend.orElse(null);
    }

    public boolean isBackendAvailable() {
        return backend != null;
    }

    // ---- RSI ----

    public Double calculateRsi(List<Double> prices) {
        return calculateRsi(prices, indicatorConfig.getRsiPeriod());
    }

    /**
     * Current RSI (0-100).
     *
     * @return the RSI, or null with fewer than {@code period + 1} prices
     */
    public Double calculateRsi(List<Double> prices, int period) {
        if (!backendReady() || prices == null || prices.size() < period + 1) {
            return null;
        }
        try {
            return finiteOrNull(backend.rsi(toArray(prices), period));
        } catch (RuntimeException e) {
            log.error("RSI({}) calculation failed", period, e);
            return null;
        }
    }

    // ---- Bollinger ----

    public BollingerBands calculateBollingerBands(List<Double> prices) {
        return calculateBollingerBands(
                prices, indicatorConfig.getBollingerPeriod(), indicatorConfig.getBollingerMultiplier());
    }

    /**
     * Bollinger levels and the last price's position within them.
     *
     * @return the bands, or null with fewer than {@code period} prices
     */
    public BollingerBands calculateBollingerBands(List<Double> prices, int period, double multiplier) {
        if (!backendReady() || prices == null || prices.size() < period) {
            return null;
        }
        try {
            IndicatorBackend.BandValues bands = backend.bollinger(toArray(prices), period, multiplier);
            if (!Double.isFinite(bands.upper()) || !Double.isFinite(bands.lower())) {
                return null;
            }
            return BollingerBands.of(bands.upper(), bands.middle(), bands.lower(), prices.get(prices.size() - 1));
        } catch (RuntimeException e) {
            log.error("Bollinger({}, {}) calculation failed", period, multiplier, e);
            return null;
        }
    }

    // ---- MACD ----

    public MacdResult calculateMacd(List<Double> prices) {
        return calculateMacd(
                prices, indicatorConfig.getMacdFast(), indicatorConfig.getMacdSlow(), indicatorConfig.getMacdSignal());
    }

    /**
     * MACD, signal line, histogram and trend.
     *
     * @return the result, or null with fewer than {@code slow + signal} prices
     */
    public MacdResult calculateMacd(List<Double> prices, int fast, int slow, int signal) {
        if (!backendReady() || prices == null || prices.size() < slow + signal) {
            return null;
        }
        try {
            IndicatorBackend.MacdValues values = backend.macd(toArray(prices), fast, slow, signal);
            if (!Double.isFinite(values.macd()) || !Double.isFinite(values.signal())) {
                return null;
            }
            return MacdResult.of(values.macd(), values.signal(), indicatorConfig.getMacdCrossoverTolerance());
        } catch (RuntimeException e) {
            log.error("MACD({}, {}, {}) calculation failed", fast, slow, signal, e);
            return null;
        }
    }

    // ---- ATR ----

    public Double calculateAtr(List<Double> highs, List<Double> lows, List<Double> closes) {
        return calculateAtr(highs, lows, closes, indicatorConfig.getAtrPeriod());
    }

    /**
     * Average true range.
     *
     * @return the ATR, or null when a series is missing, lengths differ, or there are
     *     fewer than {@code period + 1} closes
     */
    public Double calculateAtr(List<Double> highs, List<Double> lows, List<Double> closes, int period) {
        if (!backendReady() || highs == null || lows == null || closes == null || closes.size() < period + 1) {
            return null;
        }
        if (highs.size() != closes.size() || lows.size() != closes.size()) {
            log.warn(
                    "ATR needs aligned series, got highs={}, lows={}, closes={}",
                    highs.size(),
                    lows.size(),
                    closes.size());
            return null;
        }
        try {
            return finiteOrNull(backend.atr(toArray(highs), toArray(lows), toArray(closes), period));
        } catch (RuntimeException e) {
            log.error("ATR({}) calculation failed", period, e);
            return null;
        }
    }

    // ---- Aggregate ----

    public IndicatorSnapshot analyze(PriceSeries series) {
        return analyze(series.closes(), series.highs(), series.lows());
    }

    /**
     * Runs every indicator and derives the tag list and overall signal.
     *
     * @param prices closes, oldest first
     * @param highs  highs aligned with prices, or null
     * @param lows   lows aligned with prices, or null
     */
    public IndicatorSnapshot analyze(List<Double> prices, List<Double> highs, List<Double> lows) {
        if (!backendReady()) {
            return IndicatorSnapshot.unavailable(BACKEND_UNAVAILABLE);
        }
        try {
            Double rsi = calculateRsi(prices);
            BollingerBands bollinger = calculateBollingerBands(prices);
            MacdResult macd = calculateMacd(prices);
            Double atr = highs != null && lows != null ? calculateAtr(highs, lows, prices) : null;

            List<SignalTag> signals = new ArrayList<>();
            if (rsi != null) {
                if (rsi < indicatorConfig.getRsiOversold()) {
                    signals.add(SignalTag.RSI_OVERSOLD);
                } else if (rsi > indicatorConfig.getRsiOverbought()) {
                    signals.add(SignalTag.RSI_OVERBOUGHT);
                }
            }
            if (bollinger != null) {
                signals.add(SignalTag.forBand(bollinger.signal()));
            }
            if (macd != null) {
                signals.add(SignalTag.forTrend(macd.trend()));
            }

            return IndicatorSnapshot.builder()
                    .rsi(rsi)
                    .bollinger(bollinger)
                    .macd(macd)
                    .atr(atr)
                    .signals(List.copyOf(signals))
                    .overallSignal(overallSignal(signals))
                    .build();

        } catch (RuntimeException e) {
            log.error("Technical analysis failed", e);
            return IndicatorSnapshot.unavailable("technical analysis failed: " + e.getMessage());
        }
    }

    static SignalDirection overallSignal(List<SignalTag> signals) {
        if (signals.contains(SignalTag.MACD_BULLISH)) {
            return SignalDirection.BULLISH;
        }
        if (signals.contains(SignalTag.MACD_BEARISH)) {
            return SignalDirection.BEARISH;
        }
        return SignalDirection.NEUTRAL;
    }

    // ---- Internal ----

    private boolean backendReady() {
        if (backend != null) {
            return true;
        }
        if (unavailableWarned.compareAndSet(false, true)) {
            log.warn("No indicator backend configured, technical indicators are unavailable");
        }
        return false;
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
