package com.optiontrader.indicator;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.DoubleNum;
import org.ta4j.core.num.Num;

/**
 * {@link IndicatorBackend} built on ta4j.
 *
 * <p>Every call builds a throwaway daily BarSeries from the supplied arrays and reads the
 * indicator at the end index. Close-only input uses the close as open, high and low.
 * RSI and ATR use ta4j's Wilder smoothing, Bollinger bands use the population standard
 * deviation, and the MACD signal line is an EMA of the MACD line.
 *
 * <p>Stateless and thread-safe.
 */
@Component
@ConditionalOnProperty(prefix = "optiontrader.indicators", name = "enabled", matchIfMissing = true)
public class Ta4jIndicatorBackend implements IndicatorBackend {

    private static final Logger log = LoggerFactory.getLogger(Ta4jIndicatorBackend.class);

    /** Synthetic start date for series built from bare arrays. */
    private static final ZonedDateTime SERIES_START = ZonedDateTime.of(2000, 1, 3, 16, 0, 0, 0, ZoneOffset.UTC);

    @Override
    public double rsi(double[] closes, int period) {
        BarSeries series = closeSeries(closes);
        RSIIndicator rsi = new RSIIndicator(new ClosePriceIndicator(series), period);
        return valueAtEnd(rsi.getValue(series.getEndIndex()));
    }

    @Override
    public BandValues bollinger(double[] closes, int period, double multiplier) {
        BarSeries series = closeSeries(closes);
        ClosePriceIndicator closePrice = new ClosePriceIndicator(series);
        SMAIndicator sma = new SMAIndicator(closePrice, period);
        StandardDeviationIndicator stdDev = new StandardDeviationIndicator(closePrice, period);
        Num k = series.numOf(multiplier);

        BollingerBandsMiddleIndicator middle = new BollingerBandsMiddleIndicator(sma);
        BollingerBandsUpperIndicator upper = new BollingerBandsUpperIndicator(middle, stdDev, k);
        BollingerBandsLowerIndicator lower = new BollingerBandsLowerIndicator(middle, stdDev, k);

        int end = series.getEndIndex();
        return new BandValues(
                valueAtEnd(upper.getValue(end)), valueAtEnd(middle.getValue(end)), valueAtEnd(lower.getValue(end)));
    }

    @Override
    public MacdValues macd(double[] closes, int fastPeriod, int slowPeriod, int signalPeriod) {
        BarSeries series = closeSeries(closes);
        MACDIndicator macd = new MACDIndicator(new ClosePriceIndicator(series), fastPeriod, slowPeriod);
        EMAIndicator signal = new EMAIndicator(macd, signalPeriod);

        int end = series.getEndIndex();
        return new MacdValues(valueAtEnd(macd.getValue(end)), valueAtEnd(signal.getValue(end)));
    }

    @Override
    public double atr(double[] highs, double[] lows, double[] closes, int period) {
        if (highs.length != closes.length || lows.length != closes.length) {
            throw new IllegalArgumentException("high, low and close series must have equal lengths");
        }
        BarSeries series = new BaseBarSeriesBuilder()
                .withName("atr")
                .withNumTypeOf(DoubleNum.class)
                .build();
        for (int i = 0; i < closes.length; i++) {
            series.addBar(SERIES_START.plusDays(i), closes[i], highs[i], lows[i], closes[i], 0);
        }
        ATRIndicator atr = new ATRIndicator(series, period);
        return valueAtEnd(atr.getValue(series.getEndIndex()));
    }

    private static BarSeries closeSeries(double[] closes) {
        if (closes.length == 0) {
            throw new IllegalArgumentException("price series must not be empty");
        }
        BarSeries series = new BaseBarSeriesBuilder()
                .withName("closes")
                .withNumTypeOf(DoubleNum.class)
                .build();
        for (int i = 0; i < closes.length; i++) {
            series.addBar(SERIES_START.plusDays(i), closes[i], closes[i], closes[i], closes[i], 0);
        }
        log.trace("Built {}-bar series for indicator evaluation", series.getBarCount());
        return series;
    }

    private static double valueAtEnd(Num value) {
        return value.isNaN() ? Double.NaN : value.doubleValue();
    }
}
