package com.optiontrader.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.optiontrader.indicator.BandSignal;
import com.optiontrader.indicator.BollingerBands;
import com.optiontrader.indicator.IndicatorBackend;
import com.optiontrader.indicator.IndicatorConfig;
import com.optiontrader.indicator.IndicatorSnapshot;
import com.optiontrader.indicator.MacdResult;
import com.optiontrader.indicator.SignalDirection;
import com.optiontrader.indicator.SignalTag;
import com.optiontrader.indicator.Ta4jIndicatorBackend;
import com.optiontrader.indicator.TechnicalSignalEngine;
import com.optiontrader.marketdata.PriceBar;
import com.optiontrader.marketdata.PriceSeries;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for TechnicalSignalEngine. Trend scenarios run on the ta4j backend;
 * threshold and failure scenarios use a mocked backend.
 */
@ExtendWith(MockitoExtension.class)
class TechnicalSignalEngineTest {

    private IndicatorConfig indicatorConfig;

    @BeforeEach
    void setUp() {
        indicatorConfig = new IndicatorConfig();
    }

    private static List<Double> linear(int count, double start, double step) {
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            prices.add(start + i * step);
        }
        return prices;
    }

    // ==============================
    // TA4J BACKEND
    // ==============================

    @Nested
    @DisplayName("With ta4j Backend")
    class WithTa4j {

        private TechnicalSignalEngine engine;

        @BeforeEach
        void setUp() {
            engine = new TechnicalSignalEngine(indicatorConfig, Optional.of(new Ta4jIndicatorBackend()));
        }

        @Test
        @DisplayName("Steady uptrend is overbought and bullish")
        void uptrend() {
            IndicatorSnapshot snapshot = engine.analyze(linear(60, 100, 1), null, null);

            assertThat(snapshot.isAvailable()).isTrue();
            assertThat(snapshot.getRsi()).isGreaterThan(70.0);
            assertThat(snapshot.getBollinger().signal()).isEqualTo(BandSignal.OVERBOUGHT);
            assertThat(snapshot.getMacd().trend()).isEqualTo(SignalDirection.BULLISH);
            assertThat(snapshot.getSignals())
                    .containsExactly(SignalTag.RSI_OVERBOUGHT, SignalTag.BB_OVERBOUGHT, SignalTag.MACD_BULLISH);
            assertThat(snapshot.getOverallSignal()).isEqualTo(SignalDirection.BULLISH);
        }

        @Test
        @DisplayName("Steady downtrend is oversold and bearish")
        void downtrend() {
            IndicatorSnapshot snapshot = engine.analyze(linear(60, 200, -1), null, null);

            assertThat(snapshot.getRsi()).isLessThan(30.0);
            assertThat(snapshot.getSignals())
                    .containsExactly(SignalTag.RSI_OVERSOLD, SignalTag.BB_OVERSOLD, SignalTag.MACD_BEARISH);
            assertThat(snapshot.getOverallSignal()).isEqualTo(SignalDirection.BEARISH);
        }

        @Test
        @DisplayName("RSI needs period + 1 prices")
        void rsiWarmUp() {
            assertThat(engine.calculateRsi(linear(14, 100, 1))).isNull();
            assertThat(engine.calculateRsi(linear(15, 100, 1))).isNotNull();
        }

        @Test
        @DisplayName("MACD needs slow + signal prices")
        void macdWarmUp() {
            assertThat(engine.calculateMacd(linear(34, 100, 1))).isNull();
            assertThat(engine.calculateMacd(linear(35, 100, 1))).isNotNull();
        }

        @Test
        @DisplayName("Short series keeps the indicators it can compute")
        void partialSnapshot() {
            IndicatorSnapshot snapshot = engine.analyze(linear(25, 100, 1), null, null);

            assertThat(snapshot.isAvailable()).isTrue();
            assertThat(snapshot.getRsi()).isNotNull();
            assertThat(snapshot.getBollinger()).isNotNull();
            assertThat(snapshot.getMacd()).isNull();
            assertThat(snapshot.getSignals()).doesNotContain(
                    SignalTag.MACD_BULLISH, SignalTag.MACD_BEARISH, SignalTag.MACD_NEUTRAL);
            assertThat(snapshot.getOverallSignal()).isEqualTo(SignalDirection.NEUTRAL);
        }

        @Test
        @DisplayName("ATR of bars with a constant two-point range is 2")
        void atrConstantRange() {
            List<Double> closes = linear(30, 100, 1);
            List<Double> highs = closes.stream().map(c -> c + 1).toList();
            List<Double> lows = closes.stream().map(c -> c - 1).toList();

            assertThat(engine.calculateAtr(highs, lows, closes)).isCloseTo(2.0, within(1e-9));
        }

        @Test
        @DisplayName("ATR rejects misaligned series")
        void atrMisaligned() {
            List<Double> closes = linear(30, 100, 1);

            assertThat(engine.calculateAtr(linear(29, 101, 1), linear(30, 99, 1), closes)).isNull();
        }

        @Test
        @DisplayName("Analyzes a stored series with highs and lows")
        void analyzesPriceSeries() {
            List<PriceBar> bars = new ArrayList<>();
            LocalDate start = LocalDate.of(2024, 1, 1);
            for (int i = 0; i < 40; i++) {
                double close = 100 + i;
                bars.add(new PriceBar(start.plusDays(i), close, close + 1, close - 1));
            }

            IndicatorSnapshot snapshot = engine.analyze(new PriceSeries("SPY", bars));

            assertThat(snapshot.getAtr()).isCloseTo(2.0, within(1e-9));
            assertThat(snapshot.getMacd()).isNotNull();
        }

        @Test
        @DisplayName("Close-only series has no ATR")
        void closeOnlyHasNoAtr() {
            List<PriceBar> bars = new ArrayList<>();
            LocalDate start = LocalDate.of(2024, 1, 1);
            for (int i = 0; i < 40; i++) {
                bars.add(PriceBar.ofClose(start.plusDays(i), 100 + i));
            }

            assertThat(engine.analyze(new PriceSeries("SPY", bars)).getAtr()).isNull();
        }
    }

    // ==============================
    // MOCKED BACKEND
    // ==============================

    @Nested
    @DisplayName("With Mocked Backend")
    class WithMockedBackend {

        @Mock
        private IndicatorBackend backend;

        private TechnicalSignalEngine engine;

        @BeforeEach
        void setUp() {
            engine = new TechnicalSignalEngine(indicatorConfig, Optional.of(backend));
        }

        private void givenIndicators(double rsi, IndicatorBackend.BandValues bands, IndicatorBackend.MacdValues macd) {
            when(backend.rsi(any(double[].class), anyInt())).thenReturn(rsi);
            when(backend.bollinger(any(double[].class), anyInt(), anyDouble())).thenReturn(bands);
            when(backend.macd(any(double[].class), anyInt(), anyInt(), anyInt())).thenReturn(macd);
        }

        @Test
        @DisplayName("RSI of exactly 0 counts as oversold")
        void rsiZeroIsOversold() {
            givenIndicators(
                    0.0,
                    new IndicatorBackend.BandValues(110, 100, 90),
                    new IndicatorBackend.MacdValues(0.0, 0.0));

            IndicatorSnapshot snapshot = engine.analyze(linear(40, 100, 0), null, null);

            assertThat(snapshot.getRsi()).isEqualTo(0.0);
            assertThat(snapshot.getSignals()).contains(SignalTag.RSI_OVERSOLD);
        }

        @Test
        @DisplayName("RSI at the thresholds adds no RSI tag")
        void rsiAtThresholds() {
            givenIndicators(
                    70.0,
                    new IndicatorBackend.BandValues(110, 100, 90),
                    new IndicatorBackend.MacdValues(0.0, 0.0));

            IndicatorSnapshot snapshot = engine.analyze(linear(40, 100, 0), null, null);

            assertThat(snapshot.getSignals())
                    .containsExactly(SignalTag.BB_NEUTRAL, SignalTag.MACD_NEUTRAL)
                    .doesNotContain(SignalTag.RSI_OVERBOUGHT, SignalTag.RSI_OVERSOLD);
        }

        @Test
        @DisplayName("Overall signal follows MACD even against RSI and bands")
        void overallFollowsMacd() {
            // price 100 sits at the top of the bands
            givenIndicators(
                    85.0,
                    new IndicatorBackend.BandValues(100, 95, 90),
                    new IndicatorBackend.MacdValues(-1.0, 0.5));

            IndicatorSnapshot snapshot = engine.analyze(linear(40, 100, 0), null, null);

            assertThat(snapshot.getSignals())
                    .containsExactly(SignalTag.RSI_OVERBOUGHT, SignalTag.BB_OVERBOUGHT, SignalTag.MACD_BEARISH);
            assertThat(snapshot.getOverallSignal()).isEqualTo(SignalDirection.BEARISH);
        }

        @Test
        @DisplayName("Backend NaN becomes null")
        void nanBecomesNull() {
            when(backend.rsi(any(double[].class), anyInt())).thenReturn(Double.NaN);

            assertThat(engine.calculateRsi(linear(20, 100, 1))).isNull();
        }

        @Test
        @DisplayName("Backend exception becomes null")
        void exceptionBecomesNull() {
            when(backend.macd(any(double[].class), anyInt(), anyInt(), anyInt()))
                    .thenThrow(new IllegalStateException("boom"));

            MacdResult macd = engine.calculateMacd(linear(40, 100, 1));

            assertThat(macd).isNull();
        }

        @Test
        @DisplayName("Insufficient data never reaches the backend")
        void shortSeriesSkipsBackend() {
            BollingerBands bands = engine.calculateBollingerBands(linear(19, 100, 1));

            assertThat(bands).isNull();
            verifyNoInteractions(backend);
        }
    }

    // ==============================
    // NO BACKEND
    // ==============================

    @Nested
    @DisplayName("Without Backend")
    class WithoutBackend {

        @Test
        @DisplayName("Analysis carries only the unavailable marker")
        void unavailableMarker() {
            TechnicalSignalEngine engine = new TechnicalSignalEngine(indicatorConfig, Optional.empty());

            IndicatorSnapshot snapshot = engine.analyze(linear(60, 100, 1), null, null);

            assertThat(engine.isBackendAvailable()).isFalse();
            assertThat(snapshot.isAvailable()).isFalse();
            assertThat(snapshot.getError()).isEqualTo("indicator backend not available");
            assertThat(snapshot.getRsi()).isNull();
            assertThat(snapshot.getBollinger()).isNull();
            assertThat(snapshot.getMacd()).isNull();
            assertThat(snapshot.getSignals()).isEmpty();
            assertThat(snapshot.getOverallSignal()).isEqualTo(SignalDirection.NEUTRAL);
        }

        @Test
        @DisplayName("Individual indicators return null")
        void individualIndicatorsNull() {
            TechnicalSignalEngine engine = new TechnicalSignalEngine(indicatorConfig, Optional.empty());

            assertThat(engine.calculateRsi(linear(60, 100, 1))).isNull();
            assertThat(engine.calculateMacd(linear(60, 100, 1))).isNull();
        }
    }
}
