package com.optiontrader.indicator;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * One technical analysis of a price series. Recomputed on every request.
 *
 * <p>Individual indicators are null when the series is too short for them. When the
 * indicator backend is missing the snapshot carries only {@link #error}, with no partial
 * values, an empty tag list and a NEUTRAL overall signal.
 */
@Getter
@Builder
public class IndicatorSnapshot {

    private final Double rsi;
    private final BollingerBands bollinger;
    private final MacdResult macd;

    /** Present only when highs and lows were supplied. */
    private final Double atr;

    private final List<SignalTag> signals;

    /** Follows the MACD trend only; RSI and band tags never override it. */
    private final SignalDirection overallSignal;

    private final String error;

    public static IndicatorSnapshot unavailable(String reason) {
        return IndicatorSnapshot.builder()
                .signals(List.of())
                .overallSignal(SignalDirection.NEUTRAL)
                .error(reason)
                .build();
    }

    public boolean isAvailable() {
        return error == null;
    }
}
