package com.optiontrader.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Regime inputs for a DTE prediction. Either {@code vixRatio} directly or the two index
 * levels {@code vix} and {@code vix3m}; a direct ratio wins when both are given. Missing
 * values fall back to the neutral defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DtePredictRequest {
    private Double vixRatio;
    private Double vix;
    private Double vix3m;
    private Double ivRank;
}
