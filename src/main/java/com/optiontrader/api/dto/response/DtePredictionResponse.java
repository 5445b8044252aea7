package com.optiontrader.api.dto.response;

import com.optiontrader.dte.OptimizerMode;
import com.optiontrader.dte.TermStructure;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class DtePredictionResponse {
    private final int minDte;
    private final int maxDte;
    private final double vixRatio;
    private final double ivRank;
    private final TermStructure termStructure;
    private final OptimizerMode mode;
}
