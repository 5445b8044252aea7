package com.optiontrader.api.dto.response;

import com.optiontrader.dte.OptimizerMode;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DteTrainResponse {

    /** False when training or persisting failed and the previous model is still active. */
    private final boolean trained;

    private final int samples;
    private final OptimizerMode mode;
}
