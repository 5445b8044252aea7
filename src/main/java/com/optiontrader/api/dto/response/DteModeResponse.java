package com.optiontrader.api.dto.response;

import com.optiontrader.dte.OptimizerMode;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DteModeResponse {
    private final OptimizerMode mode;
    private final String modelPath;
}
