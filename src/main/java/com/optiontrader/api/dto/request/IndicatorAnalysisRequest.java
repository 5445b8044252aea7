package com.optiontrader.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorAnalysisRequest {

    /** Closes, oldest first. */
    @NotEmpty(message = "prices must not be empty")
    private List<Double> prices;

    /** Optional, aligned with prices. */
    private List<Double> highs;

    /** Optional, aligned with prices. */
    private List<Double> lows;
}
