package com.optiontrader.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrainingSample {

    @NotNull(message = "vixRatio is required")
    private Double vixRatio;

    @NotNull(message = "ivRank is required")
    private Double ivRank;

    /** Days to expiration that performed best in this regime. */
    @NotNull(message = "dte is required")
    private Double dte;
}
