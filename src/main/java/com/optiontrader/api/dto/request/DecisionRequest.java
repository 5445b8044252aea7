package com.optiontrader.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DecisionRequest {

    @NotBlank(message = "symbol is required")
    private String symbol;

    @Positive(message = "lookbackDays must be positive")
    private Integer lookbackDays;

    private Double vix;
    private Double vix3m;

    private List<@NotNull(message = "quotes must not contain null entries") @Valid OptionQuotePayload> quotes;

    @Positive(message = "requiredValid must be positive")
    private Integer requiredValid;
}
