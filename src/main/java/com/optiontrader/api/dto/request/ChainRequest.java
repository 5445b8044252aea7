package com.optiontrader.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChainRequest {

    /** May be empty; an empty chain is simply invalid. */
    @NotNull(message = "options is required")
    private List<@NotNull(message = "options must not contain null entries") @Valid OptionQuotePayload> options;

    /** Defaults to {@code optiontrader.liquidity.required-valid} when absent. */
    @Positive(message = "requiredValid must be positive")
    private Integer requiredValid;
}
