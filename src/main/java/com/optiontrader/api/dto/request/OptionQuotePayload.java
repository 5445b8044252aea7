package com.optiontrader.api.dto.request;

import com.optiontrader.liquidity.OptionQuote;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptionQuotePayload {

    @NotNull(message = "bid is required")
    private Double bid;

    @NotNull(message = "ask is required")
    private Double ask;

    private String symbol;
    private Double strike;

    public OptionQuote toQuote() {
        return new OptionQuote(symbol, strike, bid, ask);
    }
}
