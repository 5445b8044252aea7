package com.optiontrader.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One daily bar. High and low are optional; ATR is skipped when any bar lacks them. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BarPayload {

    @NotNull(message = "date is required")
    private LocalDate date;

    @NotNull(message = "close is required")
    @Positive(message = "close must be positive")
    private Double close;

    private Double high;
    private Double low;
}
