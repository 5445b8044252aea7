package com.optiontrader.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Replaces the stored daily history of a symbol. Bars may arrive in any order but
 * dates must be unique.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BarsRequest {

    @NotEmpty(message = "bars must not be empty")
    @Valid
    private List<BarPayload> bars;
}
