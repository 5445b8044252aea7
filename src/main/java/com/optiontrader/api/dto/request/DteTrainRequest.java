package com.optiontrader.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DteTrainRequest {

    @NotEmpty(message = "samples must not be empty")
    @Valid
    private List<TrainingSample> samples;
}
