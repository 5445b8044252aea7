package com.optiontrader.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class IvRankResponse {
    private final String symbol;
    private final int lookbackDays;
    private final double ivRank;
}
