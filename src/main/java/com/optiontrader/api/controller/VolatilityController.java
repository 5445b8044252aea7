package com.optiontrader.api.controller;

import com.optiontrader.api.dto.response.IvRankResponse;
import com.optiontrader.exception.InsufficientHistoryException;
import com.optiontrader.exception.InvalidRequestException;
import com.optiontrader.volatility.IVRankEngine;
import com.optiontrader.volatility.VolatilityConfig;
import com.optiontrader.volatility.VolatilityRecord;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Volatility rank queries.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/volatility/{symbol}/rank} -- rank only, optional {@code lookbackDays}</li>
 *   <li>{@code GET /api/volatility/{symbol}} -- full record with series statistics</li>
 *   <li>{@code DELETE /api/volatility/cache} -- drop every cached record</li>
 * </ul>
 *
 * <p>A symbol without enough history answers 404.
 */
@RestController
@RequestMapping("/api/volatility")
public class VolatilityController {

    private final IVRankEngine ivRankEngine;
    private final VolatilityConfig volatilityConfig;

    public VolatilityController(IVRankEngine ivRankEngine, VolatilityConfig volatilityConfig) {
        this.ivRankEngine = ivRankEngine;
        this.volatilityConfig = volatilityConfig;
    }

    @GetMapping("/{symbol}/rank")
    public ResponseEntity<IvRankResponse> getRank(
            @PathVariable String symbol, @RequestParam(required = false) Integer lookbackDays) {
        int lookback = resolveLookback(lookbackDays);
        Double rank = ivRankEngine.getIVRank(symbol, lookback);
        if (rank == null) {
            throw new InsufficientHistoryException(symbol, lookback);
        }
        return ResponseEntity.ok(new IvRankResponse(symbol, lookback, rank));
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<VolatilityRecord> getDetails(
            @PathVariable String symbol, @RequestParam(required = false) Integer lookbackDays) {
        int lookback = resolveLookback(lookbackDays);
        VolatilityRecord record = ivRankEngine.getIVDetails(symbol, lookback);
        if (record == null) {
            throw new InsufficientHistoryException(symbol, lookback);
        }
        return ResponseEntity.ok(record);
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        ivRankEngine.clearCache();
        return ResponseEntity.noContent().build();
    }

    private int resolveLookback(Integer lookbackDays) {
        if (lookbackDays == null) {
            return volatilityConfig.getLookbackDays();
        }
        if (lookbackDays <= 0) {
            throw new InvalidRequestException(
                    "lookbackDays must be positive", Map.<String, Object>of("lookbackDays", lookbackDays));
        }
        return lookbackDays;
    }
}
