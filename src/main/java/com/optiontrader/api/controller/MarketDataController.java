package com.optiontrader.api.controller;

import com.optiontrader.api.dto.request.BarPayload;
import com.optiontrader.api.dto.request.BarsRequest;
import com.optiontrader.exception.UnknownSymbolException;
import com.optiontrader.marketdata.InMemoryMarketDataProvider;
import com.optiontrader.marketdata.PriceBar;
import com.optiontrader.marketdata.PriceSeries;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Loads and reads the daily price histories the engines compute from.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code PUT /api/market-data/{symbol}/bars} -- replace a symbol's history</li>
 *   <li>{@code GET /api/market-data/{symbol}/bars} -- the stored history, oldest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/market-data")
public class MarketDataController {

    private final InMemoryMarketDataProvider marketDataProvider;

    public MarketDataController(InMemoryMarketDataProvider marketDataProvider) {
        this.marketDataProvider = marketDataProvider;
    }

    @PutMapping("/{symbol}/bars")
    public ResponseEntity<List<PriceBar>> storeBars(
            @PathVariable String symbol, @Valid @RequestBody BarsRequest request) {
        List<PriceBar> bars = request.getBars().stream()
                .map(MarketDataController::toBar)
                .toList();
        PriceSeries stored = marketDataProvider.store(symbol, bars);
        return ResponseEntity.ok(stored.getBars());
    }

    @GetMapping("/{symbol}/bars")
    public ResponseEntity<List<PriceBar>> getBars(@PathVariable String symbol) {
        PriceSeries series = marketDataProvider
                .find(symbol)
                .orElseThrow(() -> new UnknownSymbolException(symbol));
        return ResponseEntity.ok(series.getBars());
    }

    private static PriceBar toBar(BarPayload payload) {
        return new PriceBar(payload.getDate(), payload.getClose(), payload.getHigh(), payload.getLow());
    }
}
