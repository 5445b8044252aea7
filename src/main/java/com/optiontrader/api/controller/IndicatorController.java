package com.optiontrader.api.controller;

import com.optiontrader.api.dto.request.IndicatorAnalysisRequest;
import com.optiontrader.indicator.IndicatorSnapshot;
import com.optiontrader.indicator.TechnicalSignalEngine;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Technical analysis over caller-supplied prices.
 *
 * <p>Indicators that need more history than supplied come back null; a missing backend
 * yields a snapshot carrying only an error marker.
 */
@RestController
@RequestMapping("/api/indicators")
public class IndicatorController {

    private final TechnicalSignalEngine technicalSignalEngine;

    public IndicatorController(TechnicalSignalEngine technicalSignalEngine) {
        this.technicalSignalEngine = technicalSignalEngine;
    }

    @PostMapping("/analysis")
    public ResponseEntity<IndicatorSnapshot> analyze(@Valid @RequestBody IndicatorAnalysisRequest request) {
        return ResponseEntity.ok(
                technicalSignalEngine.analyze(request.getPrices(), request.getHighs(), request.getLows()));
    }
}
