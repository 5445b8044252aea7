package com.optiontrader.api.controller;

import com.optiontrader.api.dto.request.DtePredictRequest;
import com.optiontrader.api.dto.request.DteTrainRequest;
import com.optiontrader.api.dto.request.TrainingSample;
import com.optiontrader.api.dto.response.DteModeResponse;
import com.optiontrader.api.dto.response.DtePredictionResponse;
import com.optiontrader.api.dto.response.DteTrainResponse;
import com.optiontrader.dte.DTEOptimizer;
import com.optiontrader.dte.DTEWindow;
import com.optiontrader.dte.RegimeFeatures;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Days-to-expiration selection.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/dte/predict} -- window for a volatility regime</li>
 *   <li>{@code POST /api/dte/train} -- fit and persist a new model from labelled regimes</li>
 *   <li>{@code GET /api/dte/mode} -- COLD (rule table) or WARM (trained model)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/dte")
public class DteController {

    private static final Logger log = LoggerFactory.getLogger(DteController.class);

    private final DTEOptimizer dteOptimizer;

    public DteController(DTEOptimizer dteOptimizer) {
        this.dteOptimizer = dteOptimizer;
    }

    @PostMapping("/predict")
    public ResponseEntity<DtePredictionResponse> predict(@RequestBody DtePredictRequest request) {
        RegimeFeatures features = request.getVixRatio() != null
                ? RegimeFeatures.of(request.getVixRatio(), request.getIvRank())
                : RegimeFeatures.fromVixLevels(request.getVix(), request.getVix3m(), request.getIvRank());

        DTEWindow window = dteOptimizer.predictOptimalDTE(features);
        return ResponseEntity.ok(DtePredictionResponse.builder()
                .minDte(window.minDte())
                .maxDte(window.maxDte())
                .vixRatio(features.vixRatio())
                .ivRank(features.ivRank())
                .termStructure(features.structureLabel())
                .mode(dteOptimizer.getMode())
                .build());
    }

    @PostMapping("/train")
    public ResponseEntity<DteTrainResponse> train(@Valid @RequestBody DteTrainRequest request) {
        List<TrainingSample> samples = request.getSamples();
        double[][] features = new double[samples.size()][];
        double[] targets = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            TrainingSample sample = samples.get(i);
            features[i] = new double[] {sample.getVixRatio(), sample.getIvRank()};
            targets[i] = sample.getDte();
        }

        log.info("DTE training requested with {} samples", samples.size());
        boolean trained = dteOptimizer.train(features, targets);
        return ResponseEntity.ok(new DteTrainResponse(trained, samples.size(), dteOptimizer.getMode()));
    }

    @GetMapping("/mode")
    public ResponseEntity<DteModeResponse> getMode() {
        return ResponseEntity.ok(
                new DteModeResponse(dteOptimizer.getMode(), dteOptimizer.getModelPath().toString()));
    }
}
