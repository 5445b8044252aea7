package com.optiontrader.api.controller;

import com.optiontrader.api.dto.request.DecisionRequest;
import com.optiontrader.api.dto.request.OptionQuotePayload;
import com.optiontrader.decision.TradeDecision;
import com.optiontrader.decision.TradeDecisionService;
import com.optiontrader.liquidity.OptionQuote;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runs the full decision pipeline for one underlying.
 */
@RestController
@RequestMapping("/api/decisions")
public class DecisionController {

    private final TradeDecisionService tradeDecisionService;

    public DecisionController(TradeDecisionService tradeDecisionService) {
        this.tradeDecisionService = tradeDecisionService;
    }

    @PostMapping
    public ResponseEntity<TradeDecision> decide(@Valid @RequestBody DecisionRequest request) {
        List<OptionQuote> quotes = request.getQuotes() == null
                ? List.of()
                : request.getQuotes().stream().map(OptionQuotePayload::toQuote).toList();

        TradeDecision decision = tradeDecisionService.decide(
                request.getSymbol(),
                request.getLookbackDays(),
                request.getVix(),
                request.getVix3m(),
                quotes,
                request.getRequiredValid());
        return ResponseEntity.ok(decision);
    }
}
