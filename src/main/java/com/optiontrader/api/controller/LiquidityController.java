package com.optiontrader.api.controller;

import com.optiontrader.api.dto.request.ChainRequest;
import com.optiontrader.api.dto.request.OptionQuotePayload;
import com.optiontrader.liquidity.ChainValidationResult;
import com.optiontrader.liquidity.OptionQuote;
import com.optiontrader.liquidity.SpreadValidator;
import com.optiontrader.liquidity.SpreadVerdict;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Bid/ask spread checks. A rejected quote is a normal 200 response with
 * {@code valid=false} and a reason.
 */
@RestController
@RequestMapping("/api/liquidity")
public class LiquidityController {

    private final SpreadValidator spreadValidator;

    public LiquidityController(SpreadValidator spreadValidator) {
        this.spreadValidator = spreadValidator;
    }

    @PostMapping("/spread")
    public ResponseEntity<SpreadVerdict> validateSpread(@Valid @RequestBody OptionQuotePayload request) {
        return ResponseEntity.ok(spreadValidator.validateOptionSpread(
                request.getBid(), request.getAsk(), request.getSymbol(), request.getStrike()));
    }

    @PostMapping("/chain")
    public ResponseEntity<ChainValidationResult> validateChain(@Valid @RequestBody ChainRequest request) {
        List<OptionQuote> quotes = request.getOptions().stream()
                .map(OptionQuotePayload::toQuote)
                .toList();
        ChainValidationResult result = request.getRequiredValid() != null
                ? spreadValidator.validateOptionsChain(quotes, request.getRequiredValid())
                : spreadValidator.validateOptionsChain(quotes);
        return ResponseEntity.ok(result);
    }
}
