package com.optiontrader.liquidity;

import java.util.List;
import lombok.Getter;

/**
 * Spread check over a set of option quotes.
 *
 * <p>The chain is valid when at least {@code required} quotes pass. Both lists keep the
 * input order.
 */
@Getter
public class ChainValidationResult {

    private final boolean valid;
    private final int required;
    private final List<ValidatedQuote> validOptions;
    private final List<ValidatedQuote> invalidOptions;

    public ChainValidationResult(int required, List<ValidatedQuote> validOptions, List<ValidatedQuote> invalidOptions) {
        this.required = required;
        this.validOptions = List.copyOf(validOptions);
        this.invalidOptions = List.copyOf(invalidOptions);
        this.valid = this.validOptions.size() >= required;
    }

    public int getValidCount() {
        return validOptions.size();
    }

    public int getInvalidCount() {
        return invalidOptions.size();
    }
}
