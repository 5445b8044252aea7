package com.optiontrader.liquidity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Liquidity gate run on each option quote immediately before committing to a contract.
 *
 * <p>Checks, in order, stopping at the first failure:
 * <ol>
 *   <li>bid below the minimum bid</li>
 *   <li>non-positive bid or ask</li>
 *   <li>bid above ask (crossed market, treated as a data error)</li>
 *   <li>spread as a fraction of mid above the percentage limit</li>
 *   <li>absolute spread above the dollar limit</li>
 * </ol>
 *
 * <p>Bad quotes produce an invalid verdict with a reason, never an exception.
 */
@Service
@EnableConfigurationProperties(LiquidityConfig.class)
public class SpreadValidator {

    private static final Logger log = LoggerFactory.getLogger(SpreadValidator.class);

    private final LiquidityConfig liquidityConfig;

    public SpreadValidator(LiquidityConfig liquidityConfig) {
        this.liquidityConfig = liquidityConfig;
    }

    public SpreadVerdict validateOptionSpread(double bid, double ask) {
        return validateOptionSpread(bid, ask, null, null);
    }

    /**
     * Checks one quote against the configured limits.
     *
     * @param symbol option symbol, for logging only
     * @param strike strike, for logging only
     */
    public SpreadVerdict validateOptionSpread(double bid, double ask, String symbol, Double strike) {
        double minBid = liquidityConfig.getMinBid();
        if (bid < minBid) {
            return SpreadVerdict.rejected(
                    SpreadReason.BID_TOO_LOW, format("Bid too low (%.2f < %.2f)", bid, minBid), bid, ask);
        }

        if (bid <= 0 || ask <= 0) {
            return SpreadVerdict.rejected(
                    SpreadReason.INVALID_PRICES, format("Invalid prices (bid=%.2f, ask=%.2f)", bid, ask), bid, ask);
        }

        if (bid > ask) {
            return SpreadVerdict.rejected(
                    SpreadReason.CROSSED_MARKET, format("Bid > Ask (%.2f > %.2f) - data error", bid, ask), bid, ask);
        }

        double mid = (bid + ask) / 2;
        double spreadDollars = ask - bid;
        double spreadPct = mid > 0 ? spreadDollars / mid : Double.POSITIVE_INFINITY;

        double maxSpreadPct = liquidityConfig.getMaxSpreadPct();
        if (spreadPct > maxSpreadPct) {
            return SpreadVerdict.rejected(
                    SpreadReason.SPREAD_TOO_WIDE_PCT,
                    format("Spread too wide (%.1f%% > %.1f%%)", spreadPct * 100, maxSpreadPct * 100),
                    bid,
                    ask,
                    mid,
                    spreadPct,
                    spreadDollars);
        }

        double maxSpreadDollars = liquidityConfig.getMaxSpreadDollars();
        if (spreadDollars > maxSpreadDollars) {
            return SpreadVerdict.rejected(
                    SpreadReason.SPREAD_TOO_WIDE_DOLLARS,
                    format("Spread too wide ($%.2f > $%.2f)", spreadDollars, maxSpreadDollars),
                    bid,
                    ask,
                    mid,
                    spreadPct,
                    spreadDollars);
        }

        log.debug(
                "Spread OK: {} {} - Bid={}, Ask={}, Mid={}, Spread={} (${})",
                symbol != null ? symbol : "",
                strike != null ? strike : "",
                format("%.2f", bid),
                format("%.2f", ask),
                format("%.2f", mid),
                format("%.1f%%", spreadPct * 100),
                format("%.2f", spreadDollars));
        return SpreadVerdict.accepted(bid, ask, mid, spreadPct, spreadDollars);
    }

    public ChainValidationResult validateOptionsChain(List<OptionQuote> options) {
        return validateOptionsChain(options, liquidityConfig.getRequiredValid());
    }

    /**
     * Checks every quote independently and partitions them into valid and invalid.
     * A bad quote never stops the others from being evaluated; the input is not modified.
     *
     * @param requiredValid valid quotes needed for the chain to be tradable
     */
    public ChainValidationResult validateOptionsChain(List<OptionQuote> options, int requiredValid) {
        List<ValidatedQuote> validOptions = new ArrayList<>();
        List<ValidatedQuote> invalidOptions = new ArrayList<>();

        for (OptionQuote option : options) {
            SpreadVerdict verdict =
                    validateOptionSpread(option.bid(), option.ask(), option.symbol(), option.strike());
            if (verdict.isValid()) {
                validOptions.add(new ValidatedQuote(option, verdict));
            } else {
                invalidOptions.add(new ValidatedQuote(option, verdict));
            }
        }

        ChainValidationResult result = new ChainValidationResult(requiredValid, validOptions, invalidOptions);
        if (!result.isValid()) {
            log.info(
                    "Option chain not tradable: {} valid of {} quotes, {} required",
                    result.getValidCount(),
                    options.size(),
                    requiredValid);
        }
        return result;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
