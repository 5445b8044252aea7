package com.optiontrader.liquidity;

import lombok.Getter;

/**
 * Result of checking one quote's bid/ask spread.
 *
 * <p>Valid verdicts always carry PROCEED and the mid, percentage and dollar spread.
 * Quotes rejected before the spread is computed (low bid, bad prices, crossed market)
 * leave those three fields null.
 */
@Getter
public class SpreadVerdict {

    private final boolean valid;
    private final SpreadReason reasonCode;

    /** Human-readable explanation, with the offending values. */
    private final String reason;

    private final double bid;
    private final double ask;
    private final Double mid;
    private final Double spreadPct;
    private final Double spreadDollars;
    private final SpreadAction action;

    private SpreadVerdict(
            boolean valid,
            SpreadReason reasonCode,
            String reason,
            double bid,
            double ask,
            Double mid,
            Double spreadPct,
            Double spreadDollars) {
        this.valid = valid;
        this.reasonCode = reasonCode;
        this.reason = reason;
        this.bid = bid;
        this.ask = ask;
        this.mid = mid;
        this.spreadPct = spreadPct;
        this.spreadDollars = spreadDollars;
        this.action = valid ? SpreadAction.PROCEED : SpreadAction.SKIP;
    }

    public static SpreadVerdict accepted(double bid, double ask, double mid, double spreadPct, double spreadDollars) {
        return new SpreadVerdict(
                true, SpreadReason.ACCEPTABLE, "Spread acceptable", bid, ask, mid, spreadPct, spreadDollars);
    }

    /** Rejection before the spread is measured. */
    public static SpreadVerdict rejected(SpreadReason reasonCode, String reason, double bid, double ask) {
        return new SpreadVerdict(false, reasonCode, reason, bid, ask, null, null, null);
    }

    /** Rejection on the measured spread. */
    public static SpreadVerdict rejected(
            SpreadReason reasonCode, String reason, double bid, double ask, double mid, double spreadPct, double spreadDollars) {
        return new SpreadVerdict(false, reasonCode, reason, bid, ask, mid, spreadPct, spreadDollars);
    }

    @Override
    public String toString() {
        return reasonCode + ": " + reason;
    }
}
