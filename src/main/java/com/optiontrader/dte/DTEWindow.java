package com.optiontrader.dte;

/**
 * Recommended days-to-expiration range. Always within [21, 60] with min ≤ max.
 */
public record DTEWindow(int minDte, int maxDte) {

    public static final int FLOOR = 21;
    public static final int CEILING = 60;

    /** Backwardation or panic: short-dated, to capture the vega crush. */
    public static final DTEWindow SHORT = new DTEWindow(21, 30);

    /** Neutral regime, and the fallback whenever prediction fails. */
    public static final DTEWindow STANDARD = new DTEWindow(30, 45);

    /** Contango: long-dated, for theta collection. */
    public static final DTEWindow LONG = new DTEWindow(45, 60);

    public DTEWindow {
        if (minDte < FLOOR || maxDte > CEILING || minDte > maxDte) {
            throw new IllegalArgumentException(
                    "DTE window must satisfy " + FLOOR + " <= min <= max <= " + CEILING + ", got (" + minDte + ", "
                            + maxDte + ")");
        }
    }

    /**
     * Symmetric window around a center, clamped to [21, 60]. The center itself is clamped
     * first so the window is never inverted.
     */
    public static DTEWindow around(int center, int halfWidth) {
        int clamped = Math.max(FLOOR, Math.min(CEILING, center));
        return new DTEWindow(Math.max(FLOOR, clamped - halfWidth), Math.min(CEILING, clamped + halfWidth));
    }
}
