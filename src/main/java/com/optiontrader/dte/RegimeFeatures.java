package com.optiontrader.dte;

/**
 * Volatility-regime inputs to the DTE optimizer.
 *
 * <p>A ratio that cannot be classified (missing, zero, negative or not finite) is labelled
 * UNKNOWN and replaced by the neutral 1.0, so the label and the value the rules see always
 * agree. A missing IV rank becomes 50; a present IV rank is kept as given, even when out
 * of range.
 */
public record RegimeFeatures(double vixRatio, TermStructure structureLabel, double ivRank) {

    public static final double DEFAULT_VIX_RATIO = 1.0;
    public static final double DEFAULT_IV_RANK = 50.0;

    /** Builds features from a precomputed term-structure ratio. */
    public static RegimeFeatures of(Double vixRatio, Double ivRank) {
        TermStructure label = TermStructure.classify(vixRatio);
        return new RegimeFeatures(
                label == TermStructure.UNKNOWN ? DEFAULT_VIX_RATIO : vixRatio,
                label,
                ivRank != null ? ivRank : DEFAULT_IV_RANK);
    }

    /** Builds features from the spot and three-month volatility index levels. */
    public static RegimeFeatures fromVixLevels(Double vix, Double vix3m, Double ivRank) {
        Double ratio = vix != null && vix3m != null && vix3m > 0 ? vix / vix3m : null;
        return of(ratio, ivRank);
    }

    /**
     * Feature vector fed to the regressor: [vixRatio, ivRank].
     *
     * @throws IllegalArgumentException if either value is not finite
     */
    public double[] toFeatureVector() {
        if (!Double.isFinite(vixRatio) || !Double.isFinite(ivRank)) {
            throw new IllegalArgumentException(
                    "Regime features must be finite, got vixRatio=" + vixRatio + ", ivRank=" + ivRank);
        }
        return new double[] {vixRatio, ivRank};
    }
}
