/* (C)2026 */
package com.ammann.accuracy.enumeration;

/**
 * Classification of the relative variance between two observations of the same metric.
 *
 * <p>Each tier defines an inclusive upper bound. A variance is classified into the first
 * tier whose bound it does not exceed; anything above the HIGH bound is CRITICAL.
 */
public enum DiscrepancySeverity {
    /** Variance of 0.15 or below. */
    LOW(0.15, "Minor variance within acceptable range"),
    /** Variance of 0.30 or below. */
    MEDIUM(0.30, "Moderate variance requiring attention"),
    /** Variance of 0.50 or below. */
    HIGH(0.50, "Significant variance indicating data quality issues"),
    /** Variance above 0.50. */
    CRITICAL(Double.POSITIVE_INFINITY, "Critical variance suggesting data corruption or source issues");

    private final double upperBound;
    private final String explanation;

    DiscrepancySeverity(double upperBound, String explanation) {
        this.upperBound = upperBound;
        this.explanation = explanation;
    }

    /**
     * Returns the severity tier for a relative variance.
     *
     * @param variance relative variance, expected to be above the noise floor
     * @return the lowest tier whose inclusive upper bound covers the variance
     */
    public static DiscrepancySeverity fromVariance(double variance) {
        if (variance <= LOW.upperBound) return LOW;
        if (variance <= MEDIUM.upperBound) return MEDIUM;
        if (variance <= HIGH.upperBound) return HIGH;
        return CRITICAL;
    }

    public boolean isHighOrWorse() {
        return this == HIGH || this == CRITICAL;
    }

    public double getUpperBound() { return upperBound; }

    public String getExplanation() { return explanation; }
}
