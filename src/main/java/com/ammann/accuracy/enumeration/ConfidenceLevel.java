/* (C)2026 */
package com.ammann.accuracy.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bucketed confidence derived from a hybrid score in the range [0.0, 1.0].
 *
 * <p>Each level defines an inclusive lower bound. A score is classified into the highest
 * level whose threshold it meets or exceeds.
 */
public enum ConfidenceLevel {
    VERY_HIGH(0.90, "very_high"),
    HIGH(0.75, "high"),
    MEDIUM(0.60, "medium"),
    LOW(0.40, "low"),
    VERY_LOW(0.0, "very_low");

    private final double threshold;
    private final String label;

    ConfidenceLevel(double threshold, String label) {
        this.threshold = threshold;
        this.label = label;
    }

    /**
     * Returns the confidence level corresponding to the given hybrid score.
     *
     * @param score hybrid score in the range [0.0, 1.0]
     * @return the highest level whose threshold the score meets
     */
    public static ConfidenceLevel fromScore(double score) {
        if (score >= VERY_HIGH.threshold) return VERY_HIGH;
        if (score >= HIGH.threshold) return HIGH;
        if (score >= MEDIUM.threshold) return MEDIUM;
        if (score >= LOW.threshold) return LOW;
        return VERY_LOW;
    }

    public double getThreshold() { return threshold; }

    @JsonValue
    public String getLabel() { return label; }
}
