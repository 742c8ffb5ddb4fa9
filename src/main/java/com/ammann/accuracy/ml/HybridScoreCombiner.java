/* (C)2026 */
package com.ammann.accuracy.ml;

import com.ammann.accuracy.enumeration.ConfidenceLevel;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Blends the heuristic and model scores and discounts the blend by the anomaly score.
 */
@ApplicationScoped
public class HybridScoreCombiner {

    static final double TRADITIONAL_WEIGHT = 0.4;
    static final double ML_WEIGHT = 0.6;

    /**
     * @return {@code (0.4 * traditional + 0.6 * ml) * anomaly}, clamped to [0, 1]
     */
    public double combine(double traditionalScore, double mlScore, double anomalyScore) {
        double base = traditionalScore * TRADITIONAL_WEIGHT + mlScore * ML_WEIGHT;
        double adjusted = base * anomalyScore;
        if (Double.isNaN(adjusted)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, adjusted));
    }

    public ConfidenceLevel level(double hybridScore) {
        return ConfidenceLevel.fromScore(hybridScore);
    }
}
