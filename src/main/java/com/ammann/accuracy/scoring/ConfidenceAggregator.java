/* (C)2026 */
package com.ammann.accuracy.scoring;

import com.ammann.accuracy.dto.ConfidenceScoreDTO;
import com.ammann.accuracy.dto.DiscrepancyDTO;
import com.ammann.accuracy.enumeration.DiscrepancySeverity;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;

/**
 * Combines the four component scores into the overall confidence and decides whether an
 * observation counts as accurate.
 *
 * <p>{@code overall} has no state of its own: it is recomputed from the components with
 * fixed weights, so the same components always give the same overall score.
 */
@ApplicationScoped
public class ConfidenceAggregator {

    static final double FRESHNESS_WEIGHT = 0.30;
    static final double CONSISTENCY_WEIGHT = 0.35;
    static final double RELIABILITY_WEIGHT = 0.25;
    static final double COMPLETENESS_WEIGHT = 0.10;

    static final int ACCURACY_THRESHOLD = 70;
    static final double MAX_HIGH_SEVERITY_RATIO = 0.5;

    public ConfidenceScoreDTO aggregate(
            int freshness, int consistency, int reliability, double completeness) {
        return new ConfidenceScoreDTO(
                overall(freshness, consistency, reliability, completeness),
                freshness,
                consistency,
                reliability,
                completeness);
    }

    /**
     * @return weighted, rounded overall score in [0, 100]
     */
    public int overall(int freshness, int consistency, int reliability, double completeness) {
        long weighted =
                Math.round(
                        freshness * FRESHNESS_WEIGHT
                                + consistency * CONSISTENCY_WEIGHT
                                + reliability * RELIABILITY_WEIGHT
                                + completeness * COMPLETENESS_WEIGHT);
        return (int) Math.max(0, Math.min(100, weighted));
    }

    /**
     * An observation is accurate when the overall score reaches 70, no discrepancy is
     * CRITICAL and fewer than half of the discrepancies are HIGH or CRITICAL.
     *
     * @param overall overall confidence
     * @param discrepancies detected discrepancies, may be empty
     * @return accuracy verdict
     */
    public boolean isAccurate(int overall, List<DiscrepancyDTO> discrepancies) {
        if (overall < ACCURACY_THRESHOLD) {
            return false;
        }

        boolean anyCritical =
                discrepancies.stream()
                        .anyMatch(d -> d.severity() == DiscrepancySeverity.CRITICAL);
        if (anyCritical) {
            return false;
        }

        long highOrWorse = discrepancies.stream().filter(d -> d.severity().isHighOrWorse()).count();
        double highSeverityRatio = (double) highOrWorse / Math.max(discrepancies.size(), 1);

        return highSeverityRatio < MAX_HIGH_SEVERITY_RATIO;
    }
}
