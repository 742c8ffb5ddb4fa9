/* (C)2026 */
package com.ammann.accuracy.scoring;

import com.ammann.accuracy.dto.DataPointDTO;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.OptionalDouble;
import org.jboss.logging.Logger;

/**
 * Scores agreement between a primary observation and observations of the same metric
 * from other sources.
 *
 * <p>Only comparisons at most 48 hours old count. With no usable comparison the score is
 * the neutral 50, meaning "no evidence either way" rather than poor consistency. A zero
 * primary value leaves every comparison unusable (see {@link RelativeVariance}).
 */
@ApplicationScoped
public class ConsistencyScorer {

    private static final Logger LOG = Logger.getLogger(ConsistencyScorer.class);

    public static final int NEUTRAL_SCORE = 50;
    static final double MAX_COMPARISON_AGE_HOURS = 48.0;

    private final FreshnessScorer freshnessScorer;

    @Inject
    public ConsistencyScorer(FreshnessScorer freshnessScorer) {
        this.freshnessScorer = freshnessScorer;
    }

    /**
     * @param primary validated primary observation
     * @param compare validated comparison observations, may be empty
     * @return consistency in [0, 100]
     */
    public int score(DataPointDTO primary, List<DataPointDTO> compare) {
        if (compare == null || compare.isEmpty()) {
            return NEUTRAL_SCORE;
        }

        double totalVariance = 0.0;
        int validComparisons = 0;

        for (DataPointDTO comparePoint : compare) {
            if (freshnessScorer.ageInHours(comparePoint.timestamp()) > MAX_COMPARISON_AGE_HOURS) {
                continue;
            }

            OptionalDouble variance = RelativeVariance.between(primary.value(), comparePoint.value());
            if (variance.isEmpty()) {
                continue;
            }

            totalVariance += variance.getAsDouble();
            validComparisons++;
        }

        if (validComparisons == 0) {
            LOG.debugf(
                    "No usable comparison for primary %s (%d candidates), returning neutral score",
                    primary.id(), compare.size());
            return NEUTRAL_SCORE;
        }

        return scoreForVariance(totalVariance / validComparisons);
    }

    static int scoreForVariance(double averageVariance) {
        if (averageVariance <= 0.05) return 95;
        if (averageVariance <= 0.10) return 85;
        if (averageVariance <= 0.20) return 70;
        if (averageVariance <= 0.35) return 50;
        return 25;
    }
}
