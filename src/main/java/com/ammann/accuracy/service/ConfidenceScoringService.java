/* (C)2026 */
package com.ammann.accuracy.service;

import com.ammann.accuracy.dto.ConfidenceScoreDTO;
import com.ammann.accuracy.dto.DataPointDTO;
import com.ammann.accuracy.exception.ValidationException;
import com.ammann.accuracy.scoring.CompletenessScorer;
import com.ammann.accuracy.scoring.ConfidenceAggregator;
import com.ammann.accuracy.scoring.ConsistencyScorer;
import com.ammann.accuracy.scoring.FreshnessScorer;
import com.ammann.accuracy.scoring.ReliabilityScorer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Computes the multi-factor confidence score of a primary observation.
 *
 * <p>Freshness and reliability depend on the primary observation alone, consistency on
 * its agreement with the comparison observations and completeness on the integrations
 * connected for the project.
 */
@ApplicationScoped
public class ConfidenceScoringService {

    private static final Logger LOG = Logger.getLogger(ConfidenceScoringService.class);

    private final FreshnessScorer freshnessScorer;
    private final ConsistencyScorer consistencyScorer;
    private final ReliabilityScorer reliabilityScorer;
    private final CompletenessScorer completenessScorer;
    private final ConfidenceAggregator aggregator;

    @Inject
    public ConfidenceScoringService(
            FreshnessScorer freshnessScorer,
            ConsistencyScorer consistencyScorer,
            ReliabilityScorer reliabilityScorer,
            CompletenessScorer completenessScorer,
            ConfidenceAggregator aggregator) {
        this.freshnessScorer = freshnessScorer;
        this.consistencyScorer = consistencyScorer;
        this.reliabilityScorer = reliabilityScorer;
        this.completenessScorer = completenessScorer;
        this.aggregator = aggregator;
    }

    /**
     * @param projectId project the metric belongs to
     * @param metric metric name
     * @param primary primary observation
     * @param compare comparison observations, may be {@code null}
     * @return confidence breakdown with every component in [0, 100]
     * @throws ValidationException if a required field of an observation is missing
     */
    public ConfidenceScoreDTO calculateConfidenceScore(
            String projectId, String metric, DataPointDTO primary, List<DataPointDTO> compare) {
        List<DataPointDTO> comparisons = validate(primary, compare);

        int freshness = freshnessScorer.score(primary.timestamp());
        int consistency = consistencyScorer.score(primary, comparisons);
        int reliability = reliabilityScorer.score(primary.source());
        double completeness = completenessScorer.score(projectId, metric, primary.timestamp());

        ConfidenceScoreDTO score =
                aggregator.aggregate(freshness, consistency, reliability, completeness);

        LOG.debugf(
                "Confidence for project=%s metric=%s: overall=%d freshness=%d consistency=%d"
                        + " reliability=%d completeness=%.1f",
                projectId,
                metric,
                score.overall(),
                freshness,
                consistency,
                reliability,
                completeness);

        return score;
    }

    /**
     * Validates the primary observation and every comparison observation.
     *
     * @return the comparisons, never {@code null}
     */
    static List<DataPointDTO> validate(DataPointDTO primary, List<DataPointDTO> compare) {
        if (primary == null) {
            throw ValidationException.missingField("primary");
        }
        primary.validate("primary");

        if (compare == null) {
            return List.of();
        }
        for (int i = 0; i < compare.size(); i++) {
            DataPointDTO point = compare.get(i);
            if (point == null) {
                throw ValidationException.missingField("compare[" + i + "]");
            }
            point.validate("compare[" + i + "]");
        }
        return compare;
    }
}
