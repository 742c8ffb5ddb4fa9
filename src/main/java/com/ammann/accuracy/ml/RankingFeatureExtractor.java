/* (C)2026 */
package com.ammann.accuracy.ml;

import com.ammann.accuracy.dto.ContextualDataDTO;
import com.ammann.accuracy.dto.RankingRecordDTO;
import com.ammann.accuracy.scoring.FreshnessScorer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a ranking history plus optional market hints into the fixed-length input vector
 * of {@link SimulatedInferenceModel}.
 *
 * <p>Feature order:
 * <ol>
 *   <li>mean position / 100</li>
 *   <li>position standard deviation / 50</li>
 *   <li>freshness, {@code 1 - hoursSinceLatest / 168} clamped to [0, 1]</li>
 *   <li>distinct sources / 3</li>
 *   <li>fraction of records with clicks or impressions</li>
 *   <li>absolute trend slope (positions per day)</li>
 *   <li>stability, {@code 1 - min(1, stdev / mean)}</li>
 *   <li>industry weight, 1 for a competitive industry else 0.5</li>
 *   <li>competition level</li>
 *   <li>seasonality</li>
 *   <li>search volume / 10000, capped at 1</li>
 * </ol>
 * Missing contextual values default to 0.5.
 */
@ApplicationScoped
public class RankingFeatureExtractor {

    public static final int FEATURE_COUNT = 11;

    static final double HOURS_PER_WEEK = 168.0;
    static final double EXPECTED_SOURCE_COUNT = 3.0;
    static final double SEARCH_VOLUME_SCALE = 10_000.0;
    static final double DEFAULT_CONTEXT_VALUE = 0.5;

    private final Clock clock;

    @Inject
    public RankingFeatureExtractor(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param rankings validated ranking history, at least one record
     * @param context optional market hints
     * @return feature vector of length {@link #FEATURE_COUNT}
     */
    public double[] extract(List<RankingRecordDTO> rankings, ContextualDataDTO context) {
        double[] positions = RankingStatistics.positions(rankings);
        double mean = RankingStatistics.mean(positions);
        double std = RankingStatistics.standardDeviation(positions);
        double slope = RankingStatistics.trendSlope(positions, RankingStatistics.days(rankings));

        Instant latest =
                rankings.stream()
                        .map(RankingRecordDTO::checkedAt)
                        .max(Comparator.naturalOrder())
                        .orElseThrow();
        double recencyHours = FreshnessScorer.hoursBetween(latest, clock.instant());

        long distinctSources = rankings.stream().map(RankingRecordDTO::source).distinct().count();
        double completeness =
                (double) rankings.stream().filter(RankingRecordDTO::hasTrafficData).count()
                        / rankings.size();
        double volatility = mean != 0.0 ? std / mean : 0.0;

        return new double[] {
            mean / 100.0,
            std / 50.0,
            clamp01(1.0 - recencyHours / HOURS_PER_WEEK),
            distinctSources / EXPECTED_SOURCE_COUNT,
            completeness,
            Math.abs(slope),
            1.0 - Math.min(1.0, volatility),
            industryWeight(context),
            competitionLevel(context),
            seasonality(context),
            searchVolume(context)
        };
    }

    static double industryWeight(ContextualDataDTO context) {
        return context != null && context.isCompetitiveIndustry() ? 1.0 : DEFAULT_CONTEXT_VALUE;
    }

    static double competitionLevel(ContextualDataDTO context) {
        return context != null && context.competitionLevel() != null
                ? context.competitionLevel()
                : DEFAULT_CONTEXT_VALUE;
    }

    static double seasonality(ContextualDataDTO context) {
        return context != null && context.seasonality() != null
                ? context.seasonality()
                : DEFAULT_CONTEXT_VALUE;
    }

    static double searchVolume(ContextualDataDTO context) {
        if (context == null || context.searchVolume() == null) {
            return DEFAULT_CONTEXT_VALUE;
        }
        return Math.min(1.0, context.searchVolume() / SEARCH_VOLUME_SCALE);
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
