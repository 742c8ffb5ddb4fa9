/* (C)2026 */
package com.ammann.accuracy.ml;

import com.ammann.accuracy.dto.RankingRecordDTO;
import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.scoring.FreshnessScorer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Heuristic confidence over a ranking history: freshness, position consistency, source
 * reliability and day coverage, each in [0, 1].
 */
@ApplicationScoped
public class TraditionalRankingScorer {

    static final double FRESHNESS_WEIGHT = 0.3;
    static final double CONSISTENCY_WEIGHT = 0.3;
    static final double RELIABILITY_WEIGHT = 0.25;
    static final double COVERAGE_WEIGHT = 0.15;

    private final Clock clock;

    @Inject
    public TraditionalRankingScorer(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param rankings validated ranking history, at least one record
     * @return weighted score in [0, 1]
     */
    public double score(List<RankingRecordDTO> rankings) {
        return freshness(rankings) * FRESHNESS_WEIGHT
                + consistency(rankings) * CONSISTENCY_WEIGHT
                + reliability(rankings) * RELIABILITY_WEIGHT
                + coverage(rankings) * COVERAGE_WEIGHT;
    }

    double freshness(List<RankingRecordDTO> rankings) {
        Instant latest =
                rankings.stream()
                        .map(RankingRecordDTO::checkedAt)
                        .max(Comparator.naturalOrder())
                        .orElseThrow();
        double ageHours = FreshnessScorer.hoursBetween(latest, clock.instant());

        if (ageHours <= 1) return 1.0;
        if (ageHours <= 6) return 0.9;
        if (ageHours <= 24) return 0.8;
        if (ageHours <= 72) return 0.6;
        if (ageHours <= 168) return 0.4;
        return 0.2;
    }

    double consistency(List<RankingRecordDTO> rankings) {
        if (rankings.size() < 2) {
            return 0.5;
        }

        double std = RankingStatistics.standardDeviation(RankingStatistics.positions(rankings));

        if (std <= 2) return 1.0;
        if (std <= 5) return 0.8;
        if (std <= 10) return 0.6;
        if (std <= 20) return 0.4;
        return 0.2;
    }

    double reliability(List<RankingRecordDTO> rankings) {
        Set<DataSource> sources =
                rankings.stream()
                        .map(RankingRecordDTO::source)
                        .filter(s -> s != null)
                        .collect(Collectors.toSet());
        long distinctSources = rankings.stream().map(RankingRecordDTO::source).distinct().count();

        double score = 0.5;
        if (sources.contains(DataSource.GOOGLE_SEARCH_CONSOLE)) score += 0.3;
        if (sources.contains(DataSource.SERPAPI)) score += 0.2;
        if (distinctSources > 1) score += 0.1;

        double clicksRatio =
                (double) rankings.stream().filter(r -> r.clicks() != null).count() / rankings.size();
        score += clicksRatio * 0.1;

        if (rankings.size() >= 7) score += 0.1;
        if (rankings.size() >= 30) score += 0.1;

        return Math.min(1.0, score);
    }

    double coverage(List<RankingRecordDTO> rankings) {
        long days =
                rankings.stream()
                        .map(r -> r.checkedAt().atZone(ZoneOffset.UTC).toLocalDate())
                        .distinct()
                        .count();

        if (days >= 30) return 1.0;
        if (days >= 14) return 0.8;
        if (days >= 7) return 0.6;
        if (days >= 3) return 0.4;
        return 0.2;
    }
}
