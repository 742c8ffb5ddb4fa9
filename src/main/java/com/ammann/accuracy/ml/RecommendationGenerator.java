/* (C)2026 */
package com.ammann.accuracy.ml;

import com.ammann.accuracy.dto.PatternRecognitionDTO;
import com.ammann.accuracy.dto.RankingRecordDTO;
import com.ammann.accuracy.enumeration.RankingTrend;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based operator guidance for a hybrid confidence result. Never returns an empty list.
 */
@ApplicationScoped
public class RecommendationGenerator {

    static final String ML_ABOVE_TRADITIONAL =
            "ML model detected higher confidence than traditional metrics suggest";
    static final String TRADITIONAL_ABOVE_ML =
            "Traditional metrics outperform ML model - consider manual review";
    static final String HIGH_ANOMALY_RATE =
            "High anomaly rate detected - investigate unusual ranking changes";
    static final String HIGH_VOLATILITY =
            "High volatility detected - increase tracking frequency";
    static final String CYCLE_DETECTED =
            "Cyclical pattern detected - consider seasonal optimization strategies";
    static final String LIMITED_DATA =
            "Limited data points - collect more historical data for improved accuracy";
    static final String SINGLE_SOURCE =
            "Single data source detected - add additional sources for validation";
    static final String LOOKS_GOOD =
            "ML confidence analysis looks good - continue current tracking practices";

    static final double SCORE_GAP = 0.1;
    static final double ANOMALY_THRESHOLD = 0.7;
    static final int MIN_RECORDS = 10;

    public List<String> generate(
            List<RankingRecordDTO> rankings,
            double traditionalScore,
            double mlScore,
            double anomalyScore,
            PatternRecognitionDTO patterns) {
        List<String> recommendations = new ArrayList<>();

        if (mlScore > traditionalScore + SCORE_GAP) {
            recommendations.add(ML_ABOVE_TRADITIONAL);
        } else if (traditionalScore > mlScore + SCORE_GAP) {
            recommendations.add(TRADITIONAL_ABOVE_ML);
        }

        if (anomalyScore < ANOMALY_THRESHOLD) {
            recommendations.add(HIGH_ANOMALY_RATE);
        }

        if (patterns.trend() == RankingTrend.VOLATILE) {
            recommendations.add(HIGH_VOLATILITY);
        }

        if (patterns.cycleDetected()) {
            recommendations.add(CYCLE_DETECTED);
        }

        if (rankings.size() < MIN_RECORDS) {
            recommendations.add(LIMITED_DATA);
        }

        if (rankings.stream().map(RankingRecordDTO::source).distinct().count() == 1) {
            recommendations.add(SINGLE_SOURCE);
        }

        if (recommendations.isEmpty()) {
            recommendations.add(LOOKS_GOOD);
        }

        return recommendations;
    }
}
