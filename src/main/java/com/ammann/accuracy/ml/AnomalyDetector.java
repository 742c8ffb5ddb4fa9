/* (C)2026 */
package com.ammann.accuracy.ml;

import com.ammann.accuracy.dto.RankingRecordDTO;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;

/**
 * Scores a ranking history by its share of outlying positions. 1.0 means no anomalies.
 */
@ApplicationScoped
public class AnomalyDetector {

    static final int MIN_RECORDS = 5;
    static final double OUTLIER_SIGMA = 2.0;

    /**
     * @param rankings validated ranking history
     * @return {@code max(0, 1 - 2 * outlierRate)}, or 1 with fewer than five records
     */
    public double score(List<RankingRecordDTO> rankings) {
        if (rankings == null || rankings.size() < MIN_RECORDS) {
            return 1.0;
        }

        double[] positions = RankingStatistics.positions(rankings);
        double mean = RankingStatistics.mean(positions);
        double std = RankingStatistics.standardDeviation(positions);

        long outliers = 0;
        for (double position : positions) {
            if (Math.abs(position - mean) > OUTLIER_SIGMA * std) {
                outliers++;
            }
        }

        double anomalyRate = (double) outliers / positions.length;
        return Math.max(0.0, 1.0 - anomalyRate * 2.0);
    }
}
