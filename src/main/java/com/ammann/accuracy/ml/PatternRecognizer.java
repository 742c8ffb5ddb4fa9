/* (C)2026 */
package com.ammann.accuracy.ml;

import com.ammann.accuracy.dto.PatternRecognitionDTO;
import com.ammann.accuracy.dto.RankingAnomalyDTO;
import com.ammann.accuracy.dto.RankingRecordDTO;
import com.ammann.accuracy.enumeration.AnomalySeverity;
import com.ammann.accuracy.enumeration.RankingTrend;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifies trend, cycles, seasonality and individual outliers of a ranking history.
 */
@ApplicationScoped
public class PatternRecognizer {

    static final double VOLATILITY_STD = 10.0;
    static final double TREND_SLOPE = 0.1;
    static final int MIN_CYCLE_RECORDS = 10;
    static final double CYCLE_THRESHOLD = 0.5;
    static final int MIN_SEASONALITY_RECORDS = 30;
    static final double SEASONALITY_PLACEHOLDER = 0.3;

    public PatternRecognitionDTO recognize(
            List<RankingRecordDTO> rankings, List<RankingRecordDTO> historical) {
        double[] positions = RankingStatistics.positions(rankings);
        double slope = RankingStatistics.trendSlope(positions, RankingStatistics.days(rankings));

        return new PatternRecognitionDTO(
                classifyTrend(slope, positions),
                detectSeasonality(historical),
                detectCycles(positions),
                identifySpecificAnomalies(rankings));
    }

    /**
     * Volatility wins over direction. A negative slope is an improvement because lower
     * positions are better ranks.
     */
    public RankingTrend classifyTrend(double slope, double[] positions) {
        if (RankingStatistics.standardDeviation(positions) > VOLATILITY_STD) {
            return RankingTrend.VOLATILE;
        }
        if (slope < -TREND_SLOPE) return RankingTrend.IMPROVING;
        if (slope > TREND_SLOPE) return RankingTrend.DECLINING;
        return RankingTrend.STABLE;
    }

    /**
     * Fixed seasonality strength: {@value #SEASONALITY_PLACEHOLDER} once the long-term history
     * holds at least {@value #MIN_SEASONALITY_RECORDS} records, otherwise 0. The series itself
     * is not decomposed.
     */
    public double detectSeasonality(List<RankingRecordDTO> historical) {
        if (historical == null || historical.size() < MIN_SEASONALITY_RECORDS) {
            return 0.0;
        }
        return SEASONALITY_PLACEHOLDER;
    }

    /**
     * Lag covariance of the mean-centred positions at lag {@code n / 3}.
     */
    public boolean detectCycles(double[] positions) {
        if (positions.length < MIN_CYCLE_RECORDS) {
            return false;
        }

        double mean = RankingStatistics.mean(positions);
        int period = positions.length / 3;
        double correlation = 0.0;
        for (int i = 0; i < positions.length - period; i++) {
            correlation += (positions[i] - mean) * (positions[i + period] - mean);
        }
        correlation /= (positions.length - period);

        return Math.abs(correlation) > CYCLE_THRESHOLD;
    }

    /**
     * Records more than two standard deviations from the mean position. A record is
     * {@code high} when it lies more than three standard deviations from the mean of the
     * remaining records, measured with their own deviation.
     */
    public List<RankingAnomalyDTO> identifySpecificAnomalies(List<RankingRecordDTO> rankings) {
        double[] positions = RankingStatistics.positions(rankings);
        double mean = RankingStatistics.mean(positions);
        double std = RankingStatistics.standardDeviation(positions);

        List<RankingAnomalyDTO> anomalies = new ArrayList<>();
        for (int i = 0; i < positions.length; i++) {
            double deviation = Math.abs(positions[i] - mean);
            if (deviation > 2 * std) {
                anomalies.add(
                        new RankingAnomalyDTO(
                                rankings.get(i).checkedAt(),
                                positions[i],
                                deviation,
                                severityAgainstRest(positions, i)));
            }
        }
        return anomalies;
    }

    private static AnomalySeverity severityAgainstRest(double[] positions, int index) {
        double[] rest = new double[positions.length - 1];
        for (int i = 0, j = 0; i < positions.length; i++) {
            if (i != index) {
                rest[j++] = positions[i];
            }
        }
        double restMean = RankingStatistics.mean(rest);
        double restStd = RankingStatistics.standardDeviation(rest);
        return Math.abs(positions[index] - restMean) > 3 * restStd
                ? AnomalySeverity.HIGH
                : AnomalySeverity.MEDIUM;
    }
}
