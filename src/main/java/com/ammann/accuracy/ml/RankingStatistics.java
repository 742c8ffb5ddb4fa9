/* (C)2026 */
package com.ammann.accuracy.ml;

import com.ammann.accuracy.dto.RankingRecordDTO;
import java.util.List;

/**
 * Descriptive statistics over ranking positions shared by feature extraction, anomaly
 * detection and pattern recognition.
 *
 * <p>Standard deviations are population deviations. Trend slopes are ordinary
 * least-squares slopes of position over time measured in days.
 */
public final class RankingStatistics {

    static final double MILLIS_PER_DAY = 86_400_000.0;

    private RankingStatistics() {}

    public static double[] positions(List<RankingRecordDTO> rankings) {
        return rankings.stream().mapToDouble(RankingRecordDTO::position).toArray();
    }

    /**
     * @return check times in days since the epoch, aligned with {@link #positions(List)}
     */
    public static double[] days(List<RankingRecordDTO> rankings) {
        return rankings.stream()
                .mapToDouble(r -> r.checkedAt().toEpochMilli() / MILLIS_PER_DAY)
                .toArray();
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double standardDeviation(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquares = 0.0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSquares / values.length);
    }

    /**
     * Ordinary least-squares slope of {@code y} over {@code x}, computed on centred values.
     *
     * @return slope, or 0 with fewer than two points or when all {@code x} are equal
     */
    public static double trendSlope(double[] y, double[] x) {
        if (y.length < 2 || y.length != x.length) {
            return 0.0;
        }

        double meanX = mean(x);
        double meanY = mean(y);
        double covariance = 0.0;
        double varianceX = 0.0;
        for (int i = 0; i < y.length; i++) {
            double dx = x[i] - meanX;
            covariance += dx * (y[i] - meanY);
            varianceX += dx * dx;
        }

        if (varianceX == 0.0) {
            return 0.0;
        }
        double slope = covariance / varianceX;
        return Double.isFinite(slope) ? slope : 0.0;
    }
}
