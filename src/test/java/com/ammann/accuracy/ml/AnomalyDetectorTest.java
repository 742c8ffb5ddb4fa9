/* (C)2026 */
package com.ammann.accuracy.ml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.support.TestDataFactory;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnomalyDetectorTest {

    private final AnomalyDetector detector = new AnomalyDetector();

    @Test
    void fewerThanFiveRecordsAreNeverAnomalous() {
        assertThat(detector.score(TestDataFactory.dailyRankings(DataSource.SERPAPI, 1, 1, 1, 90)))
                .isEqualTo(1.0);
        assertThat(detector.score(List.of())).isEqualTo(1.0);
        assertThat(detector.score(null)).isEqualTo(1.0);
    }

    @Test
    void singleOutlierInTenLowersScore() {
        // mean 14, sigma 12: only the outlier (deviation 36) is beyond 2 sigma
        assertThat(detector.score(TestDataFactory.rankingsWithOutlier())).isCloseTo(0.8, within(1e-12));
    }

    @Test
    void constantHistoryHasNoAnomalies() {
        assertThat(detector.score(TestDataFactory.constantRankings(12, 3))).isEqualTo(1.0);
    }

    @Test
    void scoreNeverDropsBelowZero() {
        assertThat(detector.score(TestDataFactory.dailyRankings(DataSource.SERPAPI, 5, 6, 5, 6, 5, 40)))
                .isBetween(0.0, 1.0);
    }
}
