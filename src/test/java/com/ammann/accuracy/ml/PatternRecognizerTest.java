/* (C)2026 */
package com.ammann.accuracy.ml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.accuracy.dto.PatternRecognitionDTO;
import com.ammann.accuracy.dto.RankingAnomalyDTO;
import com.ammann.accuracy.dto.RankingRecordDTO;
import com.ammann.accuracy.enumeration.AnomalySeverity;
import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.enumeration.RankingTrend;
import com.ammann.accuracy.support.TestDataFactory;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PatternRecognizerTest {

    private final PatternRecognizer recognizer = new PatternRecognizer();

    @Nested
    class Trend {

        @Test
        void fallingPositionsAreImproving() {
            PatternRecognitionDTO result = recognizer.recognize(ranks(20, 19, 18, 17, 16), null);

            assertThat(result.trend()).isEqualTo(RankingTrend.IMPROVING);
        }

        @Test
        void risingPositionsAreDeclining() {
            assertThat(recognizer.recognize(ranks(3, 4, 5, 6, 7), null).trend())
                    .isEqualTo(RankingTrend.DECLINING);
        }

        @Test
        void flatPositionsAreStable() {
            assertThat(recognizer.recognize(ranks(8, 8, 8, 8), null).trend())
                    .isEqualTo(RankingTrend.STABLE);
            assertThat(recognizer.recognize(ranks(8), null).trend()).isEqualTo(RankingTrend.STABLE);
        }

        @Test
        void wideSpreadIsVolatileWhateverTheSlope() {
            assertThat(recognizer.recognize(ranks(1, 40, 2, 45, 3), null).trend())
                    .isEqualTo(RankingTrend.VOLATILE);
        }
    }

    @Nested
    class Cycles {

        @Test
        void needsTenPositions() {
            assertThat(recognizer.detectCycles(new double[] {10, 20, 10, 20, 10, 20, 10, 20, 10}))
                    .isFalse();
        }

        @Test
        void alternatingPositionsInPhaseAtLagAreCyclic() {
            double[] positions = {10, 20, 10, 20, 10, 20, 10, 20, 10, 20, 10, 20};

            assertThat(recognizer.detectCycles(positions)).isTrue();
        }

        @Test
        void constantPositionsHaveNoCycle() {
            double[] positions = new double[15];
            Arrays.fill(positions, 4.0);

            assertThat(recognizer.detectCycles(positions)).isFalse();
        }
    }

    @Nested
    class Seasonality {

        @Test
        void requiresThirtyHistoricalRecords() {
            assertThat(recognizer.detectSeasonality(null)).isZero();
            assertThat(recognizer.detectSeasonality(TestDataFactory.constantRankings(29, 5))).isZero();
            assertThat(recognizer.detectSeasonality(TestDataFactory.constantRankings(30, 5)))
                    .isEqualTo(0.3);
        }
    }

    @Nested
    class Anomalies {

        @Test
        void isolatedOutlierIsTaggedHigh() {
            List<RankingRecordDTO> rankings = TestDataFactory.rankingsWithOutlier();

            List<RankingAnomalyDTO> anomalies = recognizer.identifySpecificAnomalies(rankings);

            assertThat(anomalies).hasSize(1);
            RankingAnomalyDTO anomaly = anomalies.get(0);
            assertThat(anomaly.position()).isEqualTo(50.0);
            assertThat(anomaly.deviation()).isCloseTo(36.0, within(1e-9));
            assertThat(anomaly.severity()).isEqualTo(AnomalySeverity.HIGH);
            assertThat(anomaly.timestamp()).isEqualTo(rankings.get(4).checkedAt());
        }

        @Test
        void outlierWithinThreeSigmaOfTheRestIsMedium() {
            // rest: mean 10, sigma 2; the outlier is exactly 3 sigma away from it
            List<RankingAnomalyDTO> anomalies =
                    recognizer.identifySpecificAnomalies(
                            ranks(8, 12, 8, 12, 8, 12, 8, 12, 8, 12, 16));

            assertThat(anomalies).hasSize(1);
            assertThat(anomalies.get(0).position()).isEqualTo(16.0);
            assertThat(anomalies.get(0).severity()).isEqualTo(AnomalySeverity.MEDIUM);
        }

        @Test
        void constantHistoryHasNoAnomalies() {
            assertThat(recognizer.identifySpecificAnomalies(TestDataFactory.constantRankings(10, 2)))
                    .isEmpty();
        }
    }

    private static List<RankingRecordDTO> ranks(double... positions) {
        return TestDataFactory.dailyRankings(DataSource.GOOGLE_SEARCH_CONSOLE, positions);
    }
}
