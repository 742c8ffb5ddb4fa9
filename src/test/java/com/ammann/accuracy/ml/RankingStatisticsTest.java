/* (C)2026 */
package com.ammann.accuracy.ml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.accuracy.dto.RankingRecordDTO;
import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.support.TestDataFactory;
import java.util.List;
import org.junit.jupiter.api.Test;

class RankingStatisticsTest {

    @Test
    void meanAndPopulationStandardDeviation() {
        double[] values = {1, 2, 3, 4};

        assertThat(RankingStatistics.mean(values)).isEqualTo(2.5);
        assertThat(RankingStatistics.standardDeviation(values)).isCloseTo(Math.sqrt(1.25), within(1e-12));
    }

    @Test
    void emptyInputGivesZero() {
        assertThat(RankingStatistics.mean(new double[0])).isZero();
        assertThat(RankingStatistics.standardDeviation(new double[0])).isZero();
    }

    @Test
    void trendSlopeIsLeastSquaresSlope() {
        assertThat(RankingStatistics.trendSlope(new double[] {10, 9, 8, 7}, new double[] {0, 1, 2, 3}))
                .isCloseTo(-1.0, within(1e-12));
        assertThat(RankingStatistics.trendSlope(new double[] {1, 3, 2, 4}, new double[] {0, 1, 2, 3}))
                .isCloseTo(0.8, within(1e-12));
    }

    @Test
    void trendSlopeIsZeroWithoutSpreadInTime() {
        assertThat(RankingStatistics.trendSlope(new double[] {5}, new double[] {1})).isZero();
        assertThat(RankingStatistics.trendSlope(new double[] {5, 9}, new double[] {2, 2})).isZero();
    }

    @Test
    void slopeOverDailyChecksIsPositionsPerDay() {
        List<RankingRecordDTO> rankings =
                TestDataFactory.dailyRankings(DataSource.SERPAPI, 30, 27, 24, 21);

        double slope =
                RankingStatistics.trendSlope(
                        RankingStatistics.positions(rankings), RankingStatistics.days(rankings));

        assertThat(slope).isCloseTo(-3.0, within(1e-6));
    }
}
