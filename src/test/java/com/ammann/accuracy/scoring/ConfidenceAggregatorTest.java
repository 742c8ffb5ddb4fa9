/* (C)2026 */
package com.ammann.accuracy.scoring;

import static com.ammann.accuracy.support.TestDataFactory.criticalDiscrepancy;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.accuracy.dto.ConfidenceScoreDTO;
import com.ammann.accuracy.dto.DiscrepancyDTO;
import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.enumeration.DiscrepancySeverity;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfidenceAggregatorTest {

    private final ConfidenceAggregator aggregator = new ConfidenceAggregator();

    @Test
    void overallIsWeightedRoundedSum() {
        // 30 + 33.25 + 23.75 + 10
        assertThat(aggregator.overall(100, 95, 95, 100.0)).isEqualTo(97);
        // 21 + 17.5 + 23.75 + 5
        assertThat(aggregator.overall(70, 50, 95, 50.0)).isEqualTo(67);
    }

    @Test
    void overallStaysWithinBounds() {
        assertThat(aggregator.overall(0, 0, 0, 0.0)).isZero();
        assertThat(aggregator.overall(100, 100, 100, 100.0)).isEqualTo(100);
    }

    @Test
    void aggregateIsDeterministicInItsComponents() {
        ConfidenceScoreDTO first = aggregator.aggregate(90, 85, 80, 66.7);
        ConfidenceScoreDTO second = aggregator.aggregate(90, 85, 80, 66.7);

        assertThat(first).isEqualTo(second);
        assertThat(first.overall())
                .isEqualTo(aggregator.overall(first.freshness(), first.consistency(),
                        first.reliability(), first.completeness()));
    }

    @Test
    void accurateWithHighScoreAndNoDiscrepancies() {
        assertThat(aggregator.isAccurate(70, List.of())).isTrue();
        assertThat(aggregator.isAccurate(69, List.of())).isFalse();
    }

    @Test
    void anyCriticalDiscrepancyMakesInaccurate() {
        assertThat(aggregator.isAccurate(99, List.of(criticalDiscrepancy(0.8)))).isFalse();
    }

    @Test
    void halfOrMoreHighDiscrepanciesMakeInaccurate() {
        DiscrepancyDTO high = discrepancy(DiscrepancySeverity.HIGH, 0.4);
        DiscrepancyDTO low = discrepancy(DiscrepancySeverity.LOW, 0.1);

        assertThat(aggregator.isAccurate(90, List.of(high, low))).isFalse();
        assertThat(aggregator.isAccurate(90, List.of(high, low, low))).isTrue();
    }

    private static DiscrepancyDTO discrepancy(DiscrepancySeverity severity, double variance) {
        return new DiscrepancyDTO(
                DataSource.GOOGLE_SEARCH_CONSOLE,
                DataSource.SERPAPI,
                100,
                100 * (1 + variance),
                variance,
                severity,
                severity.getExplanation());
    }
}
