/* (C)2026 */
package com.ammann.accuracy.service;

import static com.ammann.accuracy.support.TestDataFactory.gsc;
import static com.ammann.accuracy.support.TestDataFactory.hoursAgo;
import static com.ammann.accuracy.support.TestDataFactory.serp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.accuracy.dto.ConfidenceScoreDTO;
import com.ammann.accuracy.dto.DataPointDTO;
import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.exception.ValidationException;
import com.ammann.accuracy.scoring.CompletenessScorer;
import com.ammann.accuracy.scoring.ConfidenceAggregator;
import com.ammann.accuracy.scoring.ConsistencyScorer;
import com.ammann.accuracy.scoring.FreshnessScorer;
import com.ammann.accuracy.scoring.ReliabilityScorer;
import com.ammann.accuracy.store.IntegrationStatusProvider;
import com.ammann.accuracy.support.TestDataFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ConfidenceScoringService} wired with the real scorers and a fixed
 * clock.
 */
class ConfidenceScoringServiceTest {

    private ConfidenceScoringService service;

    @BeforeEach
    void setUp() {
        IntegrationStatusProvider provider = mock(IntegrationStatusProvider.class);
        when(provider.activeSources(anyString()))
                .thenReturn(EnumSet.of(DataSource.GOOGLE_SEARCH_CONSOLE, DataSource.GOOGLE_ANALYTICS));

        FreshnessScorer freshness = new FreshnessScorer(TestDataFactory.fixedClock());
        service =
                new ConfidenceScoringService(
                        freshness,
                        new ConsistencyScorer(freshness),
                        new ReliabilityScorer(),
                        new CompletenessScorer(provider),
                        new ConfidenceAggregator());
    }

    @Test
    void freshAgreeingConsoleDataIsHighlyTrusted() {
        ConfidenceScoreDTO score =
                service.calculateConfidenceScore("p1", "organic_clicks", gsc(1000), List.of(serp(1030)));

        assertThat(score.freshness()).isEqualTo(100);
        assertThat(score.consistency()).isGreaterThanOrEqualTo(90);
        assertThat(score.reliability()).isEqualTo(95);
        assertThat(score.completeness()).isEqualTo(100.0);
        assertThat(score.overall()).isGreaterThanOrEqualTo(94);
    }

    @Test
    void missingComparisonsGiveNeutralConsistency() {
        assertThat(service.calculateConfidenceScore("p1", "organic_clicks", gsc(1000), null).consistency())
                .isEqualTo(50);
        assertThat(service.calculateConfidenceScore("p1", "organic_clicks", gsc(1000), List.of()).consistency())
                .isEqualTo(50);
    }

    @Test
    void zeroPrimaryIsScoredWithoutError() {
        ConfidenceScoreDTO score =
                service.calculateConfidenceScore("p1", "organic_clicks", gsc(0), List.of(serp(12)));

        assertThat(score.consistency()).isEqualTo(50);
        assertThat(score.overall()).isBetween(0, 100);
    }

    @Test
    void staleUnknownDataScoresLow() {
        DataPointDTO old = new DataPointDTO("x", DataSource.MOZ_API, 10.0, hoursAgo(100), null);

        ConfidenceScoreDTO score = service.calculateConfidenceScore("p1", "conversions", old, List.of());

        assertThat(score.freshness()).isEqualTo(10);
        assertThat(score.reliability()).isEqualTo(75);
        assertThat(score.overall()).isLessThan(70);
    }

    @Test
    void missingPrimaryIsRejected() {
        assertThatThrownBy(() -> service.calculateConfidenceScore("p1", "organic_clicks", null, List.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'primary'");
    }

    @Test
    void missingFieldIsNamed() {
        DataPointDTO noValue = new DataPointDTO("c", DataSource.SERPAPI, null, hoursAgo(1), null);
        DataPointDTO noSource = new DataPointDTO("p", null, 5.0, hoursAgo(1), null);

        assertThatThrownBy(
                        () -> service.calculateConfidenceScore(
                                "p1", "organic_clicks", gsc(1000), List.of(serp(1000), noValue)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("compare[1].value");
        assertThatThrownBy(() -> service.calculateConfidenceScore("p1", "organic_clicks", noSource, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("primary.source");
    }

    @Test
    void nullComparisonEntryIsRejected() {
        List<DataPointDTO> compare = new ArrayList<>();
        compare.add(null);

        assertThatThrownBy(() -> service.calculateConfidenceScore("p1", "organic_clicks", gsc(1), compare))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("compare[0]");
    }

    @Test
    void nonFiniteValueIsRejected() {
        DataPointDTO nan = new DataPointDTO("p", DataSource.SERPAPI, Double.NaN, hoursAgo(1), null);

        assertThatThrownBy(() -> service.calculateConfidenceScore("p1", "organic_clicks", nan, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("primary.value");
    }

    @Test
    void timestampOutsideSupportedRangeIsRejected() {
        Instant distantPast = Instant.parse("-999999999-01-01T00:00:00Z");
        DataPointDTO ancient = new DataPointDTO("p", DataSource.SERPAPI, 5.0, distantPast, null);
        DataPointDTO farFuture = new DataPointDTO("c", DataSource.SERPAPI, 5.0, Instant.MAX, null);

        assertThatThrownBy(() -> service.calculateConfidenceScore("p1", "organic_clicks", ancient, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("primary.timestamp");
        assertThatThrownBy(
                        () -> service.calculateConfidenceScore(
                                "p1", "organic_clicks", gsc(1000), List.of(farFuture)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("compare[0].timestamp");
    }

    @Test
    void boundaryTimestampsAreAccepted() {
        DataPointDTO oldest =
                new DataPointDTO("p", DataSource.SERPAPI, 5.0, DataPointDTO.MIN_TIMESTAMP, null);
        DataPointDTO latest =
                new DataPointDTO("c", DataSource.SERPAPI, 5.0, DataPointDTO.MAX_TIMESTAMP, null);

        ConfidenceScoreDTO score =
                service.calculateConfidenceScore("p1", "organic_clicks", oldest, List.of(latest));

        assertThat(score.freshness()).isEqualTo(10);
    }
}
