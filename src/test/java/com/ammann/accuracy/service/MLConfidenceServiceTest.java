/* (C)2026 */
package com.ammann.accuracy.service;

import static com.ammann.accuracy.support.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.accuracy.dto.MLConfidenceInputDTO;
import com.ammann.accuracy.dto.MLConfidenceResultDTO;
import com.ammann.accuracy.dto.RankingRecordDTO;
import com.ammann.accuracy.enumeration.AnomalySeverity;
import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.exception.ValidationException;
import com.ammann.accuracy.ml.AnomalyDetector;
import com.ammann.accuracy.ml.HybridScoreCombiner;
import com.ammann.accuracy.ml.PatternRecognizer;
import com.ammann.accuracy.ml.RankingFeatureExtractor;
import com.ammann.accuracy.ml.RecommendationGenerator;
import com.ammann.accuracy.ml.SimulatedInferenceModel;
import com.ammann.accuracy.ml.TraditionalRankingScorer;
import com.ammann.accuracy.support.TestDataFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MLConfidenceServiceTest {

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private MLConfidenceService service;

    @BeforeEach
    void setUp() {
        Clock clock = TestDataFactory.fixedClock();
        executor = Executors.newFixedThreadPool(4);
        registry = new SimpleMeterRegistry();
        service =
                new MLConfidenceService(
                        new RankingFeatureExtractor(clock),
                        new SimulatedInferenceModel(),
                        new TraditionalRankingScorer(clock),
                        new AnomalyDetector(),
                        new PatternRecognizer(),
                        new HybridScoreCombiner(),
                        new RecommendationGenerator(),
                        executor,
                        clock,
                        registry);
        service.batchPauseMs = 0;
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void outlierLowersAnomalyScoreAndIsReported() {
        MLConfidenceResultDTO result =
                service.calculateMLConfidence(
                        MLConfidenceInputDTO.of(TestDataFactory.rankingsWithOutlier()));

        assertThat(result.anomalyScore()).isEqualTo(0.8);
        assertThat(result.patternRecognition().anomalies())
                .singleElement()
                .satisfies(
                        a -> {
                            assertThat(a.position()).isEqualTo(50.0);
                            assertThat(a.severity()).isEqualTo(AnomalySeverity.HIGH);
                        });
        assertThat(result.recommendations()).isNotEmpty();
    }

    @Test
    void scoresAreRoundedToTwoDecimalsAndBounded() {
        MLConfidenceResultDTO result =
                service.calculateMLConfidence(
                        MLConfidenceInputDTO.of(
                                TestDataFactory.dailyRankings(
                                        DataSource.SERPAPI, 7.3, 8.1, 6.9, 7.7, 9.2, 8.4)));

        for (double score :
                new double[] {
                    result.mlScore(),
                    result.traditionalScore(),
                    result.hybridScore(),
                    result.anomalyScore()
                }) {
            assertThat(score).isBetween(0.0, 1.0);
            assertThat(score * 100).isCloseTo(Math.rint(score * 100), within(1e-9));
        }
    }

    @Test
    void stableHistoryHasNoAnomaliesAndCarriesModelMetadata() {
        MLConfidenceResultDTO result =
                service.calculateMLConfidence(
                        MLConfidenceInputDTO.of(TestDataFactory.constantRankings(14, 3)));

        assertThat(result.anomalyScore()).isEqualTo(1.0);
        assertThat(result.patternRecognition().anomalies()).isEmpty();
        assertThat(result.confidenceLevel()).isNotNull();
        assertThat(result.modelMetadata().version()).isEqualTo(SimulatedInferenceModel.MODEL_VERSION);
        assertThat(result.modelMetadata().lastUpdated()).isEqualTo(NOW);
    }

    @Test
    void missingOrEmptyRankingsAreRejected() {
        assertThatThrownBy(() -> service.calculateMLConfidence(null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.calculateMLConfidence(MLConfidenceInputDTO.of(null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("rankings");
        assertThatThrownBy(() -> service.calculateMLConfidence(MLConfidenceInputDTO.of(List.of())))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void recordWithoutPositionIsRejected() {
        List<RankingRecordDTO> rankings =
                List.of(
                        RankingRecordDTO.of(4, NOW, DataSource.SERPAPI),
                        new RankingRecordDTO(null, NOW, null, null, DataSource.SERPAPI));

        assertThatThrownBy(() -> service.calculateMLConfidence(MLConfidenceInputDTO.of(rankings)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("rankings[1].position");
    }

    @Test
    void checkedAtOutsideSupportedRangeIsRejected() {
        List<RankingRecordDTO> rankings =
                List.of(
                        RankingRecordDTO.of(4, NOW, DataSource.SERPAPI),
                        RankingRecordDTO.of(
                                5, Instant.parse("-999999999-01-01T00:00:00Z"), DataSource.SERPAPI));

        assertThatThrownBy(() -> service.calculateMLConfidence(MLConfidenceInputDTO.of(rankings)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("rankings[1].checkedAt");
    }

    @Test
    void batchKeepsInputOrderAcrossGroups() {
        List<MLConfidenceInputDTO> inputs = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            inputs.add(
                    new MLConfidenceInputDTO(
                            "kw-" + i,
                            TestDataFactory.dailyRankings(
                                    DataSource.GOOGLE_SEARCH_CONSOLE, 3 + i, 4 + i, 3 + i, 5 + 2 * i),
                            null,
                            null));
        }

        List<MLConfidenceResultDTO> results = service.calculateBatchMLConfidence(inputs);

        assertThat(results).hasSize(25);
        for (int i = 0; i < inputs.size(); i++) {
            assertThat(results.get(i)).isEqualTo(service.calculateMLConfidence(inputs.get(i)));
        }
    }

    @Test
    void invalidInputFailsWholeBatch() {
        List<MLConfidenceInputDTO> inputs =
                List.of(
                        MLConfidenceInputDTO.of(TestDataFactory.constantRankings(5, 2)),
                        MLConfidenceInputDTO.of(List.of()));

        assertThatThrownBy(() -> service.calculateBatchMLConfidence(inputs))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.calculateBatchMLConfidence(null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void emptyBatchGivesEmptyResult() {
        assertThat(service.calculateBatchMLConfidence(List.of())).isEmpty();
    }

    @Test
    void everyEvaluationIsCounted() {
        service.calculateMLConfidence(MLConfidenceInputDTO.of(TestDataFactory.constantRankings(5, 2)));
        service.calculateMLConfidence(MLConfidenceInputDTO.of(TestDataFactory.rankingsWithOutlier()));

        double total =
                registry.find("ml_confidence_evaluations_total").counters().stream()
                        .mapToDouble(Counter::count)
                        .sum();
        assertThat(total).isEqualTo(2.0);
    }

    @Test
    void roundingKeepsTwoDecimals() {
        assertThat(MLConfidenceService.round2(0.876)).isEqualTo(0.88);
        assertThat(MLConfidenceService.round2(0.124)).isEqualTo(0.12);
        assertThat(MLConfidenceService.round2(1.0)).isEqualTo(1.0);
    }
}
