/* (C)2026 */
package com.ammann.accuracy.service;

import com.ammann.accuracy.config.ExecutorProducer;
import com.ammann.accuracy.dto.ContextualDataDTO;
import com.ammann.accuracy.dto.MLConfidenceInputDTO;
import com.ammann.accuracy.dto.MLConfidenceResultDTO;
import com.ammann.accuracy.dto.PatternRecognitionDTO;
import com.ammann.accuracy.dto.RankingRecordDTO;
import com.ammann.accuracy.enumeration.ConfidenceLevel;
import com.ammann.accuracy.exception.SomeThingWentWrongException;
import com.ammann.accuracy.exception.ValidationException;
import com.ammann.accuracy.ml.AnomalyDetector;
import com.ammann.accuracy.ml.HybridScoreCombiner;
import com.ammann.accuracy.ml.PatternRecognizer;
import com.ammann.accuracy.ml.RankingFeatureExtractor;
import com.ammann.accuracy.ml.RecommendationGenerator;
import com.ammann.accuracy.ml.SimulatedInferenceModel;
import com.ammann.accuracy.ml.TraditionalRankingScorer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Hybrid confidence for keyword ranking histories.
 *
 * <p>Blends a heuristic score with the output of {@link SimulatedInferenceModel}, discounts
 * the blend by the anomaly rate and attaches pattern analysis and recommendations. Batch
 * requests are scored in groups on the {@value ExecutorProducer#ML_SCORING_EXECUTOR}
 * executor with a short pause between groups; results keep the input order.
 */
@ApplicationScoped
public class MLConfidenceService {

    private static final Logger LOG = Logger.getLogger(MLConfidenceService.class);

    @ConfigProperty(name = "accuracy.ml.batch-size", defaultValue = "10")
    int batchSize = 10;

    @ConfigProperty(name = "accuracy.ml.batch-pause-ms", defaultValue = "100")
    long batchPauseMs = 100;

    private final RankingFeatureExtractor featureExtractor;
    private final SimulatedInferenceModel model;
    private final TraditionalRankingScorer traditionalScorer;
    private final AnomalyDetector anomalyDetector;
    private final PatternRecognizer patternRecognizer;
    private final HybridScoreCombiner combiner;
    private final RecommendationGenerator recommendationGenerator;
    private final ExecutorService executor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Inject
    public MLConfidenceService(
            RankingFeatureExtractor featureExtractor,
            SimulatedInferenceModel model,
            TraditionalRankingScorer traditionalScorer,
            AnomalyDetector anomalyDetector,
            PatternRecognizer patternRecognizer,
            HybridScoreCombiner combiner,
            RecommendationGenerator recommendationGenerator,
            @Named(ExecutorProducer.ML_SCORING_EXECUTOR) ExecutorService executor,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.featureExtractor = featureExtractor;
        this.model = model;
        this.traditionalScorer = traditionalScorer;
        this.anomalyDetector = anomalyDetector;
        this.patternRecognizer = patternRecognizer;
        this.combiner = combiner;
        this.recommendationGenerator = recommendationGenerator;
        this.executor = executor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param input ranking history with optional long-term history and market hints
     * @return hybrid confidence with scores rounded to two decimals
     * @throws ValidationException if the rankings are missing, empty or malformed
     */
    public MLConfidenceResultDTO calculateMLConfidence(MLConfidenceInputDTO input) {
        validate(input);

        List<RankingRecordDTO> rankings = input.rankings();
        ContextualDataDTO context = input.contextualData();

        double[] features = featureExtractor.extract(rankings, context);
        double mlScore = model.adjust(model.predict(features), context);
        double traditionalScore = traditionalScorer.score(rankings);
        double anomalyScore = anomalyDetector.score(rankings);
        PatternRecognitionDTO patterns = patternRecognizer.recognize(rankings, input.historical());

        double hybridScore = combiner.combine(traditionalScore, mlScore, anomalyScore);
        ConfidenceLevel level = combiner.level(hybridScore);
        List<String> recommendations =
                recommendationGenerator.generate(
                        rankings, traditionalScore, mlScore, anomalyScore, patterns);

        LOG.debugf(
                "ML confidence for keyword %s: ml=%.3f traditional=%.3f anomaly=%.3f hybrid=%.3f (%s)",
                input.keywordId(), mlScore, traditionalScore, anomalyScore, hybridScore, level);
        countEvaluation(level);

        return new MLConfidenceResultDTO(
                round2(mlScore),
                round2(traditionalScore),
                round2(hybridScore),
                round2(anomalyScore),
                patterns,
                level,
                recommendations,
                model.metadata(clock.instant()));
    }

    /**
     * Scores several ranking histories. Any invalid input fails the whole batch.
     *
     * @param inputs histories to score
     * @return one result per input, in input order
     */
    public List<MLConfidenceResultDTO> calculateBatchMLConfidence(List<MLConfidenceInputDTO> inputs) {
        if (inputs == null) {
            throw ValidationException.missingField("inputs");
        }

        int groupSize = Math.max(1, batchSize);
        List<MLConfidenceResultDTO> results = new ArrayList<>(inputs.size());

        for (int start = 0; start < inputs.size(); start += groupSize) {
            List<MLConfidenceInputDTO> group =
                    inputs.subList(start, Math.min(start + groupSize, inputs.size()));

            List<CompletableFuture<MLConfidenceResultDTO>> futures =
                    group.stream()
                            .map(
                                    in ->
                                            CompletableFuture.supplyAsync(
                                                    () -> calculateMLConfidence(in), executor))
                            .toList();
            for (CompletableFuture<MLConfidenceResultDTO> future : futures) {
                results.add(await(future));
            }

            if (start + groupSize < inputs.size()) {
                pauseBetweenGroups();
            }
        }

        LOG.infof("Scored %d ranking histories in groups of %d", inputs.size(), groupSize);
        return results;
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static void validate(MLConfidenceInputDTO input) {
        if (input == null) {
            throw ValidationException.missingField("input");
        }
        if (input.rankings() == null) {
            throw ValidationException.missingField("rankings");
        }
        if (input.rankings().isEmpty()) {
            throw ValidationException.insufficientData("ranking records", 1, 0);
        }
        for (int i = 0; i < input.rankings().size(); i++) {
            RankingRecordDTO record = input.rankings().get(i);
            if (record == null) {
                throw ValidationException.missingField("rankings[" + i + "]");
            }
            record.validate("rankings[" + i + "]");
        }
        if (input.historical() != null) {
            for (int i = 0; i < input.historical().size(); i++) {
                RankingRecordDTO record = input.historical().get(i);
                if (record == null) {
                    throw ValidationException.missingField("historical[" + i + "]");
                }
                record.validate("historical[" + i + "]");
            }
        }
    }

    private static MLConfidenceResultDTO await(CompletableFuture<MLConfidenceResultDTO> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new SomeThingWentWrongException(e.getCause());
        }
    }

    private void pauseBetweenGroups() {
        if (batchPauseMs <= 0) {
            return;
        }
        try {
            Thread.sleep(batchPauseMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SomeThingWentWrongException(e);
        }
    }

    private void countEvaluation(ConfidenceLevel level) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("ml_confidence_evaluations_total")
                .description("ML confidence evaluations, by confidence level")
                .tag("level", level.getLabel())
                .register(meterRegistry)
                .increment();
    }
}
