/* (C)2026 */
package com.ammann.accuracy.ml;

import com.ammann.accuracy.dto.ContextualDataDTO;
import com.ammann.accuracy.dto.ModelMetadataDTO;
import com.ammann.accuracy.exception.ValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;

/**
 * Fixed-weight feedforward approximator standing in for a trained confidence model.
 *
 * <p>Architecture: 11 inputs, one hidden layer of 4 {@code tanh} units, one logistic
 * output unit. The weights below were produced offline and are never updated at runtime;
 * there is no training pipeline. Do not tune them here.
 */
@ApplicationScoped
public class SimulatedInferenceModel {

    public static final String MODEL_VERSION = "1.0.0";
    public static final int TRAINED_SAMPLES = 10_000;
    public static final double MODEL_ACCURACY = 0.94;

    static final double[][] HIDDEN_WEIGHTS = {
        {0.15, -0.12, 0.25, 0.18, 0.22, -0.08, 0.31, 0.14, -0.09, 0.16, 0.11},
        {0.09, -0.18, 0.28, 0.15, 0.19, -0.11, 0.26, 0.12, -0.07, 0.14, 0.13},
        {0.11, -0.15, 0.32, 0.21, 0.17, -0.09, 0.29, 0.16, -0.08, 0.18, 0.12},
        {0.13, -0.14, 0.27, 0.19, 0.24, -0.10, 0.33, 0.15, -0.06, 0.17, 0.14}
    };
    static final double[] HIDDEN_BIASES = {0.1, -0.05, 0.08, 0.02};
    static final double[] OUTPUT_WEIGHTS = {0.24, 0.31, 0.28, 0.17};
    static final double OUTPUT_BIAS = 0.15;

    static final double COMPETITIVE_INDUSTRY_FACTOR = 0.9;
    static final double COMPETITION_PENALTY = 0.1;
    static final double HIGH_SEASONALITY_THRESHOLD = 0.7;
    static final double HIGH_SEASONALITY_FACTOR = 0.95;

    /**
     * Evaluates the network.
     *
     * @param features vector produced by {@link RankingFeatureExtractor}
     * @return probability in (0, 1)
     */
    public double predict(double[] features) {
        if (features == null || features.length != RankingFeatureExtractor.FEATURE_COUNT) {
            throw ValidationException.invalidParameter(
                    "features",
                    features == null ? null : features.length + " values",
                    RankingFeatureExtractor.FEATURE_COUNT + " values");
        }

        double output = OUTPUT_BIAS;
        for (int unit = 0; unit < HIDDEN_WEIGHTS.length; unit++) {
            double sum = HIDDEN_BIASES[unit];
            for (int j = 0; j < features.length; j++) {
                sum += features[j] * HIDDEN_WEIGHTS[unit][j];
            }
            output += Math.tanh(sum) * OUTPUT_WEIGHTS[unit];
        }

        return sigmoid(output);
    }

    /**
     * Applies market adjustments to a raw prediction and clamps to [0, 1].
     *
     * @param prediction output of {@link #predict(double[])}
     * @param context optional market hints
     */
    public double adjust(double prediction, ContextualDataDTO context) {
        double adjusted = prediction;

        if (context != null && context.isCompetitiveIndustry()) {
            adjusted *= COMPETITIVE_INDUSTRY_FACTOR;
        }

        double competitionLevel = RankingFeatureExtractor.competitionLevel(context);
        adjusted *= (1 - competitionLevel * COMPETITION_PENALTY);

        if (context != null
                && context.seasonality() != null
                && context.seasonality() > HIGH_SEASONALITY_THRESHOLD) {
            adjusted *= HIGH_SEASONALITY_FACTOR;
        }

        return Math.max(0.0, Math.min(1.0, adjusted));
    }

    public ModelMetadataDTO metadata(Instant evaluatedAt) {
        return new ModelMetadataDTO(MODEL_VERSION, TRAINED_SAMPLES, MODEL_ACCURACY, evaluatedAt);
    }

    static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }
}
