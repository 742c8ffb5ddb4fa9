/* (C)2026 */
package com.ammann.accuracy.ml;

import static com.ammann.accuracy.support.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.accuracy.dto.ContextualDataDTO;
import com.ammann.accuracy.dto.ModelMetadataDTO;
import com.ammann.accuracy.exception.ValidationException;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class SimulatedInferenceModelTest {

    private final SimulatedInferenceModel model = new SimulatedInferenceModel();

    @Test
    void zeroInputLeavesOnlyBiases() {
        double output =
                0.15
                        + Math.tanh(0.1) * 0.24
                        + Math.tanh(-0.05) * 0.31
                        + Math.tanh(0.08) * 0.28
                        + Math.tanh(0.02) * 0.17;
        double expected = 1.0 / (1.0 + Math.exp(-output));

        assertThat(model.predict(new double[11])).isCloseTo(expected, within(1e-12));
    }

    @Test
    void predictionIsAProbability() {
        double[] high = new double[11];
        Arrays.fill(high, 1.0);
        double[] low = new double[11];
        Arrays.fill(low, -1.0);

        assertThat(model.predict(high)).isStrictlyBetween(0.0, 1.0);
        assertThat(model.predict(low)).isStrictlyBetween(0.0, 1.0);
        assertThat(model.predict(high)).isGreaterThan(model.predict(low));
    }

    @Test
    void rejectsWrongFeatureCount() {
        assertThatThrownBy(() -> model.predict(new double[10]))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("features");
        assertThatThrownBy(() -> model.predict(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void defaultCompetitionDiscountsByFivePercent() {
        assertThat(model.adjust(0.8, null)).isCloseTo(0.76, within(1e-12));
    }

    @Test
    void competitiveSeasonalMarketStacksDiscounts() {
        ContextualDataDTO context = new ContextualDataDTO("competitive", 0.8, 0.9, null);

        assertThat(model.adjust(0.8, context)).isCloseTo(0.8 * 0.9 * 0.92 * 0.95, within(1e-12));
    }

    @Test
    void seasonalityDiscountStartsAboveSeventyPercent() {
        ContextualDataDTO atThreshold = new ContextualDataDTO(null, 0.0, 0.7, null);
        ContextualDataDTO absent = new ContextualDataDTO(null, 0.0, null, null);

        assertThat(model.adjust(0.8, atThreshold)).isCloseTo(0.8, within(1e-12));
        assertThat(model.adjust(0.8, absent)).isCloseTo(0.8, within(1e-12));
    }

    @Test
    void adjustedScoreIsClamped() {
        assertThat(model.adjust(1.5, new ContextualDataDTO(null, 0.0, null, null))).isEqualTo(1.0);
        assertThat(model.adjust(-0.2, null)).isZero();
    }

    @Test
    void metadataDescribesFixedModel() {
        ModelMetadataDTO metadata = model.metadata(NOW);

        assertThat(metadata.version()).isEqualTo("1.0.0");
        assertThat(metadata.trainedSamples()).isEqualTo(10_000);
        assertThat(metadata.accuracy()).isEqualTo(0.94);
        assertThat(metadata.lastUpdated()).isEqualTo(NOW);
    }

    @Test
    void sigmoidIsCentredOnZero() {
        assertThat(SimulatedInferenceModel.sigmoid(0)).isEqualTo(0.5);
    }
}
