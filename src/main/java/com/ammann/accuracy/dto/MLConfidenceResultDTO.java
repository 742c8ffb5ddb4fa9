/* (C)2026 */
package com.ammann.accuracy.dto;

import com.ammann.accuracy.enumeration.ConfidenceLevel;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Hybrid confidence for a ranking history. Scores are reported rounded to two decimals.
 */
@Schema(description = "Hybrid ML confidence result")
public record MLConfidenceResultDTO(
        @Schema(description = "Simulated inference score (0.0 - 1.0)")
        double mlScore,

        @Schema(description = "Heuristic score (0.0 - 1.0)")
        double traditionalScore,

        @Schema(description = "Anomaly-adjusted blend of both scores (0.0 - 1.0)")
        double hybridScore,

        @Schema(description = "1.0 means no anomalies (0.0 - 1.0)")
        double anomalyScore,

        PatternRecognitionDTO patternRecognition,

        ConfidenceLevel confidenceLevel,

        List<String> recommendations,

        ModelMetadataDTO modelMetadata
) {
}
