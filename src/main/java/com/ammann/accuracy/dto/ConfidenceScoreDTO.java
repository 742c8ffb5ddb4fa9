/* (C)2026 */
package com.ammann.accuracy.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Multi-factor confidence score. Every component lies in [0, 100]; {@code overall} is
 * derived from the other four by {@link com.ammann.accuracy.scoring.ConfidenceAggregator}.
 */
@Schema(description = "Confidence score breakdown (0 - 100)")
public record ConfidenceScoreDTO(
        @Schema(description = "Weighted overall confidence")
        int overall,

        @Schema(description = "Score based on data age")
        int freshness,

        @Schema(description = "Score based on cross-source agreement")
        int consistency,

        @Schema(description = "Score based on source trustworthiness")
        int reliability,

        @Schema(description = "Share of expected sources that are connected")
        double completeness
) {
}
