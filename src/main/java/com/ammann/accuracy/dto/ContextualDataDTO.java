/* (C)2026 */
package com.ammann.accuracy.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Optional hints about the market a keyword competes in. Absent values fall back to
 * neutral defaults in feature extraction.
 */
@Schema(description = "Contextual hints for ML confidence scoring")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextualDataDTO(
        @Schema(description = "Industry label; \"competitive\" lowers confidence")
        String industry,

        @Schema(description = "Competition level (0.0 - 1.0)")
        Double competitionLevel,

        @Schema(description = "Seasonality factor (0.0 - 1.0)")
        Double seasonality,

        @Schema(description = "Monthly search volume")
        Double searchVolume
) {
    public static final String COMPETITIVE_INDUSTRY = "competitive";

    public boolean isCompetitiveIndustry() {
        return COMPETITIVE_INDUSTRY.equals(industry);
    }
}
