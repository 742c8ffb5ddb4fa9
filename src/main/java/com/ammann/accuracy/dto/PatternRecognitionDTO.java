/* (C)2026 */
package com.ammann.accuracy.dto;

import com.ammann.accuracy.enumeration.RankingTrend;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Trend, seasonality and cycle classification of a ranking history")
public record PatternRecognitionDTO(
        RankingTrend trend,

        @Schema(description = "Seasonality strength (0.0 - 1.0)")
        double seasonality,

        boolean cycleDetected,

        List<RankingAnomalyDTO> anomalies
) {
}
