/* (C)2026 */
package com.ammann.accuracy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Immutable accuracy verdict for one metric observation. A new check always produces
 * a new report; existing reports are never updated.
 */
@Schema(description = "Accuracy report for one metric observation")
public record AccuracyReportDTO(
        @Schema(description = "Report id")
        String id,

        @Schema(description = "Project the metric belongs to")
        String projectId,

        @Schema(description = "Metric name, e.g. organic_clicks")
        String metric,

        @Schema(description = "Value of the primary observation")
        double primaryValue,

        @Schema(description = "Comparison observations")
        List<SecondaryValueDTO> secondaryValues,

        @Schema(description = "Confidence score breakdown")
        ConfidenceScoreDTO confidenceScore,

        @Schema(description = "Classified cross-source discrepancies")
        List<DiscrepancyDTO> discrepancies,

        @Schema(description = "Whether the observation is considered accurate")
        @JsonProperty("isAccurate")
        boolean isAccurate,

        @Schema(description = "Time the report was built")
        Instant checkedAt
) {
    public AccuracyReportDTO {
        secondaryValues = secondaryValues == null ? List.of() : List.copyOf(secondaryValues);
        discrepancies = discrepancies == null ? List.of() : List.copyOf(discrepancies);
    }
}
