/* (C)2026 */
package com.ammann.accuracy.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request body for confidence scoring, discrepancy detection and report generation.
 */
@Schema(description = "Primary observation of a metric and optional comparison observations")
public record AccuracyCheckRequestDTO(
        @Schema(description = "Project id")
        String projectId,

        @Schema(description = "Metric name")
        String metric,

        @Schema(description = "Primary observation", required = true)
        DataPointDTO primary,

        @Schema(description = "Observations of the same metric from other sources")
        List<DataPointDTO> compare
) {
    public List<DataPointDTO> compareOrEmpty() {
        return compare == null ? List.of() : compare;
    }
}
