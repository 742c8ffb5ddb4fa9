/* (C)2026 */
package com.ammann.accuracy.dto;

import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Accuracy summary of a project over the last 24 hours.
 */
@Schema(description = "Real-time accuracy status of a project")
public record ProjectAccuracyStatusDTO(
        @Schema(description = "Percentage of recent reports judged accurate")
        int overallAccuracy,

        @Schema(description = "Time of the newest report, null if none")
        Instant lastChecked,

        @Schema(description = "Number of recent reports with overall confidence below 50")
        int criticalIssues,

        @Schema(description = "Mean overall confidence of recent reports")
        int averageConfidence,

        @Schema(description = "Freshness score of the newest report")
        int dataFreshness
) {
    public static ProjectAccuracyStatusDTO empty() {
        return new ProjectAccuracyStatusDTO(0, null, 0, 0, 0);
    }
}
