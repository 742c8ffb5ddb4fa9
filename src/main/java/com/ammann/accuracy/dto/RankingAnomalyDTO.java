/* (C)2026 */
package com.ammann.accuracy.dto;

import com.ammann.accuracy.enumeration.AnomalySeverity;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Ranking record that deviates strongly from the rest of the history")
public record RankingAnomalyDTO(
        @Schema(description = "Time of the outlying check")
        Instant timestamp,

        @Schema(description = "Outlying position")
        double position,

        @Schema(description = "Absolute distance from the mean position")
        double deviation,

        @Schema(description = "high or medium")
        AnomalySeverity severity
) {
}
