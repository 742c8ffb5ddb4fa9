/* (C)2026 */
package com.ammann.accuracy.dto;

import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.enumeration.DiscrepancySeverity;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Variance between the primary observation and one comparison observation")
public record DiscrepancyDTO(
        @Schema(description = "Source of the primary observation")
        DataSource source1,

        @Schema(description = "Source of the comparison observation")
        DataSource source2,

        @Schema(description = "Primary value")
        double value1,

        @Schema(description = "Comparison value")
        double value2,

        @Schema(description = "Relative absolute difference |value1 - value2| / |value1|")
        double variance,

        @Schema(description = "Severity tier of the variance")
        DiscrepancySeverity severity,

        @Schema(description = "Human-readable explanation of the severity tier")
        String explanation
) {
}
