/* (C)2026 */
package com.ammann.accuracy.dto;

import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Describes the fixed-weight inference model. Values are nominal constants, not measured.
 */
@Schema(description = "Metadata of the simulated inference model")
public record ModelMetadataDTO(
        String version,
        int trainedSamples,
        double accuracy,
        Instant lastUpdated
) {
}
