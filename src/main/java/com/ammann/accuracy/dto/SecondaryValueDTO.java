/* (C)2026 */
package com.ammann.accuracy.dto;

import com.ammann.accuracy.enumeration.DataSource;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Comparison observation recorded in an accuracy report")
public record SecondaryValueDTO(
        DataSource source,
        double value,
        Instant timestamp
) {
    public static SecondaryValueDTO from(DataPointDTO point) {
        return new SecondaryValueDTO(point.source(), point.value(), point.timestamp());
    }
}
