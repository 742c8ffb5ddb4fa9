/* (C)2026 */
package com.ammann.accuracy.dto;

import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One observation of a metric from one source. Read-only input to the scoring engine.
 *
 * <p>Negative values are valid (for example delta metrics).
 */
@Schema(description = "Single observation of an SEO metric from one data source")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataPointDTO(
        @Schema(description = "Caller-assigned observation id")
        String id,

        @Schema(description = "Provider the value was obtained from", required = true)
        DataSource source,

        @Schema(description = "Observed metric value", required = true)
        Double value,

        @Schema(description = "Time the value was observed", required = true)
        Instant timestamp,

        @Schema(description = "Free-form provider metadata")
        Map<String, Object> metadata
) {
    /** Earliest accepted observation time. */
    public static final Instant MIN_TIMESTAMP = Instant.parse("0001-01-01T00:00:00Z");

    /** Latest accepted observation time. */
    public static final Instant MAX_TIMESTAMP = Instant.parse("9999-12-31T23:59:59Z");

    static final String TIMESTAMP_RANGE = "an instant between " + MIN_TIMESTAMP + " and " + MAX_TIMESTAMP;

    public static DataPointDTO of(String id, DataSource source, double value, Instant timestamp) {
        return new DataPointDTO(id, source, value, timestamp, null);
    }

    /**
     * Checks that the required fields are present and finite and that the timestamp lies within
     * {@link #MIN_TIMESTAMP} and {@link #MAX_TIMESTAMP}.
     *
     * @param field name of this data point in the request, used in error messages
     * @throws ValidationException naming the first offending field
     */
    public void validate(String field) {
        if (source == null) {
            throw ValidationException.missingField(field + ".source");
        }
        if (value == null) {
            throw ValidationException.missingField(field + ".value");
        }
        if (value.isNaN() || value.isInfinite()) {
            throw ValidationException.invalidParameter(field + ".value", value, "a finite number");
        }
        if (timestamp == null) {
            throw ValidationException.missingField(field + ".timestamp");
        }
        if (!isSupportedTimestamp(timestamp)) {
            throw ValidationException.invalidParameter(field + ".timestamp", timestamp, TIMESTAMP_RANGE);
        }
    }

    static boolean isSupportedTimestamp(Instant instant) {
        return !instant.isBefore(MIN_TIMESTAMP) && !instant.isAfter(MAX_TIMESTAMP);
    }
}
