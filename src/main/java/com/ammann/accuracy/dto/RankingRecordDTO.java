/* (C)2026 */
package com.ammann.accuracy.dto;

import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One ranking check of a tracked keyword.
 */
@Schema(description = "Ranking observation of a tracked keyword")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RankingRecordDTO(
        @Schema(description = "SERP position (1 = top)", required = true)
        Double position,

        @Schema(description = "Time of the ranking check", required = true)
        Instant checkedAt,

        @Schema(description = "Clicks reported for the check, if any")
        Long clicks,

        @Schema(description = "Impressions reported for the check, if any")
        Long impressions,

        @Schema(description = "Provider of the ranking")
        DataSource source
) {
    public static RankingRecordDTO of(double position, Instant checkedAt, DataSource source) {
        return new RankingRecordDTO(position, checkedAt, null, null, source);
    }

    public boolean hasTrafficData() {
        return clicks != null || impressions != null;
    }

    /**
     * @param field name of this record in the request, used in error messages
     * @throws ValidationException naming the first missing, non-finite or out-of-range field
     */
    public void validate(String field) {
        if (position == null) {
            throw ValidationException.missingField(field + ".position");
        }
        if (position.isNaN() || position.isInfinite()) {
            throw ValidationException.invalidParameter(field + ".position", position, "a finite number");
        }
        if (checkedAt == null) {
            throw ValidationException.missingField(field + ".checkedAt");
        }
        if (!DataPointDTO.isSupportedTimestamp(checkedAt)) {
            throw ValidationException.invalidParameter(
                    field + ".checkedAt", checkedAt, DataPointDTO.TIMESTAMP_RANGE);
        }
    }
}
