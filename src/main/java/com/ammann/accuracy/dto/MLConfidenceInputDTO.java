/* (C)2026 */
package com.ammann.accuracy.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Ranking history to score with the hybrid ML confidence model")
public record MLConfidenceInputDTO(
        @Schema(description = "Tracked keyword id")
        String keywordId,

        @Schema(description = "Recent ranking records", required = true)
        List<RankingRecordDTO> rankings,

        @Schema(description = "Longer ranking history used for seasonality")
        List<RankingRecordDTO> historical,

        @Schema(description = "Optional market hints")
        ContextualDataDTO contextualData
) {
    public static MLConfidenceInputDTO of(List<RankingRecordDTO> rankings) {
        return new MLConfidenceInputDTO(null, rankings, null, null);
    }
}
