/* (C)2026 */
package com.ammann.accuracy.resource;

import com.ammann.accuracy.dto.AccuracyCheckRequestDTO;
import com.ammann.accuracy.dto.ConfidenceScoreDTO;
import com.ammann.accuracy.dto.MLConfidenceInputDTO;
import com.ammann.accuracy.dto.MLConfidenceResultDTO;
import com.ammann.accuracy.exception.ValidationException;
import com.ammann.accuracy.properties.ApiProperties;
import com.ammann.accuracy.service.ConfidenceScoringService;
import com.ammann.accuracy.service.MLConfidenceService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource for multi-factor and ML confidence scoring.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Confidence.BASE)
@Tag(name = "Confidence API", description = "Confidence scores for metrics and keyword rankings")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfidenceResource {

    private static final int MAX_BATCH_SIZE = 500;

    @Inject ConfidenceScoringService confidenceScoringService;

    @Inject MLConfidenceService mlConfidenceService;

    @POST
    @Path(ApiProperties.Confidence.SCORE)
    @Operation(
            summary = "Confidence score",
            description = "Freshness, consistency, reliability and completeness of an observation")
    public Response score(AccuracyCheckRequestDTO request) {
        AccuracyResource.requireBody(request);
        ConfidenceScoreDTO score =
                confidenceScoringService.calculateConfidenceScore(
                        request.projectId(),
                        request.metric(),
                        request.primary(),
                        request.compareOrEmpty());
        return Response.ok(score).build();
    }

    @POST
    @Path(ApiProperties.Confidence.ML)
    @Operation(
            summary = "ML confidence",
            description = "Hybrid heuristic and model confidence for a keyword ranking history")
    public Response mlConfidence(MLConfidenceInputDTO input) {
        AccuracyResource.requireBody(input);
        MLConfidenceResultDTO result = mlConfidenceService.calculateMLConfidence(input);
        return Response.ok(result).build();
    }

    @POST
    @Path(ApiProperties.Confidence.ML_BATCH)
    @Operation(
            summary = "Batch ML confidence",
            description = "Scores several ranking histories; results keep the request order")
    public Response mlConfidenceBatch(List<MLConfidenceInputDTO> inputs) {
        AccuracyResource.requireBody(inputs);
        if (inputs.size() > MAX_BATCH_SIZE) {
            throw ValidationException.invalidParameter(
                    "inputs", inputs.size() + " items", "at most " + MAX_BATCH_SIZE + " items");
        }
        List<MLConfidenceResultDTO> results = mlConfidenceService.calculateBatchMLConfidence(inputs);
        return Response.ok(results).build();
    }
}
