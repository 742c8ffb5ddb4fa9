/* (C)2026 */
package com.ammann.accuracy.resource;

import com.ammann.accuracy.dto.AccuracyCheckRequestDTO;
import com.ammann.accuracy.dto.AccuracyReportDTO;
import com.ammann.accuracy.dto.DiscrepancyDTO;
import com.ammann.accuracy.dto.ProjectAccuracyStatusDTO;
import com.ammann.accuracy.exception.ValidationException;
import com.ammann.accuracy.properties.ApiProperties;
import com.ammann.accuracy.service.AccuracyReportService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for discrepancy detection and accuracy reports.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Accuracy.BASE)
@Tag(name = "Accuracy API", description = "Cross-source discrepancies and accuracy reports")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AccuracyResource {

    private static final Logger LOG = Logger.getLogger(AccuracyResource.class);

    @Inject AccuracyReportService reportService;

    @POST
    @Path(ApiProperties.Accuracy.DISCREPANCIES)
    @Operation(
            summary = "Detect discrepancies",
            description = "Classifies the variance between the primary observation and each comparison")
    public Response detectDiscrepancies(AccuracyCheckRequestDTO request) {
        requireBody(request);
        List<DiscrepancyDTO> discrepancies =
                reportService.detectDiscrepancies(request.primary(), request.compareOrEmpty());
        return Response.ok(discrepancies).build();
    }

    @POST
    @Path(ApiProperties.Accuracy.REPORT)
    @Operation(
            summary = "Generate accuracy report",
            description = "Scores the observation, classifies discrepancies and stores the report")
    public Response generateReport(AccuracyCheckRequestDTO request) {
        requireBody(request);
        requireText(request.projectId(), "projectId");
        requireText(request.metric(), "metric");
        LOG.debugf(
                "Accuracy report requested for project=%s metric=%s",
                request.projectId(), request.metric());

        AccuracyReportDTO report =
                reportService.generateAccuracyReport(
                        request.projectId(),
                        request.metric(),
                        request.primary(),
                        request.compareOrEmpty());
        return Response.ok(report).build();
    }

    @GET
    @Path(ApiProperties.Accuracy.HISTORY)
    @Operation(
            summary = "Accuracy history",
            description = "Returns the project's reports of the last days, newest first")
    public Response getHistory(
            @QueryParam("projectId") String projectId,
            @QueryParam("metric") String metric,
            @Parameter(description = "Look-back window in days (1 - 365)")
                    @QueryParam("days")
                    @DefaultValue("30")
                    int days) {
        requireText(projectId, "projectId");
        List<AccuracyReportDTO> history = reportService.getAccuracyHistory(projectId, metric, days);
        return Response.ok(history).build();
    }

    @GET
    @Path(ApiProperties.Accuracy.STATUS)
    @Operation(
            summary = "Project accuracy status",
            description = "Summarises the project's reports of the last 24 hours")
    public Response getStatus(@QueryParam("projectId") String projectId) {
        requireText(projectId, "projectId");
        ProjectAccuracyStatusDTO status = reportService.getProjectAccuracyStatus(projectId);
        return Response.ok(status).build();
    }

    static void requireBody(Object body) {
        if (body == null) {
            throw ValidationException.missingField("body");
        }
    }

    static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingField(field);
        }
    }
}
