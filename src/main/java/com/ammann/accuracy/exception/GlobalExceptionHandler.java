/* (C)2026 */
package com.ammann.accuracy.exception;

import com.ammann.accuracy.dto.ErrorResponseDTO;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Global JAX-RS exception mapper that translates application and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Unhandled exceptions are logged at ERROR level and returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof ValidationException) {
            LOG.debugf("Validation failed for path %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path
            );
        }

        if (exception instanceof StorageException) {
            LOG.warnf("Storage error for path %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.SERVICE_UNAVAILABLE,
                    exception.getMessage(),
                    "STORAGE_ERROR",
                    path
            );
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    path
            );
        }

        if (exception instanceof SomeThingWentWrongException) {
            LOG.errorf(exception, "Internal error for path %s", path);
            return createResponse(
                    Response.Status.INTERNAL_SERVER_ERROR,
                    exception.getMessage(),
                    "INTERNAL_ERROR",
                    path
            );
        }

        if (exception instanceof WebApplicationException webException) {
            Response.Status status = Response.Status.fromStatusCode(webException.getResponse().getStatus());
            if (status != null && status.getFamily() == Response.Status.Family.CLIENT_ERROR) {
                return createResponse(status, exception.getMessage(), "CLIENT_ERROR", path);
            }
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path)
    {
        ErrorResponseDTO body = new ErrorResponseDTO(message, code, path, status.getStatusCode());
        return Response.status(status).entity(body).build();
    }
}
