/* (C)2026 */
package com.ammann.accuracy.exception;

/**
 * Exception indicating that the report store or the integration status table is
 * unavailable or rejected an operation.
 *
 * <p>Scoring never propagates this exception to callers: report persistence is
 * best-effort and reads degrade to empty results. It only reaches
 * {@link GlobalExceptionHandler} if a collaborator outside the engine lets it escape,
 * in which case it maps to HTTP 503.
 */
public class StorageException extends ApiException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
