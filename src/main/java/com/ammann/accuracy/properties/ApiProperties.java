/* (C)2026 */
package com.ammann.accuracy.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Accuracy report endpoints
     */
    public static final class Accuracy {
        private Accuracy() {}

        public static final String BASE = "/accuracy";
        public static final String DISCREPANCIES = "/discrepancies";
        public static final String REPORT = "/report";
        public static final String HISTORY = "/history";
        public static final String STATUS = "/status";
    }

    /**
     * Confidence scoring endpoints
     */
    public static final class Confidence {
        private Confidence() {}

        public static final String BASE = "/confidence";
        public static final String SCORE = "/score";
        public static final String ML = "/ml";
        public static final String ML_BATCH = ML + "/batch";
    }
}
