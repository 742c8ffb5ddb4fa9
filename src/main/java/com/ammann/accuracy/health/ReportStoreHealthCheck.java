/* (C)2026 */
package com.ammann.accuracy.health;

import com.ammann.accuracy.store.ReportStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness health check that verifies the report store answers a count query.
 *
 * <p>Reports DOWN if the store throws or the query takes longer than one second. Report
 * generation keeps working while the store is down, but nothing gets persisted.
 */
@Readiness
@ApplicationScoped
public class ReportStoreHealthCheck implements HealthCheck {

    static final String NAME = "report-store-health";
    static final long MAX_QUERY_MILLIS = 1000;

    private final ReportStore reportStore;

    @Inject
    public ReportStoreHealthCheck(ReportStore reportStore) {
        this.reportStore = reportStore;
    }

    @Override
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();
            long totalReports = reportStore.count();
            Duration queryTime = Duration.between(start, Instant.now());
            boolean performanceOk = queryTime.toMillis() < MAX_QUERY_MILLIS;

            return HealthCheckResponse.named(NAME)
                    .status(performanceOk)
                    .withData("total-reports", totalReports)
                    .withData("query-time-ms", queryTime.toMillis())
                    .withData("performance-ok", performanceOk)
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("store-accessible", false)
                    .build();
        }
    }
}
