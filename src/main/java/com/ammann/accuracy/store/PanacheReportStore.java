/* (C)2026 */
package com.ammann.accuracy.store;

import com.ammann.accuracy.dto.AccuracyReportDTO;
import com.ammann.accuracy.exception.StorageException;
import com.ammann.accuracy.model.AccuracyReport;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * {@link ReportStore} backed by the {@code accuracy_reports} table.
 *
 * <p>Every write runs in its own transaction so a caller's transaction never rolls back
 * because of a failed report write, and vice versa.
 */
@ApplicationScoped
public class PanacheReportStore implements ReportStore {

    private static final Logger LOG = Logger.getLogger(PanacheReportStore.class);

    @Override
    public void create(AccuracyReportDTO report) {
        try {
            QuarkusTransaction.requiringNew().run(() -> AccuracyReport.from(report).persist());
            LOG.debugf("Stored accuracy report %s", report.id());
        } catch (RuntimeException e) {
            throw new StorageException("Failed to store accuracy report " + report.id(), e);
        }
    }

    @Override
    @ActivateRequestContext
    public List<AccuracyReportDTO> findMany(ReportQuery query) {
        StringBuilder jpql =
                new StringBuilder("projectId = :projectId and checkedAt >= :from and checkedAt <= :to");
        Parameters params =
                Parameters.with("projectId", query.projectId())
                        .and("from", query.from())
                        .and("to", query.to());
        if (query.metric() != null) {
            jpql.append(" and metric = :metric");
            params.and("metric", query.metric());
        }

        try {
            PanacheQuery<AccuracyReport> reports =
                    AccuracyReport.find(jpql.toString(), Sort.descending("checkedAt"), params);
            if (!query.isUnlimited()) {
                reports.page(0, Math.max(1, query.limit()));
            }
            return reports.list().stream().map(AccuracyReport::toDTO).toList();
        } catch (RuntimeException e) {
            throw new StorageException(
                    "Failed to read accuracy reports for project " + query.projectId(), e);
        }
    }

    @Override
    @ActivateRequestContext
    public long count() {
        try {
            return AccuracyReport.count();
        } catch (RuntimeException e) {
            throw new StorageException("Failed to count accuracy reports", e);
        }
    }
}
