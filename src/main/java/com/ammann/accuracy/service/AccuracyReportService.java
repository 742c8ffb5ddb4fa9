/* (C)2026 */
package com.ammann.accuracy.service;

import com.ammann.accuracy.dto.AccuracyReportDTO;
import com.ammann.accuracy.dto.ConfidenceScoreDTO;
import com.ammann.accuracy.dto.DataPointDTO;
import com.ammann.accuracy.dto.DiscrepancyDTO;
import com.ammann.accuracy.dto.ProjectAccuracyStatusDTO;
import com.ammann.accuracy.dto.SecondaryValueDTO;
import com.ammann.accuracy.exception.ValidationException;
import com.ammann.accuracy.scoring.ConfidenceAggregator;
import com.ammann.accuracy.scoring.DiscrepancyDetector;
import com.ammann.accuracy.scoring.FreshnessScorer;
import com.ammann.accuracy.store.ReportQuery;
import com.ammann.accuracy.store.ReportStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Builds, stores and summarises accuracy reports.
 *
 * <p>The report store is best effort: a failed write is logged and counted, and the computed
 * report is still returned. Reads degrade to empty results when the store is unavailable.
 */
@ApplicationScoped
public class AccuracyReportService {

    private static final Logger LOG = Logger.getLogger(AccuracyReportService.class);

    static final int DEFAULT_HISTORY_DAYS = 30;
    static final int MAX_HISTORY_DAYS = 365;
    static final Duration STATUS_WINDOW = Duration.ofHours(24);
    static final int CRITICAL_CONFIDENCE = 50;

    @ConfigProperty(name = "accuracy.history.max-results", defaultValue = "100")
    int maxResults = 100;

    private final ConfidenceScoringService confidenceScoringService;
    private final DiscrepancyDetector discrepancyDetector;
    private final ConfidenceAggregator aggregator;
    private final FreshnessScorer freshnessScorer;
    private final AccuracyAlertService alertService;
    private final ReportStore reportStore;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Inject
    public AccuracyReportService(
            ConfidenceScoringService confidenceScoringService,
            DiscrepancyDetector discrepancyDetector,
            ConfidenceAggregator aggregator,
            FreshnessScorer freshnessScorer,
            AccuracyAlertService alertService,
            ReportStore reportStore,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.confidenceScoringService = confidenceScoringService;
        this.discrepancyDetector = discrepancyDetector;
        this.aggregator = aggregator;
        this.freshnessScorer = freshnessScorer;
        this.alertService = alertService;
        this.reportStore = reportStore;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @throws ValidationException if a required field of an observation is missing
     */
    public List<DiscrepancyDTO> detectDiscrepancies(DataPointDTO primary, List<DataPointDTO> compare) {
        List<DataPointDTO> comparisons = ConfidenceScoringService.validate(primary, compare);
        return discrepancyDetector.detect(primary, comparisons);
    }

    /**
     * Scores the primary observation, classifies discrepancies and stores the resulting
     * report. A store failure never fails the call.
     *
     * @throws ValidationException if a required field of an observation is missing
     */
    public AccuracyReportDTO generateAccuracyReport(
            String projectId, String metric, DataPointDTO primary, List<DataPointDTO> compare) {
        List<DataPointDTO> comparisons = ConfidenceScoringService.validate(primary, compare);

        ConfidenceScoreDTO confidence =
                confidenceScoringService.calculateConfidenceScore(
                        projectId, metric, primary, comparisons);
        List<DiscrepancyDTO> discrepancies = discrepancyDetector.detect(primary, comparisons);
        boolean accurate = aggregator.isAccurate(confidence.overall(), discrepancies);

        AccuracyReportDTO report =
                new AccuracyReportDTO(
                        UUID.randomUUID().toString(),
                        projectId,
                        metric,
                        primary.value(),
                        comparisons.stream().map(SecondaryValueDTO::from).toList(),
                        confidence,
                        discrepancies,
                        accurate,
                        clock.instant());

        boolean persisted = persist(report);
        alertService.evaluate(report, primary.timestamp());

        LOG.infof(
                "Accuracy report %s for project=%s metric=%s: overall=%d accurate=%s"
                        + " discrepancies=%d persisted=%s",
                report.id(),
                projectId,
                metric,
                confidence.overall(),
                accurate,
                discrepancies.size(),
                persisted);

        return report;
    }

    /**
     * @param days look-back window, 1 to 365
     * @return reports newest first, empty if the store is unavailable
     * @throws ValidationException if {@code days} is out of range
     */
    public List<AccuracyReportDTO> getAccuracyHistory(String projectId, String metric, int days) {
        if (days < 1 || days > MAX_HISTORY_DAYS) {
            throw ValidationException.invalidParameter("days", days, "a value between 1 and 365");
        }

        Instant now = clock.instant();
        return readReports(
                new ReportQuery(projectId, metric, now.minus(Duration.ofDays(days)), now, maxResults));
    }

    /**
     * Summarises the project's reports from the last 24 hours.
     */
    public ProjectAccuracyStatusDTO getProjectAccuracyStatus(String projectId) {
        Instant now = clock.instant();
        List<AccuracyReportDTO> recent =
                readReports(
                        new ReportQuery(
                                projectId,
                                null,
                                now.minus(STATUS_WINDOW),
                                now,
                                ReportQuery.UNLIMITED));

        if (recent.isEmpty()) {
            return ProjectAccuracyStatusDTO.empty();
        }

        long accurate = recent.stream().filter(AccuracyReportDTO::isAccurate).count();
        int overallAccuracy = (int) Math.round(100.0 * accurate / recent.size());
        int averageConfidence =
                (int)
                        Math.round(
                                recent.stream()
                                        .mapToInt(r -> r.confidenceScore().overall())
                                        .average()
                                        .orElse(0.0));
        int criticalIssues =
                (int)
                        recent.stream()
                                .filter(r -> r.confidenceScore().overall() < CRITICAL_CONFIDENCE)
                                .count();

        Instant lastChecked =
                recent.stream()
                        .map(AccuracyReportDTO::checkedAt)
                        .max(Instant::compareTo)
                        .orElseThrow();

        return new ProjectAccuracyStatusDTO(
                overallAccuracy,
                lastChecked,
                criticalIssues,
                averageConfidence,
                freshnessScorer.score(lastChecked));
    }

    private boolean persist(AccuracyReportDTO report) {
        try {
            reportStore.create(report);
            countReport(true);
            return true;
        } catch (RuntimeException e) {
            LOG.warnf(
                    e,
                    "Failed to store accuracy report %s for project %s, returning it unsaved",
                    report.id(),
                    report.projectId());
            countReport(false);
            return false;
        }
    }

    private List<AccuracyReportDTO> readReports(ReportQuery query) {
        try {
            return reportStore.findMany(query);
        } catch (RuntimeException e) {
            LOG.warnf("Failed to read accuracy reports for project %s: %s", query.projectId(), e.getMessage());
            return List.of();
        }
    }

    private void countReport(boolean persisted) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("accuracy_reports_total")
                .description("Accuracy reports built, by storage outcome")
                .tag("persisted", String.valueOf(persisted))
                .register(meterRegistry)
                .increment();
    }
}
