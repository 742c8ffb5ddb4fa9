/* (C)2026 */
package com.ammann.accuracy.service;

import com.ammann.accuracy.dto.AccuracyAlertDTO;
import com.ammann.accuracy.dto.AccuracyReportDTO;
import com.ammann.accuracy.dto.DiscrepancyDTO;
import com.ammann.accuracy.enumeration.AccuracyAlertType;
import com.ammann.accuracy.enumeration.AlertSeverity;
import com.ammann.accuracy.enumeration.DiscrepancySeverity;
import com.ammann.accuracy.scoring.FreshnessScorer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Evaluates a freshly built accuracy report against the configured alert thresholds.
 *
 * <p>Raised alerts are logged at WARN and counted in {@code accuracy_alerts_total}. Delivery
 * to external channels is left to log shipping and metric alerting.
 */
@ApplicationScoped
public class AccuracyAlertService {

    private static final Logger LOG = Logger.getLogger(AccuracyAlertService.class);

    static final double STALE_HIGH_HOURS = 72.0;
    static final double CRITICAL_VARIANCE = 0.5;

    @ConfigProperty(name = "accuracy.alerts.enabled", defaultValue = "true")
    boolean enabled = true;

    @ConfigProperty(name = "accuracy.alerts.confidence-threshold", defaultValue = "70")
    int confidenceThreshold = 70;

    @ConfigProperty(name = "accuracy.alerts.consistency-threshold", defaultValue = "50")
    int consistencyThreshold = 50;

    @ConfigProperty(name = "accuracy.alerts.data-freshness-hours", defaultValue = "24")
    int dataFreshnessHours = 24;

    private final FreshnessScorer freshnessScorer;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Inject
    public AccuracyAlertService(
            FreshnessScorer freshnessScorer, Clock clock, MeterRegistry meterRegistry) {
        this.freshnessScorer = freshnessScorer;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param report report to evaluate
     * @param primaryTimestamp observation time of the report's primary value
     * @return raised alerts, empty when alerting is disabled or nothing breaches a threshold
     */
    public List<AccuracyAlertDTO> evaluate(AccuracyReportDTO report, Instant primaryTimestamp) {
        if (!enabled) {
            return List.of();
        }

        Instant now = clock.instant();
        List<AccuracyAlertDTO> alerts = new ArrayList<>();

        int overall = report.confidenceScore().overall();
        if (overall < confidenceThreshold) {
            alerts.add(confidenceAlert(report, now));
        }

        List<DiscrepancyDTO> critical =
                report.discrepancies().stream()
                        .filter(d -> d.severity() == DiscrepancySeverity.CRITICAL)
                        .toList();
        if (!critical.isEmpty()) {
            alerts.add(discrepancyAlert(report, critical, now));
        }

        if (primaryTimestamp != null) {
            double hoursOld = freshnessScorer.ageInHours(primaryTimestamp);
            if (hoursOld > dataFreshnessHours) {
                alerts.add(staleDataAlert(report, primaryTimestamp, hoursOld, now));
            }
        }

        if (report.confidenceScore().consistency() < consistencyThreshold) {
            alerts.add(consistencyAlert(report, now));
        }

        for (AccuracyAlertDTO alert : alerts) {
            LOG.warnf(
                    "%s [%s] project=%s: %s",
                    alert.title(), alert.severity(), alert.projectId(), alert.message());
            countAlert(alert.type());
        }

        return alerts;
    }

    static AlertSeverity confidenceSeverity(int overall) {
        if (overall >= 80) return AlertSeverity.LOW;
        if (overall >= 60) return AlertSeverity.MEDIUM;
        if (overall >= 40) return AlertSeverity.HIGH;
        return AlertSeverity.CRITICAL;
    }

    private AccuracyAlertDTO confidenceAlert(AccuracyReportDTO report, Instant now) {
        int overall = report.confidenceScore().overall();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("confidenceScore", report.confidenceScore());
        data.put("threshold", confidenceThreshold);

        return new AccuracyAlertDTO(
                AccuracyAlertType.CONFIDENCE_DROP,
                confidenceSeverity(overall),
                report.projectId(),
                report.metric(),
                String.format(
                        "Confidence score dropped to %d%% for %s", overall, report.metric()),
                data,
                now);
    }

    private AccuracyAlertDTO discrepancyAlert(
            AccuracyReportDTO report, List<DiscrepancyDTO> critical, Instant now) {
        double maxVariance = critical.stream().mapToDouble(DiscrepancyDTO::variance).max().orElse(0);
        AlertSeverity severity =
                maxVariance > CRITICAL_VARIANCE ? AlertSeverity.CRITICAL : AlertSeverity.HIGH;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("maxVariance", maxVariance);
        data.put(
                "affectedSources",
                critical.stream()
                        .flatMap(d -> Stream.of(d.source1(), d.source2()))
                        .toList());

        return new AccuracyAlertDTO(
                AccuracyAlertType.CRITICAL_DISCREPANCY,
                severity,
                report.projectId(),
                report.metric(),
                String.format(
                        "Critical data discrepancy detected for %s (%d%% variance)",
                        report.metric(), Math.round(maxVariance * 100)),
                data,
                now);
    }

    private AccuracyAlertDTO staleDataAlert(
            AccuracyReportDTO report, Instant primaryTimestamp, double hoursOld, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("hoursOld", Math.round(hoursOld));
        data.put("threshold", dataFreshnessHours);
        data.put("lastUpdate", primaryTimestamp);

        return new AccuracyAlertDTO(
                AccuracyAlertType.DATA_STALE,
                hoursOld > STALE_HIGH_HOURS ? AlertSeverity.HIGH : AlertSeverity.MEDIUM,
                report.projectId(),
                report.metric(),
                String.format("Data for %s is %d hours old", report.metric(), Math.round(hoursOld)),
                data,
                now);
    }

    private AccuracyAlertDTO consistencyAlert(AccuracyReportDTO report, Instant now) {
        int consistency = report.confidenceScore().consistency();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("consistencyScore", consistency);
        data.put("sourcesCount", report.secondaryValues().size());
        data.put("discrepancyCount", report.discrepancies().size());

        return new AccuracyAlertDTO(
                AccuracyAlertType.CONSISTENCY_ISSUE,
                AlertSeverity.MEDIUM,
                report.projectId(),
                report.metric(),
                String.format(
                        "Data consistency issues detected for %s (%d%% consistency score)",
                        report.metric(), consistency),
                data,
                now);
    }

    private void countAlert(AccuracyAlertType type) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("accuracy_alerts_total")
                .description("Accuracy alerts raised while building reports")
                .tag("type", type.name())
                .register(meterRegistry)
                .increment();
    }
}
