/* (C)2026 */
package com.ammann.accuracy.model;

import com.ammann.accuracy.dto.AccuracyReportDTO;
import com.ammann.accuracy.dto.ConfidenceScoreDTO;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for an accuracy report.
 *
 * <p>Reports are append-only: a new check creates a new row and existing rows are never
 * updated. Comparison values and discrepancies live in ordered collection tables so the
 * report reads back exactly as it was built.
 */
@Entity
@Table(
        name = "accuracy_reports",
        indexes = {
            @Index(name = "idx_report_project_checked", columnList = "project_id, checked_at"),
            @Index(name = "idx_report_metric", columnList = "metric")
        })
public class AccuracyReport extends PanacheEntityBase {

    @Id
    @Column(name = "id", length = 36)
    public String id;

    @Column(name = "project_id", nullable = false)
    public String projectId;

    @Column(name = "metric", nullable = false)
    public String metric;

    @Column(name = "primary_value", nullable = false)
    public double primaryValue;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "accuracy_report_secondary_values",
            joinColumns = @JoinColumn(name = "report_id"))
    @OrderColumn(name = "item_index")
    public List<SecondaryValue> secondaryValues = new ArrayList<>();

    /**
     * Weighted overall confidence (0 - 100).
     */
    @Column(name = "overall_score", nullable = false)
    public int overallScore;

    @Column(name = "freshness_score", nullable = false)
    public int freshnessScore;

    @Column(name = "consistency_score", nullable = false)
    public int consistencyScore;

    @Column(name = "reliability_score", nullable = false)
    public int reliabilityScore;

    @Column(name = "completeness_score", nullable = false)
    public double completenessScore;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "accuracy_report_discrepancies",
            joinColumns = @JoinColumn(name = "report_id"))
    @OrderColumn(name = "item_index")
    public List<DiscrepancyRecord> discrepancies = new ArrayList<>();

    @Column(name = "is_accurate", nullable = false)
    public boolean accurate;

    @Column(name = "checked_at", nullable = false)
    public Instant checkedAt;

    public AccuracyReport() {}

    public static AccuracyReport from(AccuracyReportDTO dto) {
        AccuracyReport report = new AccuracyReport();
        report.id = dto.id();
        report.projectId = dto.projectId();
        report.metric = dto.metric();
        report.primaryValue = dto.primaryValue();
        report.secondaryValues =
                new ArrayList<>(dto.secondaryValues().stream().map(SecondaryValue::from).toList());

        ConfidenceScoreDTO score = dto.confidenceScore();
        report.overallScore = score.overall();
        report.freshnessScore = score.freshness();
        report.consistencyScore = score.consistency();
        report.reliabilityScore = score.reliability();
        report.completenessScore = score.completeness();

        report.discrepancies =
                new ArrayList<>(dto.discrepancies().stream().map(DiscrepancyRecord::from).toList());
        report.accurate = dto.isAccurate();
        report.checkedAt = dto.checkedAt();
        return report;
    }

    public AccuracyReportDTO toDTO() {
        return new AccuracyReportDTO(
                id,
                projectId,
                metric,
                primaryValue,
                secondaryValues.stream().map(SecondaryValue::toDTO).toList(),
                new ConfidenceScoreDTO(
                        overallScore,
                        freshnessScore,
                        consistencyScore,
                        reliabilityScore,
                        completenessScore),
                discrepancies.stream().map(DiscrepancyRecord::toDTO).toList(),
                accurate,
                checkedAt);
    }
}
