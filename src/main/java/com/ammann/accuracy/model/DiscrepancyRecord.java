/* (C)2026 */
package com.ammann.accuracy.model;

import com.ammann.accuracy.dto.DiscrepancyDTO;
import com.ammann.accuracy.enumeration.DataSource;
import com.ammann.accuracy.enumeration.DiscrepancySeverity;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

/**
 * Classified discrepancy stored with an {@link AccuracyReport}. The explanation is not
 * stored; it is derived from the severity when the record is read back.
 */
@Embeddable
public class DiscrepancyRecord {

    @Enumerated(EnumType.STRING)
    @Column(name = "source1", length = 40)
    public DataSource source1;

    @Enumerated(EnumType.STRING)
    @Column(name = "source2", length = 40)
    public DataSource source2;

    @Column(name = "value1")
    public double value1;

    @Column(name = "value2")
    public double value2;

    @Column(name = "variance")
    public double variance;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", length = 16)
    public DiscrepancySeverity severity;

    public DiscrepancyRecord() {}

    public static DiscrepancyRecord from(DiscrepancyDTO dto) {
        DiscrepancyRecord record = new DiscrepancyRecord();
        record.source1 = dto.source1();
        record.source2 = dto.source2();
        record.value1 = dto.value1();
        record.value2 = dto.value2();
        record.variance = dto.variance();
        record.severity = dto.severity();
        return record;
    }

    public DiscrepancyDTO toDTO() {
        return new DiscrepancyDTO(
                source1, source2, value1, value2, variance, severity, severity.getExplanation());
    }
}
