/* (C)2026 */
package com.ammann.accuracy.dto;

import com.ammann.accuracy.enumeration.AccuracyAlertType;
import com.ammann.accuracy.enumeration.AlertSeverity;
import java.time.Instant;
import java.util.Map;

/**
 * Alert raised for a report that breaches a configured accuracy threshold.
 *
 * @param type alert kind
 * @param severity alert urgency
 * @param projectId project of the report
 * @param metric metric of the report
 * @param message human-readable summary
 * @param data supporting values for the alert
 * @param triggeredAt evaluation time
 */
public record AccuracyAlertDTO(
        AccuracyAlertType type,
        AlertSeverity severity,
        String projectId,
        String metric,
        String message,
        Map<String, Object> data,
        Instant triggeredAt) {

    public String title() {
        return type.getTitle();
    }
}
