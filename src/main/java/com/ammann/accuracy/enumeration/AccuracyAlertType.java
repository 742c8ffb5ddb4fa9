/* (C)2026 */
package com.ammann.accuracy.enumeration;

/**
 * Kinds of alert raised while evaluating a freshly built accuracy report.
 */
public enum AccuracyAlertType {
    CONFIDENCE_DROP("Data Confidence Alert"),
    CRITICAL_DISCREPANCY("Data Discrepancy Alert"),
    DATA_STALE("Stale Data Alert"),
    CONSISTENCY_ISSUE("Data Consistency Alert");

    private final String title;

    AccuracyAlertType(String title) {
        this.title = title;
    }

    public String getTitle() { return title; }
}
