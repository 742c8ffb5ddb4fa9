/* (C)2026 */
package com.ammann.accuracy.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity attached to a single outlying ranking record.
 */
public enum AnomalySeverity {
    /** Deviates by more than three standard deviations. */
    HIGH("high"),
    /** Deviates by more than two standard deviations. */
    MEDIUM("medium");

    private final String label;

    AnomalySeverity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }
}
