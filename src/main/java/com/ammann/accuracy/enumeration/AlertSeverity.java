/* (C)2026 */
package com.ammann.accuracy.enumeration;

/**
 * Urgency of an accuracy alert.
 */
public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
