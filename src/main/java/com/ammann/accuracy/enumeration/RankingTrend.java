/* (C)2026 */
package com.ammann.accuracy.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a ranking history. Lower position numbers are better ranks, so a
 * negative slope is an improvement.
 */
public enum RankingTrend {
    STABLE("stable"),
    IMPROVING("improving"),
    DECLINING("declining"),
    VOLATILE("volatile");

    private final String label;

    RankingTrend(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }
}
