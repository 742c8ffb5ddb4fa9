/* (C)2026 */
package com.ammann.accuracy.store;

import java.time.Instant;

/**
 * Filter for reading accuracy reports back from a {@link ReportStore}.
 *
 * @param projectId project whose reports are read
 * @param metric metric filter, {@code null} for all metrics
 * @param from inclusive lower bound of {@code checkedAt}
 * @param to inclusive upper bound of {@code checkedAt}
 * @param limit maximum number of reports returned, {@link #UNLIMITED} for every match
 */
public record ReportQuery(String projectId, String metric, Instant from, Instant to, int limit) {

    public static final int UNLIMITED = Integer.MAX_VALUE;

    public boolean isUnlimited() {
        return limit == UNLIMITED;
    }
}
