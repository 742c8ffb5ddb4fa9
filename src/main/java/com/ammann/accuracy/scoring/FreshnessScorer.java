/* (C)2026 */
package com.ammann.accuracy.scoring;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Scores the age of an observation on a 0 - 100 staircase.
 *
 * <p>Timestamps in the future count as fresh.
 */
@ApplicationScoped
public class FreshnessScorer {

    private static final double SECONDS_PER_HOUR = 3_600.0;

    private final Clock clock;

    @Inject
    public FreshnessScorer(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param timestamp observation time
     * @return 100 for data at most one hour old, down to 10 for data older than 72 hours
     */
    public int score(Instant timestamp) {
        double hoursOld = ageInHours(timestamp);

        if (hoursOld <= 1) return 100;
        if (hoursOld <= 6) return 90;
        if (hoursOld <= 12) return 80;
        if (hoursOld <= 24) return 70;
        if (hoursOld <= 48) return 50;
        if (hoursOld <= 72) return 30;
        return 10;
    }

    /**
     * @param timestamp observation time
     * @return hours between the timestamp and now, negative for future timestamps
     */
    public double ageInHours(Instant timestamp) {
        return hoursBetween(timestamp, clock.instant());
    }

    /**
     * Hours from {@code start} to {@code end}. Works across the whole {@link Instant} range, where
     * a millisecond count would overflow.
     */
    public static double hoursBetween(Instant start, Instant end) {
        Duration age = Duration.between(start, end);
        return (age.getSeconds() + age.getNano() / 1_000_000_000.0) / SECONDS_PER_HOUR;
    }
}
