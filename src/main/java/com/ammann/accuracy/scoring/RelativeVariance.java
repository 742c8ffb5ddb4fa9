/* (C)2026 */
package com.ammann.accuracy.scoring;

import java.util.OptionalDouble;

/**
 * Relative absolute difference between two observations of the same metric.
 *
 * <p>The primary value is the reference: {@code |primary - comparison| / |primary|}.
 * A primary value of exactly zero has no relative scale, so no variance is defined and
 * the comparison is treated as "no valid comparison" by every caller.
 */
public final class RelativeVariance {

    /** Variances at or below this value are measurement noise. */
    public static final double NOISE_FLOOR = 0.05;

    private RelativeVariance() {}

    /**
     * @param primary reference value
     * @param comparison value from another source
     * @return the relative variance, or empty when {@code primary} is zero
     */
    public static OptionalDouble between(double primary, double comparison) {
        if (primary == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.abs(primary - comparison) / Math.abs(primary));
    }
}
