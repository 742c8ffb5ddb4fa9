/* (C)2026 */
package com.ammann.accuracy.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * CDI producer for the wall clock used by age-based scoring.
 *
 * <p>Scorers take the clock as a constructor argument so unit tests can pin "now".
 */
@ApplicationScoped
public class ClockProducer {

    @Produces
    @Singleton
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
