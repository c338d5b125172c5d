/* (C)2026 */
package com.ammann.idgap.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * CDI producer for the {@link Clock} used by the analysis pipeline.
 *
 * <p>Analysis timestamps, cache age, cache expiry and request deadlines all read this
 * clock. Tests construct the services with a fixed or mutable clock instead.
 */
@ApplicationScoped
public class ClockProducer {

    /**
     * Produces the system UTC clock.
     *
     * @return clock shared by all analysis services
     */
    @Produces
    @Singleton
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
