/* (C)2026 */
package com.ammann.idgap.health;

import com.ammann.idgap.service.AnalysisCacheService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check exposing the state of the analysis cache.
 *
 * <p>Always UP: cache failures degrade to recomputation and never make the service
 * unusable. The data shows entry count, running computations and hit/miss/failure
 * counters.
 */
@Liveness
@ApplicationScoped
public class AnalysisCacheHealthCheck implements HealthCheck {

    @Inject AnalysisCacheService cacheService;

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("gap-analysis-cache")
                .up()
                .withData("entries", cacheService.size())
                .withData("in-flight", cacheService.inFlightCount())
                .withData("hits", cacheService.hitCount())
                .withData("misses", cacheService.missCount())
                .withData("failures", cacheService.failureCount())
                .withData("ttl-seconds", cacheService.ttl().toSeconds())
                .build();
    }
}
