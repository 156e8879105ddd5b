package tally.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Default;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.arc.DefaultBean;

/**
 * Provides a fallback meter registry when the Micrometer extension does not.
 *
 * <p>Used when the Prometheus registry is disabled (e.g.,
 * {@code quarkus.micrometer.enabled=false}).
 */
@ApplicationScoped
public class TelemetryFallbackProducer {

    /**
     * Provides a fallback MeterRegistry when Micrometer is disabled.
     *
     * @return a simple in-memory meter registry
     */
    @Produces
    @Singleton
    @DefaultBean
    @Default
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
