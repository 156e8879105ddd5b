package tally.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import tally.core.port.out.AtomicCounterStore;

/**
 * Health check reporting the counter store in use.
 *
 * <p>Always UP: an unreachable store puts counters into fail-open mode, which
 * is a degraded but serving state. Watch {@code fail_open} and the
 * {@code tally.counter.increments{status=exit_early}} metric instead.
 */
@Readiness
@ApplicationScoped
public class CounterStoreHealthCheck implements HealthCheck {

    private final AtomicCounterStore store;

    @Inject
    public CounterStoreHealthCheck(AtomicCounterStore store) {
        this.store = store;
    }

    @Override
    public HealthCheckResponse call() {
        final var initialized = store.isInitialized();
        return HealthCheckResponse.builder()
                .name("counter-store")
                .withData("provider", store.name())
                .withData("initialized", initialized)
                .withData("fail_open", !initialized)
                .up()
                .build();
    }
}
