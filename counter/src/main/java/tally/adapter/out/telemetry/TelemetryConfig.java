package tally.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Example configuration:
 * <pre>{@code
 * tally.telemetry.enabled=true
 * tally.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "tally.telemetry")
public interface TelemetryConfig {

    /**
     * Master toggle for all telemetry features.
     * When disabled, all sub-features are also disabled regardless of their individual settings.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable counter and store metrics.
         * Requires tally.telemetry.enabled=true to take effect.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
