package aegis.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import aegis.core.config.RbacConfig;
import aegis.core.model.AuthorizationDecision;
import aegis.core.model.DecisionLookup;
import aegis.core.port.out.AuthorizationMetrics;

/**
 * Micrometer implementation of AuthorizationMetrics.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code aegis.authz.decisions} - Decisions by outcome and source</li>
 *   <li>{@code aegis.authz.cache.lookups} - Decision cache lookups by result</li>
 *   <li>{@code aegis.authz.cache.invalidations} - Global and per-entry invalidations</li>
 *   <li>{@code aegis.authz.store.timeouts} - Cache store calls that timed out</li>
 *   <li>{@code aegis.authz.store.failures} - Cache store calls that failed otherwise</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthorizationMetrics implements AuthorizationMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerAuthorizationMetrics(MeterRegistry registry, RbacConfig config) {
        this(registry, config != null && config.metricsEnabled());
    }

    public MicrometerAuthorizationMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled && registry != null;
    }

    /**
     * Check if metrics recording is enabled.
     *
     * @return true if metrics are enabled
     */
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordDecision(AuthorizationDecision decision) {
        if (!enabled) {
            return;
        }

        final String outcome;
        final String source;
        if (decision instanceof AuthorizationDecision.Allow allow) {
            outcome = "allow";
            source = lower(allow.source().name());
        } else {
            outcome = "deny";
            source = "none";
        }

        Counter.builder("aegis.authz.decisions")
                .description("Authorization decisions")
                .tag("outcome", outcome)
                .tag("source", source)
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheLookup(DecisionLookup outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("aegis.authz.cache.lookups")
                .description("Decision cache lookups")
                .tag("result", lower(outcome.name()))
                .register(registry)
                .increment();

        if (outcome == DecisionLookup.INVALIDATED_ALL || outcome == DecisionLookup.EXPIRED) {
            Counter.builder("aegis.authz.cache.invalidations")
                    .description("Decision cache invalidations")
                    .tag("scope", outcome == DecisionLookup.INVALIDATED_ALL ? "global" : "entry")
                    .register(registry)
                    .increment();
        }
    }

    @Override
    public void recordStoreTimeout(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("aegis.authz.store.timeouts")
                .description("Cache store operations that timed out")
                .tag("store", nullSafe(store))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String store, String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("aegis.authz.store.failures")
                .description("Cache store operations that failed")
                .tag("store", nullSafe(store))
                .tag("operation", nullSafe(operation))
                .register(registry)
                .increment();
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
