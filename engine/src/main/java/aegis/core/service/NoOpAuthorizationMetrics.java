package aegis.core.service;

import aegis.core.model.AuthorizationDecision;
import aegis.core.model.DecisionLookup;
import aegis.core.port.out.AuthorizationMetrics;

/**
 * Metrics implementation that records nothing, for engines built without a registry.
 */
public final class NoOpAuthorizationMetrics implements AuthorizationMetrics {

    public static final NoOpAuthorizationMetrics INSTANCE = new NoOpAuthorizationMetrics();

    private NoOpAuthorizationMetrics() {}

    @Override
    public void recordDecision(AuthorizationDecision decision) {}

    @Override
    public void recordCacheLookup(DecisionLookup outcome) {}

    @Override
    public void recordStoreTimeout(String store, String operation) {}

    @Override
    public void recordStoreFailure(String store, String operation) {}
}
