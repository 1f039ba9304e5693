package aegis.core.port.out;

import aegis.core.model.AuthorizationDecision;
import aegis.core.model.DecisionLookup;

/**
 * Port interface for recording authorization and cache metrics.
 */
public interface AuthorizationMetrics {

    /**
     * Record the final outcome of an authorization check.
     *
     * @param decision the decision returned to the caller
     */
    void recordDecision(AuthorizationDecision decision);

    /**
     * Record the outcome of a decision cache lookup.
     *
     * @param outcome hit, miss or the kind of invalidation performed
     */
    void recordCacheLookup(DecisionLookup outcome);

    /**
     * Record a cache store call that exceeded its timeout.
     *
     * @param store     the store name
     * @param operation the operation name
     */
    void recordStoreTimeout(String store, String operation);

    /**
     * Record a cache store call that failed for a reason other than a timeout.
     *
     * @param store     the store name
     * @param operation the operation name
     */
    void recordStoreFailure(String store, String operation);
}
