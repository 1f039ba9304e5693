package aegis.core.service;

import java.util.Optional;

import aegis.core.cache.ReadOnlyCacheStore;
import aegis.core.model.TrustMode;
import aegis.core.model.common.ConfigurationException;
import aegis.core.port.out.CacheStore;

/**
 * Which store holds the snapshot, which holds the decision cache, and whether the engine
 * may write decisions at all.
 *
 * <p>Fixed at construction. Use the factory methods rather than the canonical
 * constructor.
 *
 * @param mode          the trust mode
 * @param snapshotStore store holding the permission snapshot
 * @param decisionStore store holding cached decisions, empty in {@link TrustMode#READ_ONLY}
 */
public record CacheTopology(TrustMode mode, CacheStore snapshotStore, Optional<CacheStore> decisionStore) {

    public CacheTopology {
        if (mode == null) {
            throw new ConfigurationException("Trust mode is required");
        }
        if (snapshotStore == null) {
            throw new ConfigurationException("Snapshot store is not configured");
        }
        decisionStore = decisionStore == null ? Optional.empty() : decisionStore;
        if (mode != TrustMode.READ_ONLY && decisionStore.isEmpty()) {
            throw new ConfigurationException(mode + " trust mode requires a decision store");
        }
        if (mode == TrustMode.READ_ONLY && decisionStore.isPresent()) {
            throw new ConfigurationException("READ_ONLY trust mode cannot have a decision store");
        }
    }

    /**
     * One store for both snapshot and decisions; the engine reads and writes it.
     *
     * @param store the shared store
     * @return the topology
     */
    public static CacheTopology shared(CacheStore store) {
        return new CacheTopology(TrustMode.SHARED, store, Optional.ofNullable(store));
    }

    /**
     * A read-only snapshot store and a separate writable decision store.
     *
     * @param snapshotStore the externally owned snapshot store; wrapped read-only
     * @param decisionStore the engine's decision store; must be a different instance
     * @return the topology
     */
    public static CacheTopology isolated(CacheStore snapshotStore, CacheStore decisionStore) {
        if (snapshotStore != null && snapshotStore == decisionStore) {
            throw new ConfigurationException("ISOLATED trust mode requires two distinct store instances");
        }
        final var readOnly = snapshotStore == null || snapshotStore instanceof ReadOnlyCacheStore
                ? snapshotStore
                : new ReadOnlyCacheStore(snapshotStore);
        return new CacheTopology(TrustMode.ISOLATED, readOnly, Optional.ofNullable(decisionStore));
    }

    /**
     * Snapshot store only; no decision caching.
     *
     * @param snapshotStore the snapshot store; wrapped read-only
     * @return the topology
     */
    public static CacheTopology readOnly(CacheStore snapshotStore) {
        final var readOnly = snapshotStore == null || snapshotStore instanceof ReadOnlyCacheStore
                ? snapshotStore
                : new ReadOnlyCacheStore(snapshotStore);
        return new CacheTopology(TrustMode.READ_ONLY, readOnly, Optional.empty());
    }

    /**
     * Returns true when the engine may consult and write the decision cache.
     */
    public boolean writeEnabled() {
        return decisionStore.isPresent();
    }
}
