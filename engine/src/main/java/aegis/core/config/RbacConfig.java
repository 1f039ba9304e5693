package aegis.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import aegis.core.model.TrustMode;

/**
 * Configuration mapping for the RBAC authorization engine.
 *
 * <p>Configuration prefix: {@code aegis.rbac}
 *
 * <h2>Store layout</h2>
 * <ul>
 *   <li>{@code SHARED} - {@code snapshot-store} holds both the snapshot and the decision cache</li>
 *   <li>{@code ISOLATED} - {@code snapshot-store} is read-only; decisions go to {@code decision-store}
 *       (defaults to the in-memory provider)</li>
 *   <li>{@code READ_ONLY} - {@code snapshot-store} only; no decision caching</li>
 * </ul>
 *
 * <p>Backend options are read under the store prefix, for example
 * {@code aegis.rbac.snapshot-store.redis.timeout} or
 * {@code aegis.rbac.decision-store.memcached.servers}.
 */
@ConfigMapping(prefix = "aegis.rbac")
public interface RbacConfig {

    /** Property prefix of the snapshot store. */
    String SNAPSHOT_STORE_PREFIX = "aegis.rbac.snapshot-store";

    /** Property prefix of the decision store. */
    String DECISION_STORE_PREFIX = "aegis.rbac.decision-store";

    /**
     * Trust topology between the snapshot store and the decision cache.
     *
     * @return trust mode (default: SHARED)
     */
    @WithDefault("SHARED")
    TrustMode trustMode();

    /**
     * Lifetime of a cached decision, and the window after a snapshot update during
     * which every cached decision is discarded.
     *
     * @return TTL duration (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration permissionTtl();

    /**
     * Backend expiry applied to the decision blob on every write.
     *
     * <p>Shorter than {@link #permissionTtl()} so an idle blob ages out of the backend
     * on its own.
     *
     * @return expiry duration (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration decisionBlobExpiry();

    /**
     * Primary claim holding the caller's role ids.
     *
     * @return claim name (default: role_ids)
     */
    @WithDefault("role_ids")
    String roleClaim();

    /**
     * Pattern that locates the tenant slug in a request path. Everything up to the end
     * of the match is stripped before rules are evaluated.
     *
     * @return regular expression (default: {@code ^/api/v1/([^/]+)/})
     */
    @WithDefault("^/api/v1/([^/]+)/")
    String pathnameSlugPattern();

    /**
     * Maximum number of compiled rule patterns kept in memory.
     *
     * @return maximum entries (default: 1000)
     */
    @WithDefault("1000")
    long regexCacheMaxEntries();

    /**
     * Enable Micrometer metrics.
     *
     * @return true if metrics are recorded (default: true)
     */
    @WithDefault("true")
    boolean metricsEnabled();

    /**
     * Store holding the permission snapshot (and, in SHARED mode, the decision cache).
     */
    StoreConfig snapshotStore();

    /**
     * Store holding the decision cache in ISOLATED mode.
     */
    StoreConfig decisionStore();

    /**
     * Selection of a cache store provider.
     */
    interface StoreConfig {

        /**
         * Provider name ({@code memory}, {@code redis}, {@code memcached}, {@code cassandra}).
         *
         * <p>When unset the highest-priority available provider is used for the snapshot
         * store, and the in-memory provider for the decision store.
         *
         * @return the provider name, if configured
         */
        Optional<String> provider();
    }
}
