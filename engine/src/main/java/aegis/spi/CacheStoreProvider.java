package aegis.spi;

import aegis.core.model.common.ConfigurationException;
import aegis.core.port.out.AuthorizationMetrics;
import aegis.core.port.out.CacheStore;

/**
 * Service Provider Interface for cache store backends.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}. The same
 * provider may be asked for several stores (the snapshot store and the decision store),
 * each under its own configuration prefix.
 */
public interface CacheStoreProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: {@code aegis.rbac.snapshot-store.provider={name}}
     *
     * @return The provider name
     */
    String name();

    /**
     * Human-readable description of this provider.
     *
     * @return Description for logging and diagnostics
     */
    default String description() {
        return name() + " cache store";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Higher values = higher priority.
     *
     * @return The provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider is available (client library present, etc.)
     *
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create a cache store.
     *
     * <p>The returned instance must be thread-safe.
     *
     * @param config  Access to configuration properties
     * @param prefix  Property prefix of the store being created, e.g. {@code aegis.rbac.snapshot-store}
     * @param metrics Sink for store timeout and failure counts
     * @return Cache store implementation
     * @throws ConfigurationException if the store cannot be created
     */
    CacheStore createStore(StorageAdapterConfig config, String prefix, AuthorizationMetrics metrics);
}
