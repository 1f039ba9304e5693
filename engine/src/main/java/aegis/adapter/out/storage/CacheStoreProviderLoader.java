package aegis.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import aegis.core.config.RbacConfig;
import aegis.core.model.TrustMode;
import aegis.core.model.common.ConfigurationException;
import aegis.core.port.out.AuthorizationMetrics;
import aegis.core.port.out.CacheStore;
import aegis.core.service.CacheTopology;
import aegis.spi.CacheStoreProvider;
import aegis.spi.StorageAdapterConfig;

/**
 * Discovers cache store providers via ServiceLoader and assembles the cache topology.
 *
 * <p>Provider selection, per store:
 * <ol>
 *   <li>If {@code <prefix>.provider} is set, use that provider</li>
 *   <li>Otherwise the snapshot store uses the highest priority available provider and
 *       the decision store uses the in-memory provider</li>
 * </ol>
 *
 * <p>Thread-safety: provider discovery is synchronized and happens once.
 */
@ApplicationScoped
public class CacheStoreProviderLoader {

    static final String DEFAULT_DECISION_PROVIDER = "memory";

    private static final Logger LOG = Logger.getLogger(CacheStoreProviderLoader.class);

    private final RbacConfig rbacConfig;
    private final StorageAdapterConfig config;
    private final AuthorizationMetrics metrics;

    private List<CacheStoreProvider> providers;

    @Inject
    public CacheStoreProviderLoader(RbacConfig rbacConfig, StorageAdapterConfig config, AuthorizationMetrics metrics) {
        this.rbacConfig = rbacConfig;
        this.config = config;
        this.metrics = metrics;
    }

    @Produces
    @Singleton
    public CacheTopology cacheTopology() {
        final var mode = rbacConfig.trustMode();
        final var snapshotStore = createStore(
                RbacConfig.SNAPSHOT_STORE_PREFIX, rbacConfig.snapshotStore().provider());

        final CacheTopology topology =
                switch (mode) {
                    case SHARED -> CacheTopology.shared(snapshotStore);
                    case READ_ONLY -> CacheTopology.readOnly(snapshotStore);
                    case ISOLATED -> CacheTopology.isolated(snapshotStore, createDecisionStore());
                };

        if (mode != TrustMode.ISOLATED && rbacConfig.decisionStore().provider().isPresent()) {
            LOG.warnf("Ignoring %s.provider: only used in ISOLATED trust mode", RbacConfig.DECISION_STORE_PREFIX);
        }
        return topology;
    }

    void closeTopology(@Disposes CacheTopology topology) {
        close(topology.snapshotStore());
        topology.decisionStore()
                .filter(store -> store != topology.snapshotStore())
                .ifPresent(CacheStoreProviderLoader::close);
    }

    private static void close(CacheStore store) {
        try {
            store.close();
            LOG.infof("Closed %s cache store", store.name());
        } catch (RuntimeException e) {
            LOG.warnf(e, "Error closing %s cache store", store.name());
        }
    }

    private CacheStore createDecisionStore() {
        final var provider = rbacConfig.decisionStore().provider().orElse(DEFAULT_DECISION_PROVIDER);
        return createStore(RbacConfig.DECISION_STORE_PREFIX, Optional.of(provider));
    }

    /**
     * Create a store from the configured or best available provider.
     *
     * @param prefix     property prefix of the store
     * @param configured explicitly configured provider name
     * @return the store
     * @throws ConfigurationException if no suitable provider exists or it fails to create the store
     */
    public CacheStore createStore(String prefix, Optional<String> configured) {
        final var provider = selectProvider(getProviders(), configured.orElse(null), prefix);
        LOG.infof("Creating %s from provider: %s (%s)", prefix, provider.name(), provider.description());
        try {
            return provider.createStore(config, prefix, metrics);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigurationException("Provider " + provider.name() + " failed to create " + prefix, e);
        }
    }

    private synchronized List<CacheStoreProvider> getProviders() {
        if (providers != null) {
            return providers;
        }

        final List<CacheStoreProvider> found = new ArrayList<>();
        ServiceLoader.load(CacheStoreProvider.class).forEach(found::add);

        if (found.isEmpty()) {
            throw new ConfigurationException(
                    "No cache store providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d cache store provider(s): %s",
                found.size(),
                found.stream().map(CacheStoreProvider::name).toList());

        providers = List.copyOf(found);
        return providers;
    }

    static CacheStoreProvider selectProvider(List<CacheStoreProvider> providers, String configured, String prefix) {
        if (configured != null && !configured.isBlank()) {
            final var provider = providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new ConfigurationException("Configured provider for " + prefix
                            + " not found: " + configured + ". Available: "
                            + providers.stream().map(CacheStoreProvider::name).toList()));
            if (!provider.isAvailable()) {
                throw new ConfigurationException("Configured provider for " + prefix + " is not available: "
                        + configured);
            }
            return provider;
        }

        return providers.stream()
                .filter(CacheStoreProvider::isAvailable)
                .max(Comparator.comparingInt(CacheStoreProvider::priority))
                .orElseThrow(() -> new ConfigurationException("No available cache store providers for " + prefix));
    }
}
