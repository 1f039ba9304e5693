package aegis.adapter.out.storage.memory;

import java.time.Clock;

import aegis.core.port.out.AuthorizationMetrics;
import aegis.core.port.out.CacheStore;
import aegis.spi.CacheStoreProvider;
import aegis.spi.StorageAdapterConfig;

/**
 * In-memory cache store provider.
 *
 * <p>Lowest priority: chosen automatically only when no network backend is available.
 * Every call to {@link #createStore} returns a new, independent store.
 */
public class InMemoryCacheStoreProvider implements CacheStoreProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory cache store (single instance only)";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public CacheStore createStore(StorageAdapterConfig config, String prefix, AuthorizationMetrics metrics) {
        return new InMemoryCacheStore(name(), Clock.systemUTC());
    }
}
