package aegis.adapter.out.storage.redis;

import java.time.Duration;

import jakarta.enterprise.inject.spi.CDI;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import aegis.adapter.out.storage.CacheCallGuard;
import aegis.adapter.out.storage.CacheValueCodec;
import aegis.core.model.common.ConfigurationException;
import aegis.core.port.out.AuthorizationMetrics;
import aegis.core.port.out.CacheStore;
import aegis.spi.CacheStoreProvider;
import aegis.spi.StorageAdapterConfig;

/**
 * Redis cache store provider.
 *
 * <p>Configuration properties, under the store prefix:
 * <ul>
 *   <li>{@code <prefix>.redis.timeout} - Per-call timeout in ISO-8601 format (default: PT1S)</li>
 * </ul>
 *
 * <p>The Redis connection is configured via Quarkus Redis properties:
 * <ul>
 *   <li>quarkus.redis.hosts - Redis server URL (default: redis://localhost:6379)</li>
 *   <li>quarkus.redis.password - Redis password (optional)</li>
 *   <li>quarkus.redis.database - Redis database index (default: 0)</li>
 * </ul>
 */
public class RedisCacheStoreProvider implements CacheStoreProvider {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public String description() {
        return "Redis shared cache store";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("io.quarkus.redis.datasource.ReactiveRedisDataSource");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public CacheStore createStore(StorageAdapterConfig config, String prefix, AuthorizationMetrics metrics) {
        final var timeout = config.getDuration(prefix + ".redis.timeout").orElse(DEFAULT_TIMEOUT);

        final ReactiveRedisDataSource dataSource;
        try {
            dataSource = CDI.current().select(ReactiveRedisDataSource.class).get();
        } catch (RuntimeException e) {
            throw new ConfigurationException("Failed to obtain Redis data source from CDI", e);
        }

        return new RedisCacheStore(
                name(), dataSource, new CacheCallGuard(timeout, metrics, name()), new CacheValueCodec());
    }
}
