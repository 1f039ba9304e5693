package aegis.adapter.out.storage.memcached;

import java.io.IOException;
import java.time.Duration;

import net.spy.memcached.AddrUtil;
import net.spy.memcached.ConnectionFactoryBuilder;
import net.spy.memcached.MemcachedClient;
import org.jboss.logging.Logger;

import aegis.adapter.out.storage.CacheCallGuard;
import aegis.adapter.out.storage.CacheValueCodec;
import aegis.core.model.common.ConfigurationException;
import aegis.core.port.out.AuthorizationMetrics;
import aegis.core.port.out.CacheStore;
import aegis.spi.CacheStoreProvider;
import aegis.spi.StorageAdapterConfig;

/**
 * Memcached cache store provider.
 *
 * <p>Configuration properties, under the store prefix:
 * <ul>
 *   <li>{@code <prefix>.memcached.servers} - Space or comma separated host:port list
 *       (default: localhost:11211)</li>
 *   <li>{@code <prefix>.memcached.timeout} - Per-call timeout in ISO-8601 format (default: PT1S)</li>
 * </ul>
 */
public class MemcachedCacheStoreProvider implements CacheStoreProvider {

    private static final Logger LOG = Logger.getLogger(MemcachedCacheStoreProvider.class);
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);
    static final String DEFAULT_SERVERS = "localhost:11211";

    @Override
    public String name() {
        return "memcached";
    }

    @Override
    public String description() {
        return "Memcached shared cache store";
    }

    @Override
    public int priority() {
        return 5;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("net.spy.memcached.MemcachedClient");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public CacheStore createStore(StorageAdapterConfig config, String prefix, AuthorizationMetrics metrics) {
        final var servers = config.getOrDefault(prefix + ".memcached.servers", DEFAULT_SERVERS);
        final var timeout = config.getDuration(prefix + ".memcached.timeout").orElse(DEFAULT_TIMEOUT);

        final MemcachedClient client;
        try {
            client = new MemcachedClient(
                    new ConnectionFactoryBuilder()
                            .setDaemon(true)
                            .setOpTimeout(timeout.toMillis())
                            .build(),
                    AddrUtil.getAddresses(servers.replace(',', ' ')));
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException("Failed to connect to Memcached servers: " + servers, e);
        }

        LOG.infof("Connected %s store to Memcached at %s", prefix, servers);
        return new MemcachedCacheStore(
                name(), client, new CacheCallGuard(timeout, metrics, name()), new CacheValueCodec());
    }
}
