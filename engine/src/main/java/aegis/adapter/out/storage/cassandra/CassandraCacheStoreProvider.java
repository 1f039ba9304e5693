package aegis.adapter.out.storage.cassandra;

import java.net.InetSocketAddress;
import java.time.Duration;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import org.jboss.logging.Logger;

import aegis.adapter.out.storage.CacheCallGuard;
import aegis.adapter.out.storage.CacheValueCodec;
import aegis.core.model.common.ConfigurationException;
import aegis.core.port.out.AuthorizationMetrics;
import aegis.core.port.out.CacheStore;
import aegis.spi.CacheStoreProvider;
import aegis.spi.StorageAdapterConfig;

/**
 * Cassandra cache store provider (generic key-value backend).
 *
 * <p>Configuration properties, under the store prefix:
 * <ul>
 *   <li>{@code <prefix>.cassandra.contact-points} - Comma-separated host:port pairs (default: localhost:9042)</li>
 *   <li>{@code <prefix>.cassandra.datacenter} - Local datacenter name (default: datacenter1)</li>
 *   <li>{@code <prefix>.cassandra.keyspace} - Keyspace name (default: aegis)</li>
 *   <li>{@code <prefix>.cassandra.table} - Table name (default: rbac_cache)</li>
 *   <li>{@code <prefix>.cassandra.username} - Username for authentication (optional)</li>
 *   <li>{@code <prefix>.cassandra.password} - Password for authentication (required with username)</li>
 *   <li>{@code <prefix>.cassandra.timeout} - Per-call timeout in ISO-8601 format (default: PT2S)</li>
 * </ul>
 */
public class CassandraCacheStoreProvider implements CacheStoreProvider {

    private static final Logger LOG = Logger.getLogger(CassandraCacheStoreProvider.class);
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    @Override
    public String name() {
        return "cassandra";
    }

    @Override
    public String description() {
        return "Apache Cassandra key-value cache store";
    }

    @Override
    public int priority() {
        return 1;
    }

    @Override
    public boolean isAvailable() {
        try {
            Class.forName("com.datastax.oss.driver.api.core.CqlSession");
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    @Override
    public CacheStore createStore(StorageAdapterConfig config, String prefix, AuthorizationMetrics metrics) {
        final var table = config.getOrDefault(prefix + ".cassandra.table", "rbac_cache");
        final var timeout = config.getDuration(prefix + ".cassandra.timeout").orElse(DEFAULT_TIMEOUT);
        final var session = buildSession(config, prefix);
        try {
            return new CassandraCacheStore(
                    name(), session, table, new CacheCallGuard(timeout, metrics, name()), new CacheValueCodec());
        } catch (RuntimeException e) {
            session.close();
            throw new ConfigurationException("Failed to prepare Cassandra cache statements for table " + table, e);
        }
    }

    private CqlSession buildSession(StorageAdapterConfig config, String prefix) {
        final var contactPoints = config.getOrDefault(prefix + ".cassandra.contact-points", "localhost:9042");
        final var datacenter = config.getOrDefault(prefix + ".cassandra.datacenter", "datacenter1");
        final var keyspace = config.getOrDefault(prefix + ".cassandra.keyspace", "aegis");

        final CqlSessionBuilder builder =
                CqlSession.builder().withLocalDatacenter(datacenter).withKeyspace(keyspace);

        for (String contactPoint : contactPoints.split(",")) {
            final String[] parts = contactPoint.trim().split(":");
            final int port = parts.length > 1 ? Integer.parseInt(parts[1]) : 9042;
            builder.addContactPoint(new InetSocketAddress(parts[0], port));
        }

        config.get(prefix + ".cassandra.username").ifPresent(username -> {
            final String password = config.get(prefix + ".cassandra.password")
                    .orElseThrow(() ->
                            new ConfigurationException("Cassandra password required when username is specified"));
            builder.withAuthCredentials(username, password);
        });

        try {
            final var session = builder.build();
            LOG.infof("Connected %s store to Cassandra keyspace %s", prefix, keyspace);
            return session;
        } catch (RuntimeException e) {
            throw new ConfigurationException("Failed to connect to Cassandra", e);
        }
    }
}
