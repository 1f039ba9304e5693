package aegis.adapter.out.storage.cassandra;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import io.smallrye.mutiny.Uni;

import aegis.adapter.out.storage.CacheCallGuard;
import aegis.adapter.out.storage.CacheValueCodec;
import aegis.core.port.out.CacheStore;

/**
 * Cassandra implementation of CacheStore, used as a generic key-value backend.
 *
 * <h2>Schema</h2>
 * <pre>
 * CREATE TABLE IF NOT EXISTS rbac_cache (
 *     cache_key text PRIMARY KEY,
 *     cache_value text
 * );
 * </pre>
 *
 * <p>Expiring writes use {@code USING TTL}; {@link #clear()} truncates the table.
 */
public class CassandraCacheStore implements CacheStore {

    /** Largest TTL Cassandra accepts (20 years). */
    static final int MAX_TTL_SECONDS = 630_720_000;

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private final String name;
    private final CqlSession session;
    private final String table;
    private final CacheCallGuard guard;
    private final CacheValueCodec codec;
    private final PreparedStatement selectStmt;
    private final PreparedStatement insertStmt;
    private final PreparedStatement insertWithTtlStmt;
    private final PreparedStatement deleteStmt;

    public CassandraCacheStore(
            String name, CqlSession session, String table, CacheCallGuard guard, CacheValueCodec codec) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid Cassandra table name: " + table);
        }
        this.name = name;
        this.session = session;
        this.table = table;
        this.guard = guard;
        this.codec = codec;
        this.selectStmt = session.prepare("SELECT cache_value FROM " + table + " WHERE cache_key = ?");
        this.insertStmt = session.prepare("INSERT INTO " + table + " (cache_key, cache_value) VALUES (?, ?)");
        this.insertWithTtlStmt =
                session.prepare("INSERT INTO " + table + " (cache_key, cache_value) VALUES (?, ?) USING TTL ?");
        this.deleteStmt = session.prepare("DELETE FROM " + table + " WHERE cache_key = ?");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Object> read(String key) {
        final String text = guard.await(
                Uni.createFrom()
                        .completionStage(() -> session.executeAsync(selectStmt.bind(key)))
                        .map(rs -> {
                            final var row = rs.one();
                            return row == null ? null : row.getString("cache_value");
                        }),
                "read");
        return Optional.ofNullable(codec.decode(text));
    }

    @Override
    public void write(String key, Object value, Duration expiresIn) {
        guard.await(
                Uni.createFrom()
                        .completionStage(() -> {
                            final var encoded = codec.encode(value);
                            if (expiresIn == null || expiresIn.isZero() || expiresIn.isNegative()) {
                                return session.executeAsync(insertStmt.bind(key, encoded));
                            }
                            return session.executeAsync(insertWithTtlStmt.bind(key, encoded, ttlSeconds(expiresIn)));
                        })
                        .replaceWithVoid(),
                "write");
    }

    @Override
    public void delete(String key) {
        guard.await(
                Uni.createFrom()
                        .completionStage(() -> session.executeAsync(deleteStmt.bind(key)))
                        .replaceWithVoid(),
                "delete");
    }

    @Override
    public void clear() {
        guard.await(
                Uni.createFrom()
                        .completionStage(() -> session.executeAsync(SimpleStatement.newInstance("TRUNCATE " + table)))
                        .replaceWithVoid(),
                "clear");
    }

    @Override
    public void close() {
        if (!session.isClosed()) {
            session.close();
        }
    }

    static int ttlSeconds(Duration expiresIn) {
        return (int) Math.min(Math.max(1, expiresIn.toSeconds()), MAX_TTL_SECONDS);
    }
}
