package aegis.adapter.out.storage.memcached;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import net.spy.memcached.MemcachedClientIF;

import aegis.adapter.out.storage.CacheCallGuard;
import aegis.adapter.out.storage.CacheValueCodec;
import aegis.core.model.common.CacheException;
import aegis.core.port.out.CacheStore;

/**
 * Memcached implementation of CacheStore.
 *
 * <p>Values are stored as encoded strings. Memcached reads expirations longer than
 * 30 days as absolute timestamps, so longer expiries are capped at 30 days.
 */
public class MemcachedCacheStore implements CacheStore {

    static final long MAX_RELATIVE_EXPIRY_SECONDS = Duration.ofDays(30).toSeconds();

    private final String name;
    private final MemcachedClientIF client;
    private final CacheCallGuard guard;
    private final CacheValueCodec codec;

    public MemcachedCacheStore(String name, MemcachedClientIF client, CacheCallGuard guard, CacheValueCodec codec) {
        this.name = name;
        this.client = client;
        this.guard = guard;
        this.codec = codec;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Object> read(String key) {
        final Object raw = guard.await(Uni.createFrom().deferred(() -> Uni.createFrom()
                .future(client.asyncGet(key))), "read");
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(raw instanceof String text ? codec.decode(text) : raw);
    }

    @Override
    public void write(String key, Object value, Duration expiresIn) {
        final Boolean stored = guard.await(
                Uni.createFrom().deferred(() -> Uni.createFrom()
                        .future(client.set(key, expirySeconds(expiresIn), codec.encode(value)))),
                "write");
        if (!Boolean.TRUE.equals(stored)) {
            throw new CacheException(name, "write", "server did not store the value");
        }
    }

    @Override
    public void delete(String key) {
        guard.await(Uni.createFrom().deferred(() -> Uni.createFrom().future(client.delete(key))), "delete");
    }

    @Override
    public void clear() {
        guard.await(Uni.createFrom().deferred(() -> Uni.createFrom().future(client.flush())), "clear");
    }

    @Override
    public void close() {
        client.shutdown();
    }

    static int expirySeconds(Duration expiresIn) {
        if (expiresIn == null || expiresIn.isZero() || expiresIn.isNegative()) {
            return 0;
        }
        return (int) Math.min(Math.max(1, expiresIn.toSeconds()), MAX_RELATIVE_EXPIRY_SECONDS);
    }
}
