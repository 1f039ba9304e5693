package aegis.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import aegis.adapter.out.storage.CacheCallGuard;
import aegis.adapter.out.storage.CacheValueCodec;
import aegis.core.port.out.CacheStore;

/**
 * Redis implementation of CacheStore.
 *
 * <p>Keys are used verbatim so that the snapshot written by the permission publisher is
 * visible under its well-known key. {@link #clear()} flushes the selected database.
 */
public class RedisCacheStore implements CacheStore {

    private final String name;
    private final ReactiveRedisDataSource dataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final CacheCallGuard guard;
    private final CacheValueCodec codec;

    public RedisCacheStore(
            String name, ReactiveRedisDataSource dataSource, CacheCallGuard guard, CacheValueCodec codec) {
        this.name = name;
        this.dataSource = dataSource;
        this.valueCommands = dataSource.value(String.class, String.class);
        this.keyCommands = dataSource.key(String.class);
        this.guard = guard;
        this.codec = codec;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Object> read(String key) {
        final var text = guard.await(valueCommands.get(key), "read");
        return Optional.ofNullable(codec.decode(text));
    }

    @Override
    public void write(String key, Object value, Duration expiresIn) {
        guard.await(
                Uni.createFrom().item(() -> codec.encode(value)).flatMap(encoded -> {
                    if (expiresIn == null || expiresIn.isZero() || expiresIn.isNegative()) {
                        return valueCommands.set(key, encoded);
                    }
                    return valueCommands.setex(key, Math.max(1, expiresIn.toSeconds()), encoded);
                }),
                "write");
    }

    @Override
    public void delete(String key) {
        guard.await(keyCommands.del(key).replaceWithVoid(), "delete");
    }

    @Override
    public void clear() {
        guard.await(dataSource.execute("FLUSHDB").replaceWithVoid(), "clear");
    }
}
