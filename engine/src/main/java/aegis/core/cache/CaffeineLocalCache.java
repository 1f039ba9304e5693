package aegis.core.cache;

import java.util.function.Function;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Caffeine-backed local cache bounded by size.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, V> cache;

    /**
     * @param maxSize the maximum number of entries
     */
    public CaffeineLocalCache(long maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Maximum size must be positive, got: " + maxSize);
        }
        this.cache = Caffeine.newBuilder().maximumSize(maxSize).build();
    }

    @Override
    public V get(K key, Function<? super K, ? extends V> loader) {
        return cache.get(key, loader);
    }

    @Override
    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
