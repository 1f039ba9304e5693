package aegis.core.cache;

import java.util.function.Function;

/**
 * Bounded in-process memo for derived, recomputable data such as compiled rule
 * patterns.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /**
     * Gets a value, computing and storing it when absent.
     *
     * @param key    the cache key
     * @param loader computes the value on a miss; must not return null
     * @return the cached or computed value
     */
    V get(K key, Function<? super K, ? extends V> loader);

    /**
     * Returns the estimated number of entries in the cache.
     */
    long estimatedSize();
}
