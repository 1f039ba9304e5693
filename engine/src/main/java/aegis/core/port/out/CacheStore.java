package aegis.core.port.out;

import java.time.Duration;
import java.util.Optional;

import aegis.core.model.common.CacheException;

/**
 * Port interface for the key-value stores that hold the permission snapshot and the
 * decision cache.
 *
 * <p>Values are opportunistically serialized: strings, numbers and booleans are stored
 * as text, structured values (maps, lists) as JSON. Reads parse JSON back into maps,
 * lists and scalars, and fall back to the raw string when the stored text is not JSON.
 *
 * <p>Every method that can fail at the transport layer throws {@link CacheException}.
 * An absent key is reported as an empty result, never as an exception. Implementations
 * must be safe for concurrent use.
 *
 * <p>{@link #close()} releases backend connections the store owns; stores without any
 * keep the no-op default.
 */
public interface CacheStore extends AutoCloseable {

    /**
     * Short backend name used in logs and metrics (e.g. "memory", "redis").
     */
    String name();

    /**
     * Read a value.
     *
     * @param key the key
     * @return the decoded value, or empty if absent or expired
     * @throws CacheException on backend failure
     */
    Optional<Object> read(String key);

    /**
     * Write a value without expiry.
     *
     * @param key   the key
     * @param value the value, serialized by the store
     * @throws CacheException on backend failure
     */
    default void write(String key, Object value) {
        write(key, value, null);
    }

    /**
     * Write a value.
     *
     * @param key       the key
     * @param value     the value, serialized by the store
     * @param expiresIn time to live, or null for no expiry
     * @throws CacheException on backend failure
     */
    void write(String key, Object value, Duration expiresIn);

    /**
     * Delete a key. Deleting an absent key is not an error.
     *
     * @param key the key
     * @throws CacheException on backend failure
     */
    void delete(String key);

    /**
     * Remove every key in the store.
     *
     * @throws CacheException on backend failure
     */
    void clear();

    /**
     * Check whether a key holds a value.
     *
     * @param key the key
     * @return true when {@link #read(String)} would return a value
     * @throws CacheException on backend failure
     */
    default boolean exists(String key) {
        return read(key).isPresent();
    }

    @Override
    default void close() {}
}
