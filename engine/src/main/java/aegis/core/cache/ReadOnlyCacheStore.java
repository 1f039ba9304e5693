package aegis.core.cache;

import java.time.Duration;
import java.util.Optional;

import aegis.core.port.out.CacheStore;

/**
 * View of a cache store that only permits reads.
 *
 * <p>Wraps the snapshot store in the isolated trust mode so that no code path in the
 * engine can mutate data owned by the external permission system.
 */
public final class ReadOnlyCacheStore implements CacheStore {

    private final CacheStore delegate;

    public ReadOnlyCacheStore(CacheStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public Optional<Object> read(String key) {
        return delegate.read(key);
    }

    @Override
    public boolean exists(String key) {
        return delegate.exists(key);
    }

    @Override
    public void write(String key, Object value, Duration expiresIn) {
        throw readOnly("write");
    }

    @Override
    public void delete(String key) {
        throw readOnly("delete");
    }

    @Override
    public void clear() {
        throw readOnly("clear");
    }

    /**
     * Closes the wrapped store. Releasing connections does not touch stored data.
     */
    @Override
    public void close() {
        delegate.close();
    }

    /**
     * Returns the wrapped store.
     */
    public CacheStore delegate() {
        return delegate;
    }

    private UnsupportedOperationException readOnly(String operation) {
        return new UnsupportedOperationException(
                "Cache store '" + delegate.name() + "' is read-only; " + operation + " rejected");
    }
}
