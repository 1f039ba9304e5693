package aegis.core.service;

import java.util.Optional;
import java.util.OptionalLong;

import aegis.core.model.PermissionKey;
import aegis.core.model.common.CacheException;
import aegis.core.model.snapshot.LegacyGrant;
import aegis.core.model.snapshot.PermissionSnapshot;
import aegis.core.port.out.CacheStore;

/**
 * Read access to the permission snapshot store.
 *
 * <p>The snapshot lives under the well-known key {@value #SNAPSHOT_KEY}. Legacy
 * single-key decision values live in the same store under the serialized
 * {@link PermissionKey}. The engine never writes to this store.
 */
public class SnapshotReader {

    public static final String SNAPSHOT_KEY = "permissions";

    private final CacheStore store;
    private final SnapshotParser parser;

    public SnapshotReader(CacheStore store, SnapshotParser parser) {
        this.store = store;
        this.parser = parser;
    }

    /**
     * Load and parse the snapshot.
     *
     * @return the snapshot, or empty when absent or invalid
     * @throws CacheException when the store cannot be read
     */
    public Optional<PermissionSnapshot> load() {
        return store.read(SNAPSHOT_KEY).flatMap(parser::parse);
    }

    /**
     * Read only the snapshot's {@code last_update} timestamp.
     *
     * @return epoch seconds, or empty when the snapshot or its timestamp is absent
     * @throws CacheException when the store cannot be read
     */
    public OptionalLong lastUpdate() {
        return store.read(SNAPSHOT_KEY).map(parser::lastUpdateOf).orElse(OptionalLong.empty());
    }

    /**
     * Read a legacy single-key decision value.
     *
     * @param key the permission key
     * @return the resolved legacy value, or empty when no entry exists
     * @throws CacheException when the store cannot be read
     */
    public Optional<LegacyGrant> legacyEntry(PermissionKey key) {
        return store.read(key.serialize()).map(LegacyGrant::from);
    }
}
