package aegis.core.service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import org.jboss.logging.Logger;

import aegis.core.model.DecisionLookup;
import aegis.core.model.PermissionKey;
import aegis.core.model.common.CacheException;
import aegis.core.port.out.AuthorizationMetrics;
import aegis.core.port.out.CacheStore;
import aegis.core.util.KeyFingerprint;

/**
 * Engine-owned cache of granted decisions and its invalidation policy.
 *
 * <p>All decisions live in one blob under {@value #DECISIONS_KEY}, mapping a serialized
 * {@link PermissionKey} to the epoch second at which the grant was cached, so a single
 * round trip serves every subject sharing the store. Denials are never stored.
 *
 * <h2>Lookup</h2>
 * <ol>
 *   <li>No blob: miss.</li>
 *   <li>Snapshot {@code last_update} within the TTL: the snapshot changed recently and no
 *       cached decision can be trusted, so the whole blob is deleted.</li>
 *   <li>Entry older than the TTL: only that entry is removed; the blob is deleted
 *       when it becomes empty.</li>
 *   <li>Otherwise: hit.</li>
 * </ol>
 *
 * <h2>Writes</h2>
 * A grant is recorded only if the snapshot timestamp re-read at write time equals the one
 * the grant was evaluated against and lies outside the TTL window. An evaluation against
 * a snapshot that changed mid-request therefore cannot repopulate the blob after a global
 * invalidation. Concurrent merges are last-writer-wins on the whole blob; removals only
 * delete an entry whose timestamp is unchanged since it was found stale.
 *
 * <p>Every store failure is logged and reported as {@link DecisionLookup#UNAVAILABLE}
 * (reads) or a skipped write; nothing propagates.
 */
public class DecisionCache {

    public static final String DECISIONS_KEY = "user_permissions";

    private static final Logger LOG = Logger.getLogger(DecisionCache.class);

    private final CacheStore store;
    private final SnapshotReader snapshot;
    private final long ttlSeconds;
    private final Duration blobExpiry;
    private final Clock clock;
    private final AuthorizationMetrics metrics;

    public DecisionCache(
            CacheStore store,
            SnapshotReader snapshot,
            Duration ttl,
            Duration blobExpiry,
            Clock clock,
            AuthorizationMetrics metrics) {
        this.store = store;
        this.snapshot = snapshot;
        this.ttlSeconds = ttl.toSeconds();
        this.blobExpiry = blobExpiry;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Look up a cached grant, applying both invalidation rules.
     *
     * @param key the permission key
     * @return the lookup outcome; only {@link DecisionLookup#HIT} grants access
     */
    public DecisionLookup lookup(PermissionKey key) {
        final var outcome = evaluate(key);
        metrics.recordCacheLookup(outcome);
        return outcome;
    }

    /**
     * Record a granted decision.
     *
     * @param key               the permission key
     * @param evaluatedAgainst  {@code last_update} of the snapshot the grant was evaluated
     *                          against (empty when evaluated without a snapshot)
     * @return true when the entry was written
     */
    public boolean record(PermissionKey key, OptionalLong evaluatedAgainst) {
        final var fingerprint = KeyFingerprint.of(key.serialize());
        try {
            final var now = now();
            final var current = snapshot.lastUpdate();
            if (!current.equals(evaluatedAgainst)) {
                LOG.debugf("Skipped caching %s: snapshot changed during evaluation", fingerprint);
                return false;
            }
            if (current.isPresent() && now - current.getAsLong() <= ttlSeconds) {
                LOG.debugf("Skipped caching %s: snapshot updated within TTL", fingerprint);
                return false;
            }

            final var blob = readBlob().orElseGet(LinkedHashMap::new);
            blob.put(key.serialize(), now);
            store.write(DECISIONS_KEY, blob, blobExpiry);
            LOG.debugf("Cached decision %s at %d", fingerprint, now);
            return true;
        } catch (CacheException e) {
            LOG.warnv("Decision cache write failed ({0}): {1}", store.name(), e.getMessage());
            return false;
        }
    }

    /**
     * Discard every cached decision.
     *
     * @param reason log message explaining the invalidation
     */
    public void invalidateAll(String reason) {
        try {
            store.delete(DECISIONS_KEY);
            LOG.debugf("Invalidated decision cache: %s", reason);
        } catch (CacheException e) {
            LOG.warnv("Decision cache invalidation failed ({0}): {1}", store.name(), e.getMessage());
        }
    }

    /**
     * Returns the cached grants currently in the blob, keyed by serialized permission key.
     *
     * @throws CacheException when the store cannot be read
     */
    public Map<String, Object> entries() {
        return readBlob().orElseGet(LinkedHashMap::new);
    }

    private DecisionLookup evaluate(PermissionKey key) {
        final var fingerprint = KeyFingerprint.of(key.serialize());
        final Optional<Map<String, Object>> blob;
        final OptionalLong lastUpdate;
        try {
            blob = readBlob();
            if (blob.isEmpty()) {
                return DecisionLookup.MISS;
            }
            lastUpdate = snapshot.lastUpdate();
        } catch (CacheException e) {
            LOG.warnv("Decision cache lookup failed ({0}): {1}", e.getStore(), e.getMessage());
            return DecisionLookup.UNAVAILABLE;
        }

        final var now = now();
        if (lastUpdate.isPresent()) {
            final var snapshotAge = now - lastUpdate.getAsLong();
            if (snapshotAge <= ttlSeconds) {
                invalidateAll("snapshot updated " + snapshotAge + "s ago, within TTL of " + ttlSeconds + "s");
                return DecisionLookup.INVALIDATED_ALL;
            }
        }

        final var cached = blob.get().get(key.serialize());
        if (!(cached instanceof Number timestamp)) {
            return DecisionLookup.MISS;
        }

        final var entryAge = now - timestamp.longValue();
        if (entryAge > ttlSeconds) {
            removeEntry(key, timestamp.longValue());
            LOG.debugf("Expired decision %s (%ds > %ds)", fingerprint, entryAge, ttlSeconds);
            return DecisionLookup.EXPIRED;
        }

        LOG.debugf("Decision cache hit %s (age %ds)", fingerprint, entryAge);
        return DecisionLookup.HIT;
    }

    private void removeEntry(PermissionKey key, long staleTimestamp) {
        try {
            final var current = readBlob();
            if (current.isEmpty()) {
                return;
            }
            final var blob = current.get();
            final var value = blob.get(key.serialize());
            if (!(value instanceof Number n) || n.longValue() != staleTimestamp) {
                return;
            }
            blob.remove(key.serialize());
            if (blob.isEmpty()) {
                store.delete(DECISIONS_KEY);
            } else {
                store.write(DECISIONS_KEY, blob, blobExpiry);
            }
        } catch (CacheException e) {
            LOG.warnv("Stale decision removal failed ({0}): {1}", store.name(), e.getMessage());
        }
    }

    private Optional<Map<String, Object>> readBlob() {
        return store.read(DECISIONS_KEY).flatMap(value -> {
            if (!(value instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            final var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return Optional.of(copy);
        });
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
