package aegis.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

import aegis.adapter.out.storage.CacheValueCodec;
import aegis.core.model.common.CacheException;
import aegis.core.port.out.CacheStore;

/**
 * In-memory implementation of CacheStore.
 *
 * <p>Values are held in encoded form, so a read always returns a fresh copy and behaves
 * like a network store. Expired entries are swept lazily on read: the expiry index is
 * ordered by deadline and only its expired head is walked.
 *
 * <p>Entries are local to one process. Intended for single-instance deployments, for the
 * decision store in ISOLATED mode and for tests.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCacheStore.class);

    private final String name;
    private final Clock clock;
    private final CacheValueCodec codec;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Entry> entries = new HashMap<>();
    private final PriorityQueue<Deadline> deadlines = new PriorityQueue<>();

    public InMemoryCacheStore() {
        this("memory", Clock.systemUTC());
    }

    public InMemoryCacheStore(String name, Clock clock) {
        this(name, clock, new CacheValueCodec());
    }

    public InMemoryCacheStore(String name, Clock clock, CacheValueCodec codec) {
        this.name = name;
        this.clock = clock;
        this.codec = codec;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Object> read(String key) {
        lock.lock();
        try {
            sweepExpired();
            final var entry = entries.get(key);
            return entry == null ? Optional.empty() : Optional.ofNullable(codec.decode(entry.value()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void write(String key, Object value, Duration expiresIn) {
        final String encoded;
        try {
            encoded = codec.encode(value);
        } catch (IllegalArgumentException e) {
            throw new CacheException(name, "write", e);
        }

        lock.lock();
        try {
            if (expiresIn == null || expiresIn.isZero() || expiresIn.isNegative()) {
                entries.put(key, new Entry(encoded, Long.MAX_VALUE));
                return;
            }
            final var deadline = deadline(expiresIn);
            entries.put(key, new Entry(encoded, deadline));
            deadlines.add(new Deadline(deadline, key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            deadlines.clear();
            LOG.debugf("Cleared in-memory cache store %s", name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of live entries, sweeping expired ones first.
     */
    public int size() {
        lock.lock();
        try {
            sweepExpired();
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private void sweepExpired() {
        final var now = clock.millis();
        var swept = 0;
        while (!deadlines.isEmpty() && deadlines.peek().expiresAtMillis() <= now) {
            final var head = deadlines.poll();
            final var entry = entries.get(head.key());
            // A rewrite leaves the old deadline behind; only the entry's own deadline removes it.
            if (entry != null && entry.expiresAtMillis() == head.expiresAtMillis()) {
                entries.remove(head.key());
                swept++;
            }
        }
        if (swept > 0) {
            LOG.debugf("Swept %d expired entries from %s", swept, name);
        }
    }

    private long deadline(Duration expiresIn) {
        try {
            return Math.addExact(clock.millis(), expiresIn.toMillis());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private record Entry(String value, long expiresAtMillis) {}

    private record Deadline(long expiresAtMillis, String key) implements Comparable<Deadline> {
        @Override
        public int compareTo(Deadline other) {
            return Long.compare(expiresAtMillis, other.expiresAtMillis);
        }
    }
}
