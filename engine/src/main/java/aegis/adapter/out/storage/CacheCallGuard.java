package aegis.adapter.out.storage;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import aegis.core.model.common.CacheException;
import aegis.core.port.out.AuthorizationMetrics;

/**
 * Bounds backend calls with a timeout and translates their failures.
 *
 * <p>Every network store runs its operations through {@link #await}. A call that
 * produces no item within the timeout fails; any failure, timeout or otherwise, reaches
 * the caller as a {@link CacheException} naming the store and operation. Timeouts and
 * other failures are counted separately.
 */
public class CacheCallGuard {

    private static final Logger LOG = Logger.getLogger(CacheCallGuard.class);

    private final Duration timeout;
    private final AuthorizationMetrics metrics;
    private final String storeName;

    /**
     * @param timeout   upper bound for a single backend call
     * @param metrics   metrics sink (may be null)
     * @param storeName store name used in errors, logs and metric tags
     */
    public CacheCallGuard(Duration timeout, AuthorizationMetrics metrics, String storeName) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        this.timeout = timeout;
        this.metrics = metrics;
        this.storeName = storeName;
    }

    /**
     * Run a backend call and wait for its result.
     *
     * @param operation     the backend call
     * @param operationName name for errors, logs and metrics
     * @param <T>           the result type
     * @return the call's item (may be null)
     * @throws CacheException on timeout or any failure
     */
    public <T> T await(Uni<T> operation, String operationName) {
        try {
            return operation
                    .ifNoItem()
                    .after(timeout)
                    .failWith(() -> {
                        LOG.warnv("Cache operation timeout: {0} on {1} after {2}", operationName, storeName, timeout);
                        recordTimeout(operationName);
                        return new CacheException(storeName, operationName, "timed out after " + timeout);
                    })
                    .await()
                    .indefinitely();
        } catch (CacheException e) {
            throw e;
        } catch (RuntimeException e) {
            final var cause = unwrap(e);
            LOG.warnv("Cache operation failure: {0} on {1}: {2}", operationName, storeName, cause.getMessage());
            recordFailure(operationName);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new CacheException(storeName, operationName, cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void recordTimeout(String operationName) {
        if (metrics != null) {
            metrics.recordStoreTimeout(storeName, operationName);
        }
    }

    private void recordFailure(String operationName) {
        if (metrics != null) {
            metrics.recordStoreFailure(storeName, operationName);
        }
    }
}
