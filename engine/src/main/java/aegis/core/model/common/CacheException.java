package aegis.core.model.common;

/**
 * Transport or backend failure raised by a cache store.
 *
 * <p>Every store translates its client's native exceptions into this type so that
 * callers never depend on backend-specific error classes. A missing key is not a
 * failure and never raises this exception.
 */
public class CacheException extends RuntimeException {

    private final String store;
    private final String operation;

    public CacheException(String store, String operation, String message) {
        super(store + " " + operation + " error: " + message);
        this.store = store;
        this.operation = operation;
    }

    public CacheException(String store, String operation, Throwable cause) {
        super(store + " " + operation + " error: " + describe(cause), cause);
        this.store = store;
        this.operation = operation;
    }

    /** Returns the name of the store that failed. */
    public String getStore() {
        return store;
    }

    /** Returns the operation that failed (read, write, delete, clear). */
    public String getOperation() {
        return operation;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
