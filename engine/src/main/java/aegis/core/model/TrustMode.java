package aegis.core.model;

/**
 * Trust topology between the permission snapshot store and the decision cache.
 */
public enum TrustMode {

    /** One store holds both the snapshot and the decision cache; the engine may write. */
    SHARED,

    /** The snapshot store is read-only to the engine; decisions go to a separate writable store. */
    ISOLATED,

    /** Snapshot store only. No decision cache; every request is evaluated against the snapshot. */
    READ_ONLY
}
