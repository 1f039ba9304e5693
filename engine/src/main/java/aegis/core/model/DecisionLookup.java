package aegis.core.model;

/**
 * Result of consulting the decision cache for one permission key.
 */
public enum DecisionLookup {

    /** A fresh cached grant exists. */
    HIT,

    /** No usable entry. */
    MISS,

    /** The snapshot changed within the TTL window and the whole decision blob was discarded. */
    INVALIDATED_ALL,

    /** This entry outlived the TTL and was removed; sibling entries were kept. */
    EXPIRED,

    /** The cache could not be read. */
    UNAVAILABLE;

    public boolean isHit() {
        return this == HIT;
    }
}
