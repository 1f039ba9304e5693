package aegis.core.model;

/**
 * Outcome of an authorization check.
 *
 * <p>A denial is a normal result, not an exception. Deny reasons are fixed
 * human-readable strings and never contain cache keys, store names or stack traces.
 */
public sealed interface AuthorizationDecision {

    String MISSING_SUBJECT = "Subject identifier missing";
    String NO_ROLES = "No roles assigned";
    String INSUFFICIENT_PERMISSIONS = "Access denied - insufficient permissions";
    String PERMISSIONS_UNAVAILABLE = "Access denied - permissions unavailable";

    /**
     * Returns true when the request is allowed.
     */
    boolean allowed();

    /**
     * Access granted.
     *
     * @param source where the grant came from
     */
    record Allow(Source source) implements AuthorizationDecision {
        @Override
        public boolean allowed() {
            return true;
        }
    }

    /**
     * Access refused.
     *
     * @param reason non-sensitive explanation
     */
    record Deny(String reason) implements AuthorizationDecision {
        @Override
        public boolean allowed() {
            return false;
        }
    }

    /** Where an allow decision was resolved. */
    enum Source {
        /** Served from the decision cache without reading the snapshot rules. */
        DECISION_CACHE,
        /** Evaluated against the permission snapshot. */
        SNAPSHOT,
        /** Evaluated against a legacy single-key decision entry. */
        LEGACY_ENTRY
    }

    static AuthorizationDecision allow(Source source) {
        return new Allow(source);
    }

    static AuthorizationDecision deny(String reason) {
        return new Deny(reason);
    }
}
