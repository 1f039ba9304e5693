package aegis.core.service;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import aegis.core.util.RoleIdentifiers;

/**
 * Pulls the caller's role ids out of validated token claims.
 *
 * <p>The configured claim is read first. When it is absent the fallbacks
 * {@code roles}, {@code role}, {@code user_roles} and {@code role_ids} are tried in that
 * order. A list, a single string or a single integer is accepted; the result is
 * canonical, de-duplicated role ids in first-seen order.
 */
public class RoleClaimExtractor {

    public static final String DEFAULT_CLAIM = "role_ids";
    public static final List<String> FALLBACK_CLAIMS = List.of("roles", "role", "user_roles", "role_ids");

    private static final Logger LOG = Logger.getLogger(RoleClaimExtractor.class);

    private final String claim;

    public RoleClaimExtractor() {
        this(DEFAULT_CLAIM);
    }

    public RoleClaimExtractor(String claim) {
        this.claim = claim == null || claim.isBlank() ? DEFAULT_CLAIM : claim;
    }

    /**
     * Extract role ids.
     *
     * @param claims validated token claims (may be null)
     * @return canonical role ids; empty when no usable claim is present
     */
    public List<String> extract(Map<String, ?> claims) {
        if (claims == null || claims.isEmpty()) {
            return List.of();
        }

        var value = claims.get(claim);
        if (value == null) {
            for (String fallback : FALLBACK_CLAIMS) {
                value = claims.get(fallback);
                if (value != null) {
                    break;
                }
            }
        }

        if (value instanceof Collection<?> list) {
            return RoleIdentifiers.normalize(list);
        }
        if (value instanceof String || value instanceof Integer || value instanceof Long) {
            return RoleIdentifiers.normalize(List.of(value));
        }

        LOG.debugf("No usable role claim found under '%s'; available claims: %s", claim, claims.keySet());
        return List.of();
    }

    /**
     * Returns the primary claim name.
     */
    public String claim() {
        return claim;
    }
}
