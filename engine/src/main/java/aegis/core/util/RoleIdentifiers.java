package aegis.core.util;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Canonical string form for role identifiers.
 *
 * <p>Role ids arrive from token claims as strings or integers and appear in the
 * snapshot as JSON object keys. Normalizing both sides to the same string form means
 * {@code 123} and {@code "123"} always refer to the same role.
 */
public final class RoleIdentifiers {

    private RoleIdentifiers() {}

    /**
     * Normalize a single role id.
     *
     * @param role a string or number
     * @return the canonical id, or null for null, blank, non-finite or non-scalar input
     */
    public static String canonical(Object role) {
        if (role == null) {
            return null;
        }
        if (role instanceof String s) {
            final var trimmed = s.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        if (role instanceof Integer || role instanceof Long || role instanceof Short || role instanceof Byte) {
            return role.toString();
        }
        if (role instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return null;
        }
        if (role instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return null;
        }
        if (role instanceof Number n) {
            final var decimal = new BigDecimal(n.toString()).stripTrailingZeros();
            return decimal.scale() <= 0 ? decimal.toBigInteger().toString() : decimal.toPlainString();
        }
        return null;
    }

    /**
     * Normalize and de-duplicate a collection of role ids, keeping first-seen order.
     *
     * @param roles raw role ids (may be null)
     * @return canonical ids; never null
     */
    public static List<String> normalize(Collection<?> roles) {
        if (roles == null || roles.isEmpty()) {
            return List.of();
        }
        final var unique = new LinkedHashSet<String>();
        for (Object role : roles) {
            final var id = canonical(role);
            if (id != null) {
                unique.add(id);
            }
        }
        return List.copyOf(unique);
    }
}
