package aegis.core.model.snapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed, validated permission collection owned by an external system.
 *
 * <p>Role identifiers are canonical strings. Both the flat-map shape and the legacy
 * list-of-single-key-maps shape parse into this one structure.
 *
 * @param lastUpdate  Unix timestamp (seconds) of the last mutation by the owner
 * @param permissions role id to compiled rules, in snapshot order
 */
public record PermissionSnapshot(long lastUpdate, Map<String, List<PermissionRule>> permissions) {

    public PermissionSnapshot {
        if (permissions == null) {
            permissions = Map.of();
        } else {
            final var copy = new LinkedHashMap<String, List<PermissionRule>>();
            permissions.forEach((role, rules) -> copy.put(role, List.copyOf(rules)));
            permissions = Collections.unmodifiableMap(copy);
        }
    }

    /**
     * Rules granted to a role.
     *
     * @param roleId canonical role id
     * @return the rules, or empty when the role is not in the snapshot
     */
    public Optional<List<PermissionRule>> rulesFor(String roleId) {
        return Optional.ofNullable(permissions.get(roleId));
    }

    /**
     * Returns the number of roles in the snapshot.
     */
    public int roleCount() {
        return permissions.size();
    }
}
