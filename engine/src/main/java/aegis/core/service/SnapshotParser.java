package aegis.core.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import org.jboss.logging.Logger;

import aegis.core.model.snapshot.PermissionRule;
import aegis.core.model.snapshot.PermissionSnapshot;
import aegis.core.util.RoleIdentifiers;

/**
 * Validates and parses the externally written permission snapshot.
 *
 * <p>Accepted layouts:
 * <pre>
 * { "last_update": 1700000000,
 *   "permissions": { "admin": ["admin/*:*"], "42": ["sales/invoices:get"] } }
 *
 * { "last_update": 1700000000,
 *   "permissions": [ { "admin": ["admin/*:*"] }, { "42": ["sales/invoices:get"] } ] }
 * </pre>
 *
 * <p>The second (list) layout is the legacy one. It is flattened at parse time; when a
 * role appears more than once the first occurrence wins, which is the order a list scan
 * would have found it in.
 *
 * <p>The snapshot is written by another system, so any structural problem makes the
 * whole snapshot invalid. Parsing never throws.
 */
public class SnapshotParser {

    public static final String LAST_UPDATE = "last_update";
    public static final String PERMISSIONS = "permissions";

    private static final Logger LOG = Logger.getLogger(SnapshotParser.class);

    private final PermissionMatcher matcher;

    public SnapshotParser(PermissionMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * Structural check of a raw snapshot value.
     *
     * @param raw the decoded store value
     * @return true when the value is a well-formed snapshot
     */
    public boolean validate(Object raw) {
        return rolesOf(raw).isPresent() && lastUpdateOf(raw).isPresent();
    }

    /**
     * Parse a raw snapshot value.
     *
     * @param raw the decoded store value
     * @return the parsed snapshot, or empty when the value is not a valid snapshot
     */
    public Optional<PermissionSnapshot> parse(Object raw) {
        try {
            final var lastUpdate = lastUpdateOf(raw);
            final var roles = rolesOf(raw);
            if (lastUpdate.isEmpty() || roles.isEmpty()) {
                LOG.warn("Permission snapshot failed validation; denying until it is repaired");
                return Optional.empty();
            }

            final var compiled = new LinkedHashMap<String, List<PermissionRule>>();
            roles.get().forEach((role, rules) -> {
                final var parsed = new ArrayList<PermissionRule>(rules.size());
                rules.forEach(rule -> matcher.compile(rule).ifPresent(parsed::add));
                compiled.put(role, parsed);
            });
            return Optional.of(new PermissionSnapshot(lastUpdate.getAsLong(), compiled));
        } catch (RuntimeException e) {
            LOG.warnv("Permission snapshot could not be parsed: {0}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Extract only the {@code last_update} timestamp.
     *
     * <p>Does not require the rest of the snapshot to be valid; the invalidation policy
     * needs the timestamp even when rule lists are being repaired.
     *
     * @param raw the decoded store value
     * @return the timestamp in epoch seconds, if present and numeric
     */
    public OptionalLong lastUpdateOf(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            return OptionalLong.empty();
        }
        final var value = map.get(LAST_UPDATE);
        if (value instanceof Number n) {
            return OptionalLong.of(n.longValue());
        }
        if (value instanceof String s) {
            try {
                return OptionalLong.of(Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    private Optional<Map<String, List<String>>> rolesOf(Object raw) {
        if (!(raw instanceof Map<?, ?> map) || !map.containsKey(PERMISSIONS)) {
            return Optional.empty();
        }
        final var permissions = map.get(PERMISSIONS);
        final var roles = new LinkedHashMap<String, List<String>>();

        if (permissions instanceof Map<?, ?> flat) {
            return collectRoles(flat, roles) ? Optional.of(roles) : Optional.empty();
        }
        if (permissions instanceof Collection<?> entries) {
            for (Object entry : entries) {
                if (!(entry instanceof Map<?, ?> single) || single.isEmpty() || !collectRoles(single, roles)) {
                    return Optional.empty();
                }
            }
            return Optional.of(roles);
        }
        return Optional.empty();
    }

    private boolean collectRoles(Map<?, ?> source, Map<String, List<String>> target) {
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            final var role = RoleIdentifiers.canonical(entry.getKey());
            final var rules = ruleStrings(entry.getValue());
            if (role == null || rules.isEmpty()) {
                return false;
            }
            target.putIfAbsent(role, rules.get());
        }
        return true;
    }

    private Optional<List<String>> ruleStrings(Object value) {
        if (!(value instanceof Collection<?> list)) {
            return Optional.empty();
        }
        final var rules = new ArrayList<String>(list.size());
        for (Object rule : list) {
            if (!(rule instanceof String s) || PermissionRule.split(s).isEmpty()) {
                return Optional.empty();
            }
            rules.add(s);
        }
        return Optional.of(rules);
    }
}
