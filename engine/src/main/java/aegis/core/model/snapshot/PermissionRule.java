package aegis.core.model.snapshot;

import java.util.Locale;
import java.util.Optional;

/**
 * A compiled {@code <resource-pattern>:<method>} rule.
 *
 * @param source   the rule text as written in the snapshot
 * @param resource compiled resource pattern
 * @param method   lower-cased HTTP method or {@code *}
 */
public record PermissionRule(String source, ResourcePattern resource, String method) {

    public static final String SEPARATOR = ":";
    public static final String WILDCARD = "*";
    public static final String REGEX_OPEN = "%r{";
    public static final String REGEX_CLOSE = "}";

    public PermissionRule {
        method = method.toLowerCase(Locale.ROOT);
    }

    /**
     * Split a rule into its resource and method halves.
     *
     * @param rule the raw rule
     * @return the two halves, or empty unless the rule holds exactly one separator
     *         with a non-empty method
     */
    public static Optional<String[]> split(String rule) {
        if (rule == null) {
            return Optional.empty();
        }
        final var index = rule.indexOf(SEPARATOR);
        if (index < 0 || rule.indexOf(SEPARATOR, index + 1) >= 0) {
            return Optional.empty();
        }
        final var method = rule.substring(index + 1);
        if (method.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new String[] {rule.substring(0, index), method.trim()});
    }

    /**
     * Check this rule against a resource path and method.
     */
    public boolean matches(String resourcePath, String requestMethod) {
        return methodMatches(requestMethod) && resource.matches(resourcePath == null ? "" : resourcePath);
    }

    private boolean methodMatches(String requestMethod) {
        if (WILDCARD.equals(method)) {
            return true;
        }
        return requestMethod != null && method.equalsIgnoreCase(requestMethod.trim());
    }

    @Override
    public String toString() {
        return source;
    }
}
