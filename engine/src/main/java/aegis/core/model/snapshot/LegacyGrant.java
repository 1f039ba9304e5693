package aegis.core.model.snapshot;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Single-key-per-decision permission value from the pre-rule-string format.
 *
 * <p>The old format stored one value per decision under the serialized permission key,
 * and that value could be a boolean, a boolean-like scalar, a descriptor map or a list
 * of allowed methods. {@link #from(Object)} resolves the shape once; evaluation then
 * works on the variant.
 */
public sealed interface LegacyGrant {

    String ALLOWED_METHODS = "allowed_methods";
    String ROLES = "roles";
    String ALLOWED = "allowed";

    /**
     * Check whether this value grants the given method.
     *
     * @param method the HTTP method
     * @return true when access is granted
     */
    boolean grants(String method);

    /** Boolean or boolean-like scalar ({@code true}, {@code "true"}, {@code 1}, {@code "1"}). */
    record Flag(boolean granted) implements LegacyGrant {
        @Override
        public boolean grants(String method) {
            return granted;
        }
    }

    /** Bare list of allowed method names. */
    record MethodList(Set<String> methods) implements LegacyGrant {
        public MethodList {
            methods = methods == null ? Set.of() : Set.copyOf(methods);
        }

        @Override
        public boolean grants(String method) {
            return methodAllowed(methods, method);
        }
    }

    /**
     * Map with {@code allowed_methods}, {@code roles} or {@code allowed}, checked in that order.
     */
    record Descriptor(Optional<Set<String>> allowedMethods, boolean rolesPresent, Optional<Boolean> allowed)
            implements LegacyGrant {
        @Override
        public boolean grants(String method) {
            if (allowedMethods.isPresent()) {
                return methodAllowed(allowedMethods.get(), method);
            }
            if (rolesPresent) {
                return true;
            }
            return allowed.orElse(false);
        }
    }

    /** Any other shape. Always denies. */
    record Unrecognized(String type) implements LegacyGrant {
        @Override
        public boolean grants(String method) {
            return false;
        }
    }

    /**
     * Resolve a raw decoded cache value into its variant.
     *
     * @param raw the value read from the store (may be null)
     * @return the variant; never null
     */
    static LegacyGrant from(Object raw) {
        if (raw == null) {
            return new Unrecognized("null");
        }
        final var flag = booleanLike(raw);
        if (flag.isPresent()) {
            return new Flag(flag.get());
        }
        if (raw instanceof Map<?, ?> map) {
            return descriptor(map);
        }
        if (raw instanceof Collection<?> list) {
            return methodNames(list)
                    .<LegacyGrant>map(MethodList::new)
                    .orElseGet(() -> new Unrecognized("list"));
        }
        return new Unrecognized(raw.getClass().getSimpleName());
    }

    private static LegacyGrant descriptor(Map<?, ?> map) {
        if (map.containsKey(ALLOWED_METHODS)) {
            final var methods = map.get(ALLOWED_METHODS) instanceof Collection<?> list
                    ? methodNames(list)
                    : Optional.<Set<String>>empty();
            return methods.<LegacyGrant>map(m -> new Descriptor(Optional.of(m), false, Optional.empty()))
                    .orElseGet(() -> new Unrecognized("map"));
        }
        if (map.containsKey(ROLES)) {
            return new Descriptor(Optional.empty(), present(map.get(ROLES)), Optional.empty());
        }
        if (map.containsKey(ALLOWED)) {
            return new Descriptor(
                    Optional.empty(), false, Optional.of(booleanLike(map.get(ALLOWED)).orElse(false)));
        }
        return new Unrecognized("map");
    }

    private static Optional<Set<String>> methodNames(Collection<?> list) {
        if (!list.stream().allMatch(String.class::isInstance)) {
            return Optional.empty();
        }
        return Optional.of(list.stream()
                .map(m -> ((String) m).trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet()));
    }

    private static boolean present(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return !(value instanceof String s) || !s.isBlank();
    }

    private static Optional<Boolean> booleanLike(Object value) {
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value instanceof Number n) {
            if (n.doubleValue() == 1) {
                return Optional.of(true);
            }
            if (n.doubleValue() == 0) {
                return Optional.of(false);
            }
            return Optional.empty();
        }
        if (value instanceof String s) {
            return switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "true", "1" -> Optional.of(true);
                case "false", "0" -> Optional.of(false);
                default -> Optional.empty();
            };
        }
        return Optional.empty();
    }

    private static boolean methodAllowed(Set<String> methods, String method) {
        if (methods.contains(PermissionRule.WILDCARD)) {
            return true;
        }
        return method != null && methods.contains(method.trim().toLowerCase(Locale.ROOT));
    }
}
