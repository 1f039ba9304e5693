package aegis.core.model.snapshot;

import java.util.regex.Pattern;

/**
 * Resource half of a permission rule, compiled once when the snapshot is parsed.
 */
public sealed interface ResourcePattern {

    /**
     * Check whether a tenant-stripped resource path matches this pattern.
     *
     * @param resourcePath the resource path
     * @return true on match
     */
    boolean matches(String resourcePath);

    /** Plain string; matches by equality. */
    record Literal(String path) implements ResourcePattern {
        @Override
        public boolean matches(String resourcePath) {
            return path.equals(resourcePath);
        }
    }

    /**
     * Trailing {@code /*} wildcard. {@code admin/*} matches {@code admin} and anything
     * below {@code admin/}.
     */
    record Prefix(String base) implements ResourcePattern {
        @Override
        public boolean matches(String resourcePath) {
            return resourcePath.equals(base) || resourcePath.startsWith(base + "/");
        }
    }

    /** A bare {@code *}; matches every resource. */
    record Any() implements ResourcePattern {
        @Override
        public boolean matches(String resourcePath) {
            return true;
        }
    }

    /** {@code %r{...}} pattern; unanchored search, as a rule author would expect. */
    record Regex(Pattern pattern) implements ResourcePattern {
        @Override
        public boolean matches(String resourcePath) {
            return pattern.matcher(resourcePath).find();
        }
    }

    /** A pattern that failed to compile. Never matches. */
    record Unmatchable(String source, String error) implements ResourcePattern {
        @Override
        public boolean matches(String resourcePath) {
            return false;
        }
    }
}
