package aegis.core.service;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.jboss.logging.Logger;

import aegis.core.cache.CaffeineLocalCache;
import aegis.core.cache.LocalCache;
import aegis.core.model.snapshot.PermissionRule;
import aegis.core.model.snapshot.PermissionSnapshot;
import aegis.core.model.snapshot.ResourcePattern;

/**
 * Compiles and evaluates {@code <resource-pattern>:<method>} permission rules.
 *
 * <p>Resource patterns:
 * <ul>
 *   <li>{@code %r{...}} - regular expression, searched anywhere in the resource path</li>
 *   <li>{@code prefix/*} - the prefix and anything below it</li>
 *   <li>{@code *} - any resource</li>
 *   <li>anything else - literal equality</li>
 * </ul>
 *
 * <p>Methods compare case-insensitively; {@code *} matches every method.
 *
 * <p>Compiled resource patterns are memoized by pattern text, so snapshots that repeat
 * a rule across roles or reloads compile it once. An invalid regular expression is
 * logged when compiled and then never matches.
 */
public class PermissionMatcher {

    private static final Logger LOG = Logger.getLogger(PermissionMatcher.class);
    private static final long DEFAULT_CACHE_SIZE = 1000;
    private static final String PREFIX_SUFFIX = "/*";

    private final LocalCache<String, ResourcePattern> patterns;

    public PermissionMatcher() {
        this(DEFAULT_CACHE_SIZE);
    }

    public PermissionMatcher(long maxCachedPatterns) {
        this.patterns = new CaffeineLocalCache<>(maxCachedPatterns);
    }

    /**
     * Compile a rule.
     *
     * @param rule the rule text
     * @return the compiled rule, or empty unless the rule holds exactly one {@code :}
     */
    public Optional<PermissionRule> compile(String rule) {
        return PermissionRule.split(rule)
                .map(parts -> new PermissionRule(rule, patterns.get(parts[0], this::compilePattern), parts[1]));
    }

    /**
     * Evaluate a single rule.
     *
     * @param rule         the rule text
     * @param resourcePath the tenant-stripped resource path
     * @param method       the HTTP method
     * @return true when the rule grants the request; false for malformed rules
     */
    public boolean matches(String rule, String resourcePath, String method) {
        return compile(rule).map(r -> r.matches(resourcePath, method)).orElse(false);
    }

    /**
     * Find the first rule granting the request across the caller's roles.
     *
     * <p>Roles are checked in the caller's order and rules in snapshot order; the first
     * match wins.
     *
     * @param snapshot     the parsed snapshot
     * @param roles        canonical role ids
     * @param resourcePath the tenant-stripped resource path
     * @param method       the HTTP method
     * @return the granting rule and its role, or empty when nothing matches
     */
    public Optional<Match> findMatch(
            PermissionSnapshot snapshot, List<String> roles, String resourcePath, String method) {
        for (String role : roles) {
            final var rules = snapshot.rulesFor(role);
            if (rules.isEmpty()) {
                continue;
            }
            for (PermissionRule rule : rules.get()) {
                if (rule.matches(resourcePath, method)) {
                    return Optional.of(new Match(role, rule));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the number of compiled patterns currently memoized.
     */
    public long cachedPatternCount() {
        return patterns.estimatedSize();
    }

    private ResourcePattern compilePattern(String pattern) {
        if (pattern.startsWith(PermissionRule.REGEX_OPEN)
                && pattern.endsWith(PermissionRule.REGEX_CLOSE)
                && pattern.length() >= PermissionRule.REGEX_OPEN.length() + PermissionRule.REGEX_CLOSE.length()) {
            final var source = pattern.substring(
                    PermissionRule.REGEX_OPEN.length(), pattern.length() - PermissionRule.REGEX_CLOSE.length());
            try {
                return new ResourcePattern.Regex(Pattern.compile(source));
            } catch (PatternSyntaxException e) {
                LOG.warnf("Invalid regex in permission rule '%s': %s", source, e.getDescription());
                return new ResourcePattern.Unmatchable(source, e.getDescription());
            }
        }
        if (PermissionRule.WILDCARD.equals(pattern)) {
            return new ResourcePattern.Any();
        }
        if (pattern.endsWith(PREFIX_SUFFIX)) {
            return new ResourcePattern.Prefix(pattern.substring(0, pattern.length() - PREFIX_SUFFIX.length()));
        }
        return new ResourcePattern.Literal(pattern);
    }

    /**
     * A rule that granted a request.
     *
     * @param role the role that carried the rule
     * @param rule the matching rule
     */
    public record Match(String role, PermissionRule rule) {}
}
