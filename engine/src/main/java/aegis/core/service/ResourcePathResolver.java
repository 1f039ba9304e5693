package aegis.core.service;

import java.util.regex.Pattern;

/**
 * Reduces a request path to the tenant-agnostic resource path that rules are written
 * against.
 *
 * <p>With the default slug pattern {@code ^/api/v1/([^/]+)/}, the path
 * {@code /api/v1/acme/sales/invoices} resolves to {@code sales/invoices}. Paths that do
 * not carry a slug lose an {@code /api/vN/} or {@code /api/} prefix and a leading slash.
 * Already-resolved paths pass through unchanged.
 */
public class ResourcePathResolver {

    public static final String DEFAULT_SLUG_PATTERN = "^/api/v1/([^/]+)/";

    private static final Pattern VERSIONED_API_PREFIX = Pattern.compile("^/api/v\\d+/");
    private static final Pattern API_PREFIX = Pattern.compile("^/api/");

    private final Pattern slugPattern;

    public ResourcePathResolver() {
        this(Pattern.compile(DEFAULT_SLUG_PATTERN));
    }

    /**
     * @param slugPattern pattern locating the tenant slug, or null to skip slug stripping
     */
    public ResourcePathResolver(Pattern slugPattern) {
        this.slugPattern = slugPattern;
    }

    /**
     * Resolve the resource path.
     *
     * @param path the request path (may be null)
     * @return the resource path; never null
     */
    public String resolve(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }

        if (slugPattern != null) {
            final var matcher = slugPattern.matcher(path);
            if (matcher.find() && matcher.groupCount() > 0) {
                final var stripped = path.substring(0, matcher.start()) + path.substring(matcher.end());
                return stripped.startsWith("/") ? stripped.substring(1) : stripped;
            }
        }

        var resource = VERSIONED_API_PREFIX.matcher(path).replaceFirst("");
        resource = API_PREFIX.matcher(resource).replaceFirst("");
        return resource.startsWith("/") ? resource.substring(1) : resource;
    }
}
