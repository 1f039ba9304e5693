package aegis.core.model;

import java.util.Locale;

/**
 * Identifies a single authorization decision.
 *
 * <p>Serialized as {@code <subject>:<host><path>:<method>} for use as a key inside the
 * decision cache blob. The method is lower-cased so that {@code GET} and {@code get}
 * produce the same key; host and path are used verbatim because tenant validation has
 * already normalized them.
 *
 * @param subjectId the authenticated subject
 * @param host      request host ({@code localhost} when absent)
 * @param path      request path, verbatim
 * @param method    HTTP method, lower-cased
 */
public record PermissionKey(String subjectId, String host, String path, String method) {

    static final String DEFAULT_HOST = "localhost";

    public PermissionKey {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("Subject ID cannot be null or blank");
        }
        if (host == null || host.isEmpty()) {
            host = DEFAULT_HOST;
        }
        if (path == null) {
            path = "";
        }
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("Method cannot be null or blank");
        }
        method = method.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Create a key from a raw subject identifier (string or integer).
     *
     * @param subjectId the subject, converted with {@link String#valueOf(Object)}
     * @param host      the request host
     * @param path      the request path
     * @param method    the HTTP method
     * @return the key
     */
    public static PermissionKey of(Object subjectId, String host, String path, String method) {
        return new PermissionKey(subjectId == null ? null : String.valueOf(subjectId), host, path, method);
    }

    /**
     * Returns the stable string form used inside the decision blob.
     */
    public String serialize() {
        return subjectId + ":" + host + path + ":" + method;
    }

    @Override
    public String toString() {
        return serialize();
    }
}
