package aegis.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Short, stable fingerprints of permission keys for log output.
 *
 * <p>Permission keys embed subject identifiers and request paths. Logs carry a
 * truncated SHA-256 digest instead so entries stay correlatable without exposing the
 * raw key.
 */
public final class KeyFingerprint {

    private static final int HEX_CHARS = 12;

    private KeyFingerprint() {}

    /**
     * Return the fingerprint of a key.
     *
     * @param key the raw key
     * @return 12 hex characters, or {@code "-"} for null
     */
    public static String of(String key) {
        if (key == null) {
            return "-";
        }
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            final var hash = digest.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
