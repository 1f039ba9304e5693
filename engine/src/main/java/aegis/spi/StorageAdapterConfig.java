package aegis.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Backend options for cache store providers.
 *
 * <p>Keys are absolute property names built from the store prefix a provider is created
 * for, e.g. {@code aegis.rbac.snapshot-store.memcached.servers}.
 */
public interface StorageAdapterConfig {

    /**
     * @param key the property name
     * @return the value, if configured
     */
    Optional<String> get(String key);

    /**
     * @param key          the property name
     * @param defaultValue returned when the property is unset
     * @return the configured value or the default
     */
    String getOrDefault(String key, String defaultValue);

    /**
     * Read an ISO-8601 duration such as {@code PT2S}.
     *
     * @param key the property name
     * @return the duration, if configured
     * @throws aegis.core.model.common.ConfigurationException if the value is not a duration
     */
    Optional<Duration> getDuration(String key);
}
