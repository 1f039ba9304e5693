package aegis.adapter.out.storage;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;

import aegis.core.model.common.ConfigurationException;
import aegis.spi.StorageAdapterConfig;

/**
 * Store options read from MicroProfile Config.
 */
@ApplicationScoped
public class MicroProfileStorageAdapterConfig implements StorageAdapterConfig {

    private final Config config;

    @Inject
    public MicroProfileStorageAdapterConfig(Config config) {
        this.config = config;
    }

    @Override
    public Optional<String> get(String key) {
        return config.getOptionalValue(key, String.class).map(String::trim).filter(v -> !v.isEmpty());
    }

    @Override
    public String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    @Override
    public Optional<Duration> getDuration(String key) {
        return get(key).map(value -> parseDuration(key, value));
    }

    static Duration parseDuration(String key, String value) {
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid duration for " + key + ": " + value, e);
        }
    }
}
