package aegis.core.model.common;

/**
 * Thrown when the engine cannot be assembled from its configuration.
 *
 * <p>Raised at construction time only, for example when no snapshot store can be
 * resolved or a trust mode is paired with an incompatible store layout.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
