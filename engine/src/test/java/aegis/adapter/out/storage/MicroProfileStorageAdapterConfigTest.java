package aegis.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import aegis.core.model.common.ConfigurationException;

@DisplayName("MicroProfileStorageAdapterConfig")
class MicroProfileStorageAdapterConfigTest {

    private Config config;
    private MicroProfileStorageAdapterConfig adapterConfig;

    @BeforeEach
    void setUp() {
        config = mock(Config.class);
        when(config.getOptionalValue("missing", String.class)).thenReturn(Optional.empty());
        adapterConfig = new MicroProfileStorageAdapterConfig(config);
    }

    @Test
    @DisplayName("should fall back to the default for unset and blank values")
    void shouldFallBackToDefault() {
        when(config.getOptionalValue("blank", String.class)).thenReturn(Optional.of("  "));

        assertEquals("localhost:11211", adapterConfig.getOrDefault("missing", "localhost:11211"));
        assertEquals("localhost:11211", adapterConfig.getOrDefault("blank", "localhost:11211"));
    }

    @Test
    @DisplayName("should parse ISO-8601 durations")
    void shouldParseDurations() {
        when(config.getOptionalValue("timeout", String.class)).thenReturn(Optional.of("PT2S"));

        assertEquals(Optional.of(Duration.ofSeconds(2)), adapterConfig.getDuration("timeout"));
        assertTrue(adapterConfig.getDuration("missing").isEmpty());
    }

    @Test
    @DisplayName("should name the property when a duration is malformed")
    void shouldRejectMalformedDuration() {
        when(config.getOptionalValue("timeout", String.class)).thenReturn(Optional.of("2 seconds"));

        final var exception = assertThrows(ConfigurationException.class, () -> adapterConfig.getDuration("timeout"));

        assertTrue(exception.getMessage().contains("timeout"));
    }
}
