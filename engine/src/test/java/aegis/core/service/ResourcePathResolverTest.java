package aegis.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.regex.Pattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ResourcePathResolver")
class ResourcePathResolverTest {

    private final ResourcePathResolver resolver = new ResourcePathResolver();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "/api/v1/acme/sales/invoices, sales/invoices",
        "/api/v1/acme/sales/invoices/42, sales/invoices/42",
        "/api/v2/sales/invoices, sales/invoices",
        "/api/sales/invoices, sales/invoices",
        "/sales/invoices, sales/invoices",
        "sales/invoices, sales/invoices",
    })
    @DisplayName("should strip slug and API prefixes")
    void shouldStripPrefixes(String path, String expected) {
        assertEquals(expected, resolver.resolve(path));
    }

    @Test
    @DisplayName("should return empty for null or empty paths")
    void shouldHandleEmptyPath() {
        assertEquals("", resolver.resolve(null));
        assertEquals("", resolver.resolve(""));
    }

    @Test
    @DisplayName("should honour a custom slug pattern")
    void shouldHonourCustomSlugPattern() {
        final var custom = new ResourcePathResolver(Pattern.compile("^/tenants/([^/]+)/"));

        assertEquals("sales/invoices", custom.resolve("/tenants/acme/sales/invoices"));
        assertEquals("sales", custom.resolve("/api/v1/sales"));
    }
}
