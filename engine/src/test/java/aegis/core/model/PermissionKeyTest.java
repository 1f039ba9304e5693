package aegis.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PermissionKey")
class PermissionKeyTest {

    @Nested
    @DisplayName("serialize()")
    class Serialize {

        @Test
        @DisplayName("should join subject, host, path and lower-cased method")
        void shouldJoinComponents() {
            final var key = PermissionKey.of(42, "acme.example.com", "/api/v1/acme/sales/invoices", "GET");

            assertEquals("42:acme.example.com/api/v1/acme/sales/invoices:get", key.serialize());
        }

        @Test
        @DisplayName("should default missing host to localhost")
        void shouldDefaultHost() {
            final var key = PermissionKey.of("u1", null, "/reports", "post");

            assertEquals("u1:localhost/reports:post", key.serialize());
        }

        @Test
        @DisplayName("should produce the same key for GET and get")
        void shouldIgnoreMethodCase() {
            final var upper = PermissionKey.of("u1", "h", "/p", "GET");
            final var lower = PermissionKey.of("u1", "h", "/p", "get");

            assertEquals(upper, lower);
            assertEquals(upper.serialize(), lower.serialize());
        }

        @Test
        @DisplayName("should keep path verbatim")
        void shouldKeepPathVerbatim() {
            final var key = PermissionKey.of("u1", "h", "/API/V1/Acme/Sales?x=1", "get");

            assertEquals("/API/V1/Acme/Sales?x=1", key.path());
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject null subject")
        void shouldRejectNullSubject() {
            assertThrows(IllegalArgumentException.class, () -> PermissionKey.of(null, "h", "/p", "get"));
        }

        @Test
        @DisplayName("should reject blank method")
        void shouldRejectBlankMethod() {
            assertThrows(IllegalArgumentException.class, () -> PermissionKey.of("u1", "h", "/p", " "));
        }
    }
}
