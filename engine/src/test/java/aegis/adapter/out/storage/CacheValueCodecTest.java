package aegis.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CacheValueCodec")
class CacheValueCodecTest {

    private final CacheValueCodec codec = new CacheValueCodec();

    @Nested
    @DisplayName("encode()")
    class Encode {

        @Test
        @DisplayName("should store scalars as plain text")
        void shouldStoreScalarsAsText() {
            assertEquals("hello", codec.encode("hello"));
            assertEquals("42", codec.encode(42));
            assertEquals("true", codec.encode(true));
        }

        @Test
        @DisplayName("should store maps and lists as JSON")
        void shouldStoreStructuresAsJson() {
            assertEquals("{\"a\":[1,2]}", codec.encode(Map.of("a", List.of(1, 2))));
        }

        @Test
        @DisplayName("should reject null")
        void shouldRejectNull() {
            assertThrows(IllegalArgumentException.class, () -> codec.encode(null));
        }
    }

    @Nested
    @DisplayName("decode()")
    class Decode {

        @Test
        @DisplayName("should parse JSON text")
        void shouldParseJson() {
            assertEquals(Map.of("last_update", 5), codec.decode("{\"last_update\":5}"));
            assertEquals(List.of("GET"), codec.decode("[\"GET\"]"));
            assertEquals(Boolean.TRUE, codec.decode("true"));
            assertEquals(7, codec.decode("7"));
        }

        @Test
        @DisplayName("should fall back to the raw string for non-JSON text")
        void shouldFallBackToRawString() {
            assertEquals("hello world", codec.decode("hello world"));
            assertEquals("{broken", codec.decode("{broken"));
            assertEquals("true false", codec.decode("true false"));
        }

        @Test
        @DisplayName("should keep the text null when the JSON is null")
        void shouldHandleNull() {
            assertNull(codec.decode(null));
            assertEquals("null", codec.decode("null"));
        }
    }
}
