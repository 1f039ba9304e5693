package aegis.adapter.out.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Text encoding of cache values shared by every backend.
 *
 * <p>Strings, numbers and booleans are stored as their plain text; maps, lists and other
 * structured values as JSON. Reading parses the text as JSON and falls back to the raw
 * string when it is not JSON, so values written by other clients in either form read
 * back sensibly.
 */
public final class CacheValueCodec {

    private final ObjectMapper objectMapper;

    public CacheValueCodec() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public CacheValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Encode a value for storage.
     *
     * @param value the value (must not be null)
     * @return the stored text
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public String encode(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Cache value cannot be null");
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Cannot serialize cache value of type " + value.getClass().getName(), e);
        }
    }

    /**
     * Decode stored text.
     *
     * @param text the stored text (may be null)
     * @return the parsed JSON value, the raw text when it is not JSON, or null for null
     */
    public Object decode(String text) {
        if (text == null) {
            return null;
        }
        try {
            final var parsed = objectMapper.readValue(text, Object.class);
            return parsed == null ? text : parsed;
        } catch (JsonProcessingException e) {
            return text;
        }
    }
}
