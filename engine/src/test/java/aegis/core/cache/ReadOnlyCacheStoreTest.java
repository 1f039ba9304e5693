package aegis.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import aegis.adapter.out.storage.memory.InMemoryCacheStore;

@DisplayName("ReadOnlyCacheStore")
class ReadOnlyCacheStoreTest {

    private InMemoryCacheStore delegate;
    private ReadOnlyCacheStore store;

    @BeforeEach
    void setUp() {
        delegate = new InMemoryCacheStore();
        delegate.write("permissions", "value");
        store = new ReadOnlyCacheStore(delegate);
    }

    @Test
    @DisplayName("should delegate reads")
    void shouldDelegateReads() {
        assertEquals("value", store.read("permissions").orElseThrow());
        assertTrue(store.exists("permissions"));
        assertEquals(delegate.name(), store.name());
    }

    @Test
    @DisplayName("should reject every mutation")
    void shouldRejectMutations() {
        assertThrows(UnsupportedOperationException.class, () -> store.write("k", "v"));
        assertThrows(UnsupportedOperationException.class, () -> store.delete("permissions"));
        assertThrows(UnsupportedOperationException.class, store::clear);
        assertTrue(delegate.exists("permissions"));
    }
}
