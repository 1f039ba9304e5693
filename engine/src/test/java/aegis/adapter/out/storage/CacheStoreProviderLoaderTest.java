package aegis.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import aegis.adapter.out.storage.memory.InMemoryCacheStore;
import aegis.core.cache.ReadOnlyCacheStore;
import aegis.core.config.RbacConfig;
import aegis.core.model.TrustMode;
import aegis.core.model.common.ConfigurationException;
import aegis.core.port.out.AuthorizationMetrics;
import aegis.core.port.out.CacheStore;
import aegis.core.service.CacheTopology;
import aegis.core.service.NoOpAuthorizationMetrics;
import aegis.mock.MapStorageAdapterConfig;
import aegis.spi.CacheStoreProvider;
import aegis.spi.StorageAdapterConfig;

@DisplayName("CacheStoreProviderLoader")
class CacheStoreProviderLoaderTest {

    private RbacConfig rbacConfig;
    private RbacConfig.StoreConfig snapshotStore;
    private RbacConfig.StoreConfig decisionStore;

    @BeforeEach
    void setUp() {
        rbacConfig = mock(RbacConfig.class);
        snapshotStore = mock(RbacConfig.StoreConfig.class);
        decisionStore = mock(RbacConfig.StoreConfig.class);
        when(rbacConfig.snapshotStore()).thenReturn(snapshotStore);
        when(rbacConfig.decisionStore()).thenReturn(decisionStore);
        when(snapshotStore.provider()).thenReturn(Optional.of("memory"));
        when(decisionStore.provider()).thenReturn(Optional.empty());
    }

    private CacheStoreProviderLoader loader() {
        return new CacheStoreProviderLoader(
                rbacConfig, new MapStorageAdapterConfig(Map.of()), NoOpAuthorizationMetrics.INSTANCE);
    }

    @Nested
    @DisplayName("cacheTopology()")
    class Topology {

        @Test
        @DisplayName("SHARED should use the snapshot store for decisions")
        void sharedShouldReuseSnapshotStore() {
            when(rbacConfig.trustMode()).thenReturn(TrustMode.SHARED);

            final var topology = loader().cacheTopology();

            assertInstanceOf(InMemoryCacheStore.class, topology.snapshotStore());
            assertSame(topology.snapshotStore(), topology.decisionStore().orElseThrow());
        }

        @Test
        @DisplayName("ISOLATED should default the decision store to memory")
        void isolatedShouldDefaultDecisionStore() {
            when(rbacConfig.trustMode()).thenReturn(TrustMode.ISOLATED);

            final var topology = loader().cacheTopology();

            final var snapshot = assertInstanceOf(ReadOnlyCacheStore.class, topology.snapshotStore());
            final var decisions = topology.decisionStore().orElseThrow();
            assertInstanceOf(InMemoryCacheStore.class, decisions);
            assertNotSame(snapshot.delegate(), decisions);
        }

        @Test
        @DisplayName("READ_ONLY should have no decision store")
        void readOnlyShouldHaveNoDecisionStore() {
            when(rbacConfig.trustMode()).thenReturn(TrustMode.READ_ONLY);

            final var topology = loader().cacheTopology();

            assertFalse(topology.writeEnabled());
        }

        @Test
        @DisplayName("should fail for an unknown provider")
        void shouldFailForUnknownProvider() {
            when(rbacConfig.trustMode()).thenReturn(TrustMode.SHARED);
            when(snapshotStore.provider()).thenReturn(Optional.of("etcd"));

            final var exception = assertThrows(ConfigurationException.class, () -> loader().cacheTopology());

            assertTrue(exception.getMessage().contains("etcd"));
        }
    }

    @Nested
    @DisplayName("closeTopology()")
    class CloseTopology {

        @Test
        @DisplayName("should close a shared store once")
        void shouldCloseSharedStoreOnce() {
            final var store = mock(CacheStore.class);

            loader().closeTopology(CacheTopology.shared(store));

            verify(store, times(1)).close();
        }

        @Test
        @DisplayName("should close both isolated stores even when one fails")
        void shouldCloseBothIsolatedStores() {
            final var snapshotStore = mock(CacheStore.class);
            final var decisionStore = mock(CacheStore.class);
            doThrow(new IllegalStateException("already shut down")).when(snapshotStore).close();

            loader().closeTopology(CacheTopology.isolated(snapshotStore, decisionStore));

            verify(snapshotStore).close();
            verify(decisionStore).close();
        }
    }

    @Nested
    @DisplayName("selectProvider()")
    class SelectProvider {

        private final CacheStoreProvider low = new FixedProvider("low", 1, true);
        private final CacheStoreProvider high = new FixedProvider("high", 10, true);
        private final CacheStoreProvider unavailable = new FixedProvider("unavailable", 100, false);

        @Test
        @DisplayName("should pick the highest priority available provider")
        void shouldPickHighestPriority() {
            final var selected = CacheStoreProviderLoader.selectProvider(List.of(low, unavailable, high), null, "p");

            assertSame(high, selected);
        }

        @Test
        @DisplayName("should honour an explicit provider name")
        void shouldHonourExplicitName() {
            assertSame(low, CacheStoreProviderLoader.selectProvider(List.of(low, high), "low", "p"));
        }

        @Test
        @DisplayName("should reject an explicit provider that is not available")
        void shouldRejectUnavailableExplicitProvider() {
            assertThrows(
                    ConfigurationException.class,
                    () -> CacheStoreProviderLoader.selectProvider(List.of(unavailable), "unavailable", "p"));
        }

        @Test
        @DisplayName("should fail when nothing is available")
        void shouldFailWhenNothingAvailable() {
            assertThrows(
                    ConfigurationException.class,
                    () -> CacheStoreProviderLoader.selectProvider(List.of(unavailable), null, "p"));
        }
    }

    private record FixedProvider(String name, int priority, boolean isAvailable) implements CacheStoreProvider {
        @Override
        public CacheStore createStore(StorageAdapterConfig config, String prefix, AuthorizationMetrics metrics) {
            return new InMemoryCacheStore();
        }
    }
}
