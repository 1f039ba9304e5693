package aegis.adapter.out.storage.cassandra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import aegis.adapter.out.storage.CacheCallGuard;
import aegis.adapter.out.storage.CacheValueCodec;
import aegis.core.model.common.CacheException;
import aegis.core.port.out.AuthorizationMetrics;

@DisplayName("CassandraCacheStore")
@ExtendWith(MockitoExtension.class)
class CassandraCacheStoreTest {

    @Mock
    private CqlSession session;

    @Mock
    private PreparedStatement selectStmt;

    @Mock
    private PreparedStatement insertStmt;

    @Mock
    private PreparedStatement insertWithTtlStmt;

    @Mock
    private PreparedStatement deleteStmt;

    @Mock
    private AuthorizationMetrics metrics;

    private CassandraCacheStore store;

    @BeforeEach
    void setUp() {
        lenient().when(session.prepare(startsWith("SELECT"))).thenReturn(selectStmt);
        lenient()
                .when(session.prepare(argThat((String q) -> q.startsWith("INSERT") && !q.contains("TTL"))))
                .thenReturn(insertStmt);
        lenient().when(session.prepare(contains("USING TTL"))).thenReturn(insertWithTtlStmt);
        lenient().when(session.prepare(startsWith("DELETE"))).thenReturn(deleteStmt);

        store = new CassandraCacheStore(
                "cassandra",
                session,
                "rbac_cache",
                new CacheCallGuard(Duration.ofMillis(500), metrics, "cassandra"),
                new CacheValueCodec());
    }

    private AsyncResultSet resultWith(String value) {
        final var resultSet = mock(AsyncResultSet.class);
        if (value == null) {
            return resultSet;
        }
        final var row = mock(Row.class);
        when(row.getString("cache_value")).thenReturn(value);
        when(resultSet.one()).thenReturn(row);
        return resultSet;
    }

    @Nested
    @DisplayName("read()")
    class Read {

        @Test
        @DisplayName("should decode the stored value")
        void shouldDecodeStoredValue() {
            final var bound = mock(BoundStatement.class);
            when(selectStmt.bind("legacy")).thenReturn(bound);
            final var resultSet = resultWith("true");
            when(session.executeAsync(bound)).thenReturn(CompletableFuture.completedFuture(resultSet));

            assertEquals(Boolean.TRUE, store.read("legacy").orElseThrow());
        }

        @Test
        @DisplayName("should return empty when no row exists")
        void shouldReturnEmptyWithoutRow() {
            final var bound = mock(BoundStatement.class);
            when(selectStmt.bind("missing")).thenReturn(bound);
            when(session.executeAsync(bound)).thenReturn(CompletableFuture.completedFuture(resultWith(null)));

            assertTrue(store.read("missing").isEmpty());
        }

        @Test
        @DisplayName("should translate driver failures to CacheException")
        void shouldTranslateFailures() {
            final var bound = mock(BoundStatement.class);
            when(selectStmt.bind("permissions")).thenReturn(bound);
            when(session.executeAsync(bound))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("No node was available")));

            final var exception = assertThrows(CacheException.class, () -> store.read("permissions"));

            assertEquals("cassandra", exception.getStore());
            verify(metrics).recordStoreFailure("cassandra", "read");
        }
    }

    @Nested
    @DisplayName("write()")
    class Write {

        @Test
        @DisplayName("should insert with a TTL when an expiry is given")
        void shouldInsertWithTtl() {
            final var bound = mock(BoundStatement.class);
            when(insertWithTtlStmt.bind("user_permissions", "{\"k\":1}", 300)).thenReturn(bound);
            when(session.executeAsync(bound)).thenReturn(CompletableFuture.completedFuture(resultWith(null)));

            store.write("user_permissions", Map.of("k", 1), Duration.ofMinutes(5));

            verify(insertWithTtlStmt).bind("user_permissions", "{\"k\":1}", 300);
        }

        @Test
        @DisplayName("should insert without a TTL otherwise")
        void shouldInsertWithoutTtl() {
            final var bound = mock(BoundStatement.class);
            when(insertStmt.bind("flag", "1")).thenReturn(bound);
            when(session.executeAsync(bound)).thenReturn(CompletableFuture.completedFuture(resultWith(null)));

            store.write("flag", 1);

            verify(insertStmt).bind("flag", "1");
        }

        @Test
        @DisplayName("should cap the TTL at the largest value Cassandra accepts")
        void shouldCapTtl() {
            final var bound = mock(BoundStatement.class);
            when(insertWithTtlStmt.bind("k", "v", CassandraCacheStore.MAX_TTL_SECONDS)).thenReturn(bound);
            when(session.executeAsync(bound)).thenReturn(CompletableFuture.completedFuture(resultWith(null)));

            store.write("k", "v", Duration.ofDays(365L * 30));

            verify(insertWithTtlStmt).bind("k", "v", CassandraCacheStore.MAX_TTL_SECONDS);
            assertEquals(1, CassandraCacheStore.ttlSeconds(Duration.ofMillis(10)));
        }
    }

    @Nested
    @DisplayName("close()")
    class Close {

        @Test
        @DisplayName("should close an open session")
        void shouldCloseOpenSession() {
            when(session.isClosed()).thenReturn(false);

            store.close();

            verify(session).close();
        }

        @Test
        @DisplayName("should leave an already closed session alone")
        void shouldSkipClosedSession() {
            when(session.isClosed()).thenReturn(true);

            store.close();

            verify(session, never()).close();
        }
    }

    @Test
    @DisplayName("clear() should truncate the table")
    void clearShouldTruncate() {
        when(session.executeAsync(any(SimpleStatement.class)))
                .thenReturn(CompletableFuture.completedFuture(resultWith(null)));

        store.clear();

        verify(session).executeAsync(argThat((SimpleStatement s) -> s.getQuery().equals("TRUNCATE rbac_cache")));
    }

    @Test
    @DisplayName("should reject an unsafe table name")
    void shouldRejectUnsafeTableName() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new CassandraCacheStore(
                        "cassandra",
                        session,
                        "rbac; DROP TABLE x",
                        new CacheCallGuard(Duration.ofMillis(500), metrics, "cassandra"),
                        new CacheValueCodec()));
    }
}
