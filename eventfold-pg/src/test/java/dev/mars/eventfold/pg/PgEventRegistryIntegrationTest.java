package dev.mars.eventfold.pg;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.eventfold.api.EntitySnapshotEnvelope;
import dev.mars.eventfold.api.EnvelopeKind;
import dev.mars.eventfold.api.EventEnvelope;
import dev.mars.eventfold.api.NonPersistedEventEnvelope;
import dev.mars.eventfold.api.RegistryQuery;
import dev.mars.eventfold.api.error.ErrorKind;
import dev.mars.eventfold.api.error.EventStoreException;
import dev.mars.eventfold.api.error.UnexpectedVersionException;
import dev.mars.eventfold.core.DefaultEntityEventStore;
import dev.mars.eventfold.core.retry.ConflictRetryPolicy;
import dev.mars.eventfold.core.retry.RetryConfig;
import dev.mars.eventfold.test.categories.TestCategories;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the event registry contract against a real PostgreSQL. Skipped when Docker is not available.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("PostgreSQL Event Registry Integration Tests")
class PgEventRegistryIntegrationTest {
    private static final Logger logger = LoggerFactory.getLogger(PgEventRegistryIntegrationTest.class);

    private static final Instant T0 = Instant.parse("2025-11-03T10:00:00Z");
    private static final AtomicInteger TABLE_COUNTER = new AtomicInteger();

    @Container
    static PostgreSQLContainer<?> postgres = PostgreSQLTestConstants.createStandardContainer();

    private static Vertx vertx;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PgEventRegistry registry;

    @BeforeAll
    static void startVertx() {
        vertx = Vertx.vertx();
    }

    @AfterAll
    static void stopVertx() {
        vertx.close().toCompletionStage().toCompletableFuture().join();
    }

    private static PgRegistryConfig configFor(String tableName) {
        return PgRegistryConfig.builder()
            .host(postgres.getHost())
            .port(postgres.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT))
            .database(postgres.getDatabaseName())
            .username(postgres.getUsername())
            .password(postgres.getPassword())
            .poolSize(4)
            .tableName(tableName)
            .build();
    }

    @BeforeEach
    void setUp() {
        registry = new PgEventRegistry(vertx, configFor("envelopes_" + TABLE_COUNTER.incrementAndGet()));
        registry.initializeSchema().join();
        logger.info("Using table {}", registry.getTableName());
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private EventEnvelope event(String entityID, long version, Instant createdAt) {
        ObjectNode value = objectMapper.createObjectNode().put("step", (int) version);
        value.putArray("tags").add("a").add("b");
        return new EventEnvelope("Order", entityID, "OrderStep", value, createdAt, version,
            "req-" + version, Map.of("traceId", "t-" + version), createdAt.plusMillis(250));
    }

    private EntitySnapshotEnvelope snapshot(long version, Instant createdAt) {
        return new EntitySnapshotEnvelope("Order", "order-1", "Order",
            objectMapper.createObjectNode().put("version", (int) version), createdAt, version, createdAt.minusSeconds(1));
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        return assertThrows(CompletionException.class, future::join).getCause();
    }

    @Test
    @DisplayName("Should round-trip events and honour the exclusive lower bound and ordering")
    void testStoreAndQuery() {
        EventEnvelope e1 = event("order-1", 1, T0.plusSeconds(1));
        EventEnvelope e2 = event("order-1", 2, T0.plusSeconds(3));
        EventEnvelope e3 = event("order-1", 3, T0.plusSeconds(2));
        registry.store(e1).join();
        registry.store(e2).join();
        registry.store(e3).join();
        registry.store(event("order-2", 1, T0.plusSeconds(1))).join();

        List<EventEnvelope> all = registry.query(RegistryQuery.eventsCreatedAfter("Order", "order-1", Instant.EPOCH)).join();
        List<EventEnvelope> afterFirst = registry.query(
            RegistryQuery.eventsCreatedAfter("Order", "order-1", T0.plusSeconds(1))).join();

        assertEquals(List.of(e1, e3, e2), all);
        assertEquals(List.of(3L, 2L), afterFirst.stream().map(EventEnvelope::version).collect(Collectors.toList()));
        assertTrue(registry.query(RegistryQuery.snapshotsOf("Order", "order-1")).join().isEmpty());
    }

    @Test
    @DisplayName("Should reject events at or below the stored version")
    void testEventConflicts() {
        registry.store(event("order-1", 2, T0)).join();

        Throwable duplicate = failureOf(registry.store(event("order-1", 2, T0.plusSeconds(1))));
        Throwable stale = failureOf(registry.store(event("order-1", 1, T0.plusSeconds(1))));

        assertInstanceOf(UnexpectedVersionException.class, duplicate);
        assertEquals(ErrorKind.CONFLICT, ((EventStoreException) stale).kind());
        registry.store(event("order-1", 3, T0.plusSeconds(1))).join();
        assertEquals(2, registry.query(RegistryQuery.eventsCreatedAfter("Order", "order-1", Instant.EPOCH)).join().size());
    }

    @Test
    @DisplayName("Should return the latest snapshot, and none for an unknown entity")
    void testLatestSnapshot() {
        RegistryQuery query = RegistryQuery.snapshotsOf("Order", "order-1");
        assertEquals(Optional.empty(), registry.queryLatestSnapshot(query).join());

        registry.store(snapshot(1, T0.plusSeconds(10))).join();
        EntitySnapshotEnvelope latest = snapshot(3, T0.plusSeconds(5));
        registry.store(latest).join();

        assertEquals(Optional.of(latest), registry.queryLatestSnapshot(query).join());
        assertEquals(registry.queryLatestSnapshot(query).join(), registry.queryLatestSnapshot(query).join());
        assertEquals(EnvelopeKind.SNAPSHOT,
            ((UnexpectedVersionException) failureOf(registry.store(snapshot(2, T0.plusSeconds(20))))).getEnvelopeKind());
    }

    @Test
    @DisplayName("Should let exactly one of many concurrent writers store a version")
    void testConcurrentWriters() {
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            writes.add(registry.store(event("order-1", 1, T0.plusMillis(i))));
        }

        int conflicts = 0;
        for (CompletableFuture<Void> write : writes) {
            try {
                write.join();
            } catch (CompletionException e) {
                assertInstanceOf(UnexpectedVersionException.class, e.getCause());
                conflicts++;
            }
        }

        assertEquals(11, conflicts);
        assertEquals(1, registry.query(RegistryQuery.eventsCreatedAfter("Order", "order-1", Instant.EPOCH)).join().size());
    }

    @Test
    @DisplayName("Should store, dispatch and read back a batch through the event store")
    void testEventStoreOnPostgres() {
        List<List<NonPersistedEventEnvelope>> dispatched = new CopyOnWriteArrayList<>();
        try (ConflictRetryPolicy retryPolicy = new ConflictRetryPolicy(RetryConfig.testingConfig(3))) {
            DefaultEntityEventStore store = new DefaultEntityEventStore(registry, retryPolicy);
            NonPersistedEventEnvelope e1 = NonPersistedEventEnvelope.builder()
                .entityTypeName("Order").entityID("order-1").typeName("OrderPlaced")
                .value(objectMapper.createObjectNode().put("amount", 10))
                .createdAt(T0.plusSeconds(1)).version(1).build();
            NonPersistedEventEnvelope e2 = NonPersistedEventEnvelope.builder()
                .entityTypeName("Order").entityID("order-1").typeName("OrderShipped")
                .createdAt(T0.plusSeconds(2)).version(2).build();

            assertTrue(store.readEntityEventsSince("Order", "order-1").join().isEmpty());
            store.storeEvents(List.of(e1, e2), batch -> {
                dispatched.add(batch);
                return CompletableFuture.completedFuture(null);
            }).join();

            List<EventEnvelope> sinceT1 = store.readEntityEventsSince("Order", "order-1", T0.plusSeconds(1)).join();
            assertEquals(1, sinceT1.size());
            assertEquals("OrderShipped", sinceT1.get(0).typeName());
            assertTrue(sinceT1.get(0).value().isNull());
            assertEquals(List.of(List.of(e1, e2)), dispatched);

            Throwable failure = failureOf(store.storeEvents(List.of(e2), batch -> CompletableFuture.completedFuture(null)));
            assertInstanceOf(UnexpectedVersionException.class, failure);
        }
    }

    @Test
    @DisplayName("Should run a registry on a Vert.x instance of its own")
    void testStandaloneRegistry() {
        EventEnvelope e1 = event("order-9", 1, T0.plusSeconds(1));
        try (PgEventRegistry standalone = PgEventRegistry.create(configFor("standalone_envelopes"))) {
            standalone.initializeSchema().join();
            standalone.store(e1).join();

            assertEquals(List.of(e1),
                standalone.query(RegistryQuery.eventsCreatedAfter("Order", "order-9", Instant.EPOCH)).join());
        }
        assertTrue(registry.query(RegistryQuery.eventsCreatedAfter("Order", "order-9", Instant.EPOCH)).join().isEmpty());
    }
}
