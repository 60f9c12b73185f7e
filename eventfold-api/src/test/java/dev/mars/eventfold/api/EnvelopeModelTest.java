package dev.mars.eventfold.api;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.mars.eventfold.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Envelope Model Tests")
class EnvelopeModelTest {

    private static final Instant CREATED = Instant.parse("2025-11-03T10:15:30Z");

    private NonPersistedEventEnvelope.Builder orderPlaced() {
        JsonNode value = JsonNodeFactory.instance.objectNode().put("amount", 42);
        return NonPersistedEventEnvelope.builder()
            .entityTypeName("Order")
            .entityID("order-1")
            .typeName("OrderPlaced")
            .value(value)
            .createdAt(CREATED)
            .version(1)
            .requestID("req-7");
    }

    @Test
    @DisplayName("Should carry the event kind and identity fields")
    void testNonPersistedEnvelopeFields() {
        NonPersistedEventEnvelope envelope = orderPlaced().metadata("traceId", "t-1").build();

        assertEquals(EnvelopeKind.EVENT, envelope.kind());
        assertEquals("Order", envelope.entityTypeName());
        assertEquals("order-1", envelope.entityID());
        assertEquals("OrderPlaced", envelope.typeName());
        assertEquals(42, envelope.value().get("amount").asInt());
        assertEquals(CREATED, envelope.createdAt());
        assertEquals(1L, envelope.version());
        assertEquals("req-7", envelope.requestID());
        assertEquals(Map.of("traceId", "t-1"), envelope.metadata());
    }

    @Test
    @DisplayName("Should become a persisted envelope with identical content when stamped")
    void testPersistedAtTransition() {
        NonPersistedEventEnvelope envelope = orderPlaced().build();
        Instant persistedAt = CREATED.plusMillis(5);

        EventEnvelope persisted = envelope.persistedAt(persistedAt);

        assertEquals(EnvelopeKind.EVENT, persisted.kind());
        assertEquals(persistedAt, persisted.persistedAt());
        assertEquals(envelope.entityTypeName(), persisted.entityTypeName());
        assertEquals(envelope.entityID(), persisted.entityID());
        assertEquals(envelope.typeName(), persisted.typeName());
        assertEquals(envelope.value(), persisted.value());
        assertEquals(envelope.createdAt(), persisted.createdAt());
        assertEquals(envelope.version(), persisted.version());
        assertEquals(envelope.requestID(), persisted.requestID());
        assertEquals(envelope.metadata(), persisted.metadata());
        assertInstanceOf(PersistableEnvelope.class, persisted);
    }

    @Test
    @DisplayName("Should reject missing identity and non-positive versions")
    void testValidation() {
        assertThrows(NullPointerException.class, () -> orderPlaced().entityID(null).build());
        assertThrows(NullPointerException.class, () -> orderPlaced().entityTypeName(null).build());
        assertThrows(NullPointerException.class, () -> orderPlaced().createdAt(null).build());
        assertThrows(IllegalArgumentException.class, () -> orderPlaced().version(0).build());
        assertThrows(NullPointerException.class, () -> orderPlaced().build().persistedAt(null));
    }

    @Test
    @DisplayName("Should default a missing payload to JSON null and copy metadata defensively")
    void testDefaultsAndDefensiveCopy() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("tenant", "acme");
        NonPersistedEventEnvelope envelope = new NonPersistedEventEnvelope(
            "Order", "order-1", "OrderPlaced", null, CREATED, 1, null, metadata);

        metadata.put("tenant", "other");

        assertEquals(NullNode.getInstance(), envelope.value());
        assertEquals("acme", envelope.metadata().get("tenant"));
        assertThrows(UnsupportedOperationException.class, () -> envelope.metadata().put("x", "y"));
    }

    @Test
    @DisplayName("Should build snapshots with the snapshot kind and default type name")
    void testSnapshotEnvelope() {
        EntitySnapshotEnvelope snapshot = EntitySnapshotEnvelope.builder()
            .entityTypeName("Order")
            .entityID("order-1")
            .value(JsonNodeFactory.instance.objectNode().put("status", "PLACED"))
            .createdAt(CREATED.plusSeconds(1))
            .version(3)
            .snapshottedEventCreatedAt(CREATED)
            .build();

        assertEquals(EnvelopeKind.SNAPSHOT, snapshot.kind());
        assertEquals("Order", snapshot.typeName());
        assertEquals(3L, snapshot.version());
        assertEquals(CREATED, snapshot.snapshottedEventCreatedAt());
    }

    @Test
    @DisplayName("Should map envelope kinds to and from their stored values")
    void testEnvelopeKindValues() {
        assertEquals("event", EnvelopeKind.EVENT.value());
        assertEquals("snapshot", EnvelopeKind.SNAPSHOT.value());
        assertEquals(EnvelopeKind.SNAPSHOT, EnvelopeKind.fromValue("snapshot"));
        assertThrows(IllegalArgumentException.class, () -> EnvelopeKind.fromValue("command"));
    }
}
