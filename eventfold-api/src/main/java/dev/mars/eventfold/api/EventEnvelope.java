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
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted domain event: one fact about one entity instance at one point in time.
 *
 * Stored events are never mutated or reordered. For a given entity the registry returns
 * them ordered by {@code createdAt}, ties broken by {@code version}.
 *
 * @param entityTypeName The entity kind
 * @param entityID The entity instance identifier
 * @param typeName The domain event type
 * @param value The event payload
 * @param createdAt When the event was produced
 * @param version The stream position of this event
 * @param requestID Identifier of the originating request (can be null)
 * @param metadata Correlation metadata
 * @param persistedAt When the event was durably written
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public record EventEnvelope(
    String entityTypeName,
    String entityID,
    String typeName,
    JsonNode value,
    Instant createdAt,
    long version,
    String requestID,
    Map<String, String> metadata,
    Instant persistedAt
) implements PersistableEnvelope {

    public EventEnvelope {
        Objects.requireNonNull(entityTypeName, "Entity type name cannot be null");
        Objects.requireNonNull(entityID, "Entity ID cannot be null");
        Objects.requireNonNull(typeName, "Type name cannot be null");
        Objects.requireNonNull(createdAt, "Created at cannot be null");
        Objects.requireNonNull(persistedAt, "Persisted at cannot be null");
        value = value != null ? value : NullNode.getInstance();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        if (version < 1) {
            throw new IllegalArgumentException("Version must be positive, was " + version);
        }
    }

    @Override
    public EnvelopeKind kind() {
        return EnvelopeKind.EVENT;
    }
}
