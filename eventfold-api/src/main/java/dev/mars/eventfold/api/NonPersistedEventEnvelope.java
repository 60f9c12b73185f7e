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
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A domain event that has not been durably stored yet.
 *
 * It turns into an {@link EventEnvelope} exactly once, when the store operation assigns
 * the persistence timestamp through {@link #persistedAt(Instant)}. This is also the form
 * handed to the dispatcher after a batch has been stored.
 *
 * @param entityTypeName The entity kind, e.g. "Order"
 * @param entityID The entity instance identifier
 * @param typeName The domain event type, e.g. "OrderPlaced"
 * @param value The event payload
 * @param createdAt When the event was produced
 * @param version The expected stream position of this event, starting at 1
 * @param requestID Identifier of the originating request (can be null)
 * @param metadata Correlation metadata passed through unchanged
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public record NonPersistedEventEnvelope(
    String entityTypeName,
    String entityID,
    String typeName,
    JsonNode value,
    Instant createdAt,
    long version,
    String requestID,
    Map<String, String> metadata
) implements Envelope {

    public NonPersistedEventEnvelope {
        Objects.requireNonNull(entityTypeName, "Entity type name cannot be null");
        Objects.requireNonNull(entityID, "Entity ID cannot be null");
        Objects.requireNonNull(typeName, "Type name cannot be null");
        Objects.requireNonNull(createdAt, "Created at cannot be null");
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

    /**
     * Stamps this event with its persistence time.
     *
     * @param persistedAt The moment of the durable write
     * @return The persistable form of this event
     */
    public EventEnvelope persistedAt(Instant persistedAt) {
        return new EventEnvelope(entityTypeName, entityID, typeName, value, createdAt, version,
            requestID, metadata, persistedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link NonPersistedEventEnvelope}.
     */
    public static class Builder {
        private String entityTypeName;
        private String entityID;
        private String typeName;
        private JsonNode value;
        private Instant createdAt;
        private long version;
        private String requestID;
        private final Map<String, String> metadata = new HashMap<>();

        public Builder entityTypeName(String entityTypeName) {
            this.entityTypeName = entityTypeName;
            return this;
        }

        public Builder entityID(String entityID) {
            this.entityID = entityID;
            return this;
        }

        public Builder typeName(String typeName) {
            this.typeName = typeName;
            return this;
        }

        public Builder value(JsonNode value) {
            this.value = value;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder requestID(String requestID) {
            this.requestID = requestID;
            return this;
        }

        public Builder metadata(String key, String value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata.putAll(metadata);
            return this;
        }

        public NonPersistedEventEnvelope build() {
            return new NonPersistedEventEnvelope(entityTypeName, entityID, typeName, value, createdAt,
                version, requestID, metadata);
        }
    }
}
