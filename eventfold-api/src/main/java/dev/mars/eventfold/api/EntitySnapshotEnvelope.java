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

import java.time.Instant;
import java.util.Objects;

/**
 * Materialized entity state at a position of its event stream.
 *
 * A snapshot is a replaceable cache entry. Replaying from the beginning of time must give
 * the same state whether or not a snapshot exists; the snapshot only shortens the replay.
 *
 * @param entityTypeName The entity kind
 * @param entityID The entity instance identifier
 * @param typeName The type of the folded state, normally the entity type name
 * @param value The folded entity state
 * @param createdAt When the fold was performed
 * @param version The stream position of the last event folded in
 * @param snapshottedEventCreatedAt The creation time of the last event folded in
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public record EntitySnapshotEnvelope(
    String entityTypeName,
    String entityID,
    String typeName,
    JsonNode value,
    Instant createdAt,
    long version,
    Instant snapshottedEventCreatedAt
) implements PersistableEnvelope {

    public EntitySnapshotEnvelope {
        Objects.requireNonNull(entityTypeName, "Entity type name cannot be null");
        Objects.requireNonNull(entityID, "Entity ID cannot be null");
        Objects.requireNonNull(typeName, "Type name cannot be null");
        Objects.requireNonNull(value, "Snapshot value cannot be null");
        Objects.requireNonNull(createdAt, "Created at cannot be null");
        Objects.requireNonNull(snapshottedEventCreatedAt, "Snapshotted event created at cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("Version must be positive, was " + version);
        }
    }

    @Override
    public EnvelopeKind kind() {
        return EnvelopeKind.SNAPSHOT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link EntitySnapshotEnvelope}. The type name defaults to the entity type name.
     */
    public static class Builder {
        private String entityTypeName;
        private String entityID;
        private String typeName;
        private JsonNode value;
        private Instant createdAt;
        private long version;
        private Instant snapshottedEventCreatedAt;

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

        public Builder snapshottedEventCreatedAt(Instant snapshottedEventCreatedAt) {
            this.snapshottedEventCreatedAt = snapshottedEventCreatedAt;
            return this;
        }

        public EntitySnapshotEnvelope build() {
            return new EntitySnapshotEnvelope(entityTypeName, entityID,
                typeName != null ? typeName : entityTypeName,
                value, createdAt, version, snapshottedEventCreatedAt);
        }
    }
}
