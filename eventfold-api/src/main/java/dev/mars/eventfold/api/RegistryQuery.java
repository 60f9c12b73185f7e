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

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Predicate over registry records, passed by value to the {@link EventRegistry}.
 *
 * A query always targets one entity instance and one record kind. The optional
 * {@code createdAfter} bound is exclusive: a record whose {@code createdAt} equals the
 * bound does not match.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class RegistryQuery {

    private final String entityTypeName;
    private final String entityID;
    private final EnvelopeKind kind;
    private final Instant createdAfter;

    private RegistryQuery(Builder builder) {
        this.entityTypeName = Objects.requireNonNull(builder.entityTypeName, "Entity type name cannot be null");
        this.entityID = Objects.requireNonNull(builder.entityID, "Entity ID cannot be null");
        this.kind = Objects.requireNonNull(builder.kind, "Kind cannot be null");
        this.createdAfter = builder.createdAfter;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a query for the events of an entity created strictly after the given time.
     *
     * @param entityTypeName The entity kind
     * @param entityID The entity instance identifier
     * @param createdAfter The exclusive lower bound
     * @return A new query
     */
    public static RegistryQuery eventsCreatedAfter(String entityTypeName, String entityID, Instant createdAfter) {
        return builder()
            .entityTypeName(entityTypeName)
            .entityID(entityID)
            .kind(EnvelopeKind.EVENT)
            .createdAfter(Objects.requireNonNull(createdAfter, "Lower bound cannot be null"))
            .build();
    }

    /**
     * Creates a query for the snapshots of an entity.
     *
     * @param entityTypeName The entity kind
     * @param entityID The entity instance identifier
     * @return A new query
     */
    public static RegistryQuery snapshotsOf(String entityTypeName, String entityID) {
        return builder()
            .entityTypeName(entityTypeName)
            .entityID(entityID)
            .kind(EnvelopeKind.SNAPSHOT)
            .build();
    }

    /**
     * Tests a record against this predicate.
     *
     * @param envelope The record to test
     * @return true if identity, kind and lower bound all match
     */
    public boolean matches(Envelope envelope) {
        return kind == envelope.kind()
            && entityTypeName.equals(envelope.entityTypeName())
            && entityID.equals(envelope.entityID())
            && (createdAfter == null || envelope.createdAt().isAfter(createdAfter));
    }

    // Getters
    public String getEntityTypeName() { return entityTypeName; }
    public String getEntityID() { return entityID; }
    public EnvelopeKind getKind() { return kind; }
    public Optional<Instant> getCreatedAfter() { return Optional.ofNullable(createdAfter); }

    /**
     * Builder for RegistryQuery.
     */
    public static class Builder {
        private String entityTypeName;
        private String entityID;
        private EnvelopeKind kind = EnvelopeKind.EVENT;
        private Instant createdAfter;

        public Builder entityTypeName(String entityTypeName) {
            this.entityTypeName = entityTypeName;
            return this;
        }

        public Builder entityID(String entityID) {
            this.entityID = entityID;
            return this;
        }

        public Builder kind(EnvelopeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder createdAfter(Instant createdAfter) {
            this.createdAfter = createdAfter;
            return this;
        }

        public RegistryQuery build() {
            return new RegistryQuery(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RegistryQuery that = (RegistryQuery) o;
        return Objects.equals(entityTypeName, that.entityTypeName) &&
               Objects.equals(entityID, that.entityID) &&
               kind == that.kind &&
               Objects.equals(createdAfter, that.createdAfter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityTypeName, entityID, kind, createdAfter);
    }

    @Override
    public String toString() {
        return "RegistryQuery{" +
                "entityTypeName='" + entityTypeName + '\'' +
                ", entityID='" + entityID + '\'' +
                ", kind=" + kind +
                ", createdAfter=" + createdAfter +
                '}';
    }
}
