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

/**
 * Common shape of every record exchanged with the event registry.
 *
 * Implemented by {@link NonPersistedEventEnvelope}, {@link EventEnvelope} and
 * {@link EntitySnapshotEnvelope}. The kind is fixed by the implementing type.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface Envelope {

    /**
     * @return The discriminator of this record
     */
    EnvelopeKind kind();

    /**
     * @return The name of the entity kind this record belongs to
     */
    String entityTypeName();

    /**
     * @return The identifier of the entity instance
     */
    String entityID();

    /**
     * @return The event type name, or the entity type name for snapshots
     */
    String typeName();

    /**
     * @return The opaque JSON payload
     */
    JsonNode value();

    /**
     * @return When the record was created
     */
    Instant createdAt();

    /**
     * @return The stream position of the record, starting at 1
     */
    long version();
}
