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
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for the entity event store.
 *
 * The EntityEventStore provides:
 * - Append-only event streams per entity instance, written one event at a time
 * - Optimistic concurrency: conflicting writes are detected by the registry and retried
 *   a bounded number of times
 * - Snapshot lookup to shorten replay
 * - Dispatch of every stored batch to downstream handlers
 *
 * Implementations are stateless between calls. All failures are reported by completing the
 * returned future exceptionally with the original exception, so callers can tell a
 * version conflict from a storage failure from a dispatch failure by its
 * {@link dev.mars.eventfold.api.error.ErrorKind}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface EntityEventStore {

    /**
     * Reads the events of an entity created strictly after {@code since}.
     *
     * @param entityTypeName The entity kind
     * @param entityID The entity instance identifier
     * @param since Exclusive lower bound, or null to read from the beginning of time
     * @return A CompletableFuture that completes with the events in stream order
     */
    CompletableFuture<List<EventEnvelope>> readEntityEventsSince(String entityTypeName, String entityID,
                                                                 Instant since);

    /**
     * Reads every event of an entity.
     *
     * @param entityTypeName The entity kind
     * @param entityID The entity instance identifier
     * @return A CompletableFuture that completes with the events in stream order
     */
    default CompletableFuture<List<EventEnvelope>> readEntityEventsSince(String entityTypeName, String entityID) {
        return readEntityEventsSince(entityTypeName, entityID, null);
    }

    /**
     * Reads the latest snapshot of an entity.
     *
     * An empty result means the caller must replay from the beginning of time.
     *
     * @param entityTypeName The entity kind
     * @param entityID The entity instance identifier
     * @return A CompletableFuture that completes with the snapshot, or empty if none exists
     */
    CompletableFuture<Optional<EntitySnapshotEnvelope>> readEntityLatestSnapshot(String entityTypeName,
                                                                                 String entityID);

    /**
     * Stores a batch of events sequentially and dispatches the batch once all are stored.
     *
     * Events stored before a failing one stay stored; events after it are not attempted.
     *
     * @param eventEnvelopes The events to store, in order
     * @param dispatcher The sink receiving the batch after it has been stored
     * @return A CompletableFuture that completes when the batch is stored and dispatched
     */
    CompletableFuture<Void> storeEvents(List<NonPersistedEventEnvelope> eventEnvelopes, EventDispatcher dispatcher);

    /**
     * Stores a snapshot. Snapshots are not dispatched.
     *
     * @param snapshotEnvelope The snapshot to store
     * @return A CompletableFuture that completes when the snapshot is stored
     */
    CompletableFuture<Void> storeSnapshot(EntitySnapshotEnvelope snapshotEnvelope);
}
