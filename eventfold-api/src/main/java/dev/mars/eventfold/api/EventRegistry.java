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

import dev.mars.eventfold.api.error.RegistryException;
import dev.mars.eventfold.api.error.UnexpectedVersionException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Durable storage capability the event store depends on.
 *
 * Implementations own the records they store. Failures are reported by completing the
 * returned future exceptionally:
 * <ul>
 *   <li>{@link UnexpectedVersionException} when a concurrent writer already advanced the
 *       entity stream to or past the version of the record being stored</li>
 *   <li>{@link RegistryException} for every other storage failure</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public interface EventRegistry {

    /**
     * Queries the events matching the given predicate.
     *
     * The result is materialized, ordered ascending by {@code createdAt} then {@code version},
     * and empty when nothing matches.
     *
     * @param query The predicate; its kind must be {@link EnvelopeKind#EVENT}
     * @return A CompletableFuture that completes with the matching events
     */
    CompletableFuture<List<EventEnvelope>> query(RegistryQuery query);

    /**
     * Finds the most recent snapshot of an entity: highest version, then latest creation time.
     *
     * @param query The predicate; its kind must be {@link EnvelopeKind#SNAPSHOT}
     * @return A CompletableFuture that completes with the snapshot, or empty if none exists
     */
    CompletableFuture<Optional<EntitySnapshotEnvelope>> queryLatestSnapshot(RegistryQuery query);

    /**
     * Persists exactly one record.
     *
     * The version check and the write are atomic: the store is rejected with
     * {@link UnexpectedVersionException} if a record of the same kind and entity already has
     * a version greater than or equal to the one being stored.
     *
     * @param record The event or snapshot to store
     * @return A CompletableFuture that completes when the record is durable
     */
    CompletableFuture<Void> store(PersistableEnvelope record);
}
