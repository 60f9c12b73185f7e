package dev.mars.eventfold.core.replay;

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
import dev.mars.eventfold.api.EntityEventStore;
import dev.mars.eventfold.api.EntitySnapshotEnvelope;
import dev.mars.eventfold.api.EventEnvelope;
import dev.mars.eventfold.core.config.EventFoldConfiguration;
import dev.mars.eventfold.core.util.CompletionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Rebuilds entity state from the latest snapshot and the events stored after it.
 *
 * Events are read from just before the snapshotted event's creation time and only those with a
 * version above the snapshot's are folded, so events created at the same instant as the
 * snapshotted one are not lost.
 *
 * When events had to be folded and snapshotting is enabled, a fresh snapshot is stored so
 * the next reconstitution starts from there. Snapshots are a cache: failing to store one is
 * logged and does not fail the reconstitution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class EntityReconstituter {
    private static final Logger logger = LoggerFactory.getLogger(EntityReconstituter.class);

    private final EntityEventStore eventStore;
    private final boolean snapshotEnabled;
    private final Clock clock;

    public EntityReconstituter(EntityEventStore eventStore, EventFoldConfiguration configuration) {
        this(eventStore, configuration.isSnapshotEnabled(), Clock.systemUTC());
    }

    public EntityReconstituter(EntityEventStore eventStore, boolean snapshotEnabled, Clock clock) {
        this.eventStore = Objects.requireNonNull(eventStore, "Event store cannot be null");
        this.snapshotEnabled = snapshotEnabled;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public CompletableFuture<ReconstitutedEntity> reconstitute(String entityTypeName, String entityID,
                                                              EntityReducer reducer) {
        Objects.requireNonNull(reducer, "Reducer cannot be null");
        logger.debug("Reconstituting {} with ID {}", entityTypeName, entityID);

        return eventStore.readEntityLatestSnapshot(entityTypeName, entityID)
            .thenCompose(snapshot -> {
                // Events sharing the snapshotted createdAt are read too and filtered by version
                Instant since = snapshot.map(s -> s.snapshottedEventCreatedAt().minus(1, ChronoUnit.MICROS))
                    .orElse(null);
                return eventStore.readEntityEventsSince(entityTypeName, entityID, since)
                    .thenApply(events -> fold(entityTypeName, entityID, snapshot,
                        eventsAfterSnapshot(events, snapshot), reducer));
            })
            .thenCompose(this::snapshotIfAdvanced);
    }

    private static List<EventEnvelope> eventsAfterSnapshot(List<EventEnvelope> events,
                                                           Optional<EntitySnapshotEnvelope> snapshot) {
        if (snapshot.isEmpty()) {
            return events;
        }
        long snapshotVersion = snapshot.get().version();
        return events.stream()
            .filter(event -> event.version() > snapshotVersion)
            .collect(Collectors.toList());
    }

    private ReconstitutedEntity fold(String entityTypeName, String entityID,
                                     Optional<EntitySnapshotEnvelope> snapshot, List<EventEnvelope> events,
                                     EntityReducer reducer) {
        JsonNode state = snapshot.map(EntitySnapshotEnvelope::value).orElse(null);
        long version = snapshot.map(EntitySnapshotEnvelope::version).orElse(0L);
        Instant lastEventCreatedAt = snapshot.map(EntitySnapshotEnvelope::snapshottedEventCreatedAt).orElse(null);

        for (EventEnvelope event : events) {
            state = reducer.reduce(state, event);
            version = event.version();
            lastEventCreatedAt = event.createdAt();
        }

        logger.debug("Folded {} event(s) into {} with ID {} (from snapshot: {})",
            events.size(), entityTypeName, entityID, snapshot.isPresent());
        return new ReconstitutedEntity(entityTypeName, entityID, state, version, lastEventCreatedAt,
            events.size(), snapshot.isPresent());
    }

    private CompletableFuture<ReconstitutedEntity> snapshotIfAdvanced(ReconstitutedEntity entity) {
        if (!snapshotEnabled || entity.getEventsApplied() == 0 || entity.getState().isEmpty()) {
            return CompletableFuture.completedFuture(entity);
        }

        EntitySnapshotEnvelope snapshot = EntitySnapshotEnvelope.builder()
            .entityTypeName(entity.getEntityTypeName())
            .entityID(entity.getEntityID())
            .value(entity.getState().get())
            .createdAt(clock.instant())
            .version(entity.getVersion())
            .snapshottedEventCreatedAt(entity.getLastEventCreatedAt().orElseThrow())
            .build();

        return CompletionUtils.invoke(() -> eventStore.storeSnapshot(snapshot))
            .handle((result, throwable) -> {
                if (throwable != null) {
                    logger.warn("Could not store snapshot of {} with ID {} at version {}: {}",
                        entity.getEntityTypeName(), entity.getEntityID(), entity.getVersion(),
                        CompletionUtils.unwrap(throwable).getMessage());
                }
                return entity;
            });
    }
}
