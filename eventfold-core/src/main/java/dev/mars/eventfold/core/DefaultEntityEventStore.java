package dev.mars.eventfold.core;

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

import dev.mars.eventfold.api.EntityEventStore;
import dev.mars.eventfold.api.EntitySnapshotEnvelope;
import dev.mars.eventfold.api.EventDispatcher;
import dev.mars.eventfold.api.EventEnvelope;
import dev.mars.eventfold.api.EventRegistry;
import dev.mars.eventfold.api.NonPersistedEventEnvelope;
import dev.mars.eventfold.api.PersistableEnvelope;
import dev.mars.eventfold.api.RegistryQuery;
import dev.mars.eventfold.api.error.DispatchException;
import dev.mars.eventfold.api.error.ErrorKind;
import dev.mars.eventfold.api.error.EventStoreException;
import dev.mars.eventfold.core.metrics.EventStoreMetrics;
import dev.mars.eventfold.core.retry.ConflictRetryPolicy;
import dev.mars.eventfold.core.util.CompletionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Event store that persists through an {@link EventRegistry}.
 *
 * Every registry write runs under the {@link ConflictRetryPolicy} for
 * {@link ErrorKind#CONFLICT}. Events of a batch are written one after the other in input
 * order, each stamped with a fresh persistence time per attempt, and the batch is handed to
 * the dispatcher only once all of them are stored.
 *
 * The store keeps no state between calls; the registry is the only shared resource.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class DefaultEntityEventStore implements EntityEventStore {
    private static final Logger logger = LoggerFactory.getLogger(DefaultEntityEventStore.class);

    /** Lower bound used when reading an entity from the beginning. */
    public static final Instant ORIGIN_OF_TIME = Instant.EPOCH;

    private final EventRegistry registry;
    private final ConflictRetryPolicy retryPolicy;
    private final Clock clock;
    private final EventStoreMetrics metrics;

    public DefaultEntityEventStore(EventRegistry registry, ConflictRetryPolicy retryPolicy) {
        this(registry, retryPolicy, Clock.systemUTC(), EventStoreMetrics.noop());
    }

    public DefaultEntityEventStore(EventRegistry registry, ConflictRetryPolicy retryPolicy, Clock clock,
                                   EventStoreMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "Event registry cannot be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "Retry policy cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
    }

    @Override
    public CompletableFuture<List<EventEnvelope>> readEntityEventsSince(String entityTypeName, String entityID,
                                                                        Instant since) {
        Instant fromTime = since != null ? since : ORIGIN_OF_TIME;
        RegistryQuery query = RegistryQuery.eventsCreatedAfter(entityTypeName, entityID, fromTime);
        logger.debug("Reading events of {} with ID {} created after {}", entityTypeName, entityID, fromTime);

        return CompletionUtils.invoke(() -> registry.query(query))
            .thenApply(events -> {
                logger.debug("Read {} event(s) of {} with ID {} created after {}",
                    events.size(), entityTypeName, entityID, fromTime);
                return events;
            });
    }

    @Override
    public CompletableFuture<Optional<EntitySnapshotEnvelope>> readEntityLatestSnapshot(String entityTypeName,
                                                                                        String entityID) {
        RegistryQuery query = RegistryQuery.snapshotsOf(entityTypeName, entityID);
        logger.debug("Reading latest snapshot of {} with ID {}", entityTypeName, entityID);

        return CompletionUtils.invoke(() -> registry.queryLatestSnapshot(query))
            .thenApply(snapshot -> {
                if (snapshot.isPresent()) {
                    logger.debug("Found snapshot of {} with ID {} at version {}",
                        entityTypeName, entityID, snapshot.get().version());
                } else {
                    logger.debug("No snapshot found for {} with ID {}", entityTypeName, entityID);
                }
                return snapshot;
            });
    }

    @Override
    public CompletableFuture<Void> storeEvents(List<NonPersistedEventEnvelope> eventEnvelopes,
                                               EventDispatcher dispatcher) {
        Objects.requireNonNull(eventEnvelopes, "Event envelopes cannot be null");
        Objects.requireNonNull(dispatcher, "Event dispatcher cannot be null");
        List<NonPersistedEventEnvelope> batch = List.copyOf(eventEnvelopes);

        if (batch.isEmpty()) {
            logger.debug("Empty event batch, nothing to store or dispatch");
            return CompletableFuture.completedFuture(null);
        }

        logger.debug("Storing {} event(s)", batch.size());
        long startNanos = System.nanoTime();

        CompletableFuture<Void> stored = CompletableFuture.completedFuture(null);
        for (NonPersistedEventEnvelope envelope : batch) {
            stored = stored.thenCompose(ignored -> persistEvent(envelope));
        }

        return stored
            .thenCompose(ignored -> dispatch(batch, dispatcher))
            .whenComplete((result, throwable) ->
                metrics.recordBatchStoreTime(Duration.ofNanos(System.nanoTime() - startNanos)));
    }

    @Override
    public CompletableFuture<Void> storeSnapshot(EntitySnapshotEnvelope snapshotEnvelope) {
        Objects.requireNonNull(snapshotEnvelope, "Snapshot envelope cannot be null");
        logger.debug("Storing snapshot of {} with ID {} at version {}",
            snapshotEnvelope.entityTypeName(), snapshotEnvelope.entityID(), snapshotEnvelope.version());

        return storeWithRetry(() -> snapshotEnvelope)
            .thenRun(() -> logger.debug("Snapshot stored for {} with ID {}",
                snapshotEnvelope.entityTypeName(), snapshotEnvelope.entityID()));
    }

    private CompletableFuture<Void> persistEvent(NonPersistedEventEnvelope envelope) {
        logger.debug("Persisting event {} version {} of {} with ID {}",
            envelope.typeName(), envelope.version(), envelope.entityTypeName(), envelope.entityID());
        // Each attempt takes its own persistence time
        return storeWithRetry(() -> envelope.persistedAt(clock.instant()));
    }

    private CompletableFuture<Void> storeWithRetry(Supplier<PersistableEnvelope> attemptEnvelope) {
        return retryPolicy.retryIfError(() -> {
            PersistableEnvelope envelope = attemptEnvelope.get();
            return CompletionUtils.invoke(() -> registry.store(envelope))
                .whenComplete((result, throwable) -> {
                    if (throwable == null) {
                        metrics.recordStored(envelope.kind());
                    } else if (isConflict(throwable)) {
                        metrics.recordConflict();
                    }
                });
        }, ErrorKind.CONFLICT).whenComplete((result, throwable) -> {
            if (throwable != null) {
                metrics.recordStoreFailure();
                logger.debug("Store failed: {}", CompletionUtils.unwrap(throwable).getMessage());
            }
        });
    }

    private CompletableFuture<Void> dispatch(List<NonPersistedEventEnvelope> batch, EventDispatcher dispatcher) {
        logger.debug("Dispatching {} stored event(s)", batch.size());
        return CompletionUtils.invoke(() -> dispatcher.dispatch(batch))
            .handle((result, throwable) -> {
                if (throwable == null) {
                    return null;
                }
                Throwable cause = CompletionUtils.unwrap(throwable);
                metrics.recordDispatchFailure();
                logger.warn("Dispatch of {} stored event(s) failed: {}", batch.size(), cause.getMessage());
                throw new DispatchException(batch, cause);
            });
    }

    private static boolean isConflict(Throwable throwable) {
        Throwable error = CompletionUtils.unwrap(throwable);
        return error instanceof EventStoreException && ((EventStoreException) error).kind() == ErrorKind.CONFLICT;
    }
}
