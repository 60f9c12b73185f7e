package dev.mars.eventfold.core.registry;

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

import dev.mars.eventfold.api.EntitySnapshotEnvelope;
import dev.mars.eventfold.api.Envelope;
import dev.mars.eventfold.api.EnvelopeKind;
import dev.mars.eventfold.api.EventEnvelope;
import dev.mars.eventfold.api.EventRegistry;
import dev.mars.eventfold.api.PersistableEnvelope;
import dev.mars.eventfold.api.RegistryQuery;
import dev.mars.eventfold.api.error.EventFoldErrorCodes;
import dev.mars.eventfold.api.error.RegistryException;
import dev.mars.eventfold.api.error.UnexpectedVersionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Event registry kept in process memory.
 *
 * All state sits behind a single monitor, which makes the version check and the write
 * of {@link #store(PersistableEnvelope)} atomic. Contents are lost when the process exits.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class InMemoryEventRegistry implements EventRegistry, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventRegistry.class);

    private static final Comparator<Envelope> STREAM_ORDER =
        Comparator.comparing(Envelope::createdAt).thenComparingLong(Envelope::version);

    private static final Comparator<Envelope> LATEST_FIRST =
        Comparator.comparingLong(Envelope::version).thenComparing(Envelope::createdAt).reversed();

    private final Object lock = new Object();
    private final Map<StreamKey, List<EventEnvelope>> events = new HashMap<>();
    private final Map<StreamKey, List<EntitySnapshotEnvelope>> snapshots = new HashMap<>();
    private boolean closed;

    @Override
    public CompletableFuture<List<EventEnvelope>> query(RegistryQuery query) {
        Objects.requireNonNull(query, "Query cannot be null");
        synchronized (lock) {
            if (closed) {
                return closedFailure();
            }
            List<EventEnvelope> result = new ArrayList<>();
            for (EventEnvelope event : events.getOrDefault(StreamKey.of(query), List.of())) {
                if (query.matches(event)) {
                    result.add(event);
                }
            }
            result.sort(STREAM_ORDER);
            return CompletableFuture.completedFuture(List.copyOf(result));
        }
    }

    @Override
    public CompletableFuture<Optional<EntitySnapshotEnvelope>> queryLatestSnapshot(RegistryQuery query) {
        Objects.requireNonNull(query, "Query cannot be null");
        synchronized (lock) {
            if (closed) {
                return closedFailure();
            }
            Optional<EntitySnapshotEnvelope> latest = snapshots.getOrDefault(StreamKey.of(query), List.of())
                .stream()
                .filter(query::matches)
                .min(LATEST_FIRST);
            return CompletableFuture.completedFuture(latest);
        }
    }

    @Override
    public CompletableFuture<Void> store(PersistableEnvelope envelope) {
        Objects.requireNonNull(envelope, "Envelope cannot be null");
        synchronized (lock) {
            if (closed) {
                return closedFailure();
            }
            if (envelope instanceof EventEnvelope) {
                EventEnvelope event = (EventEnvelope) envelope;
                List<EventEnvelope> stream = events.computeIfAbsent(StreamKey.of(event), k -> new ArrayList<>());
                if (hasVersionAtOrAfter(stream, event.version())) {
                    return conflict(event);
                }
                stream.add(event);
            } else if (envelope instanceof EntitySnapshotEnvelope) {
                EntitySnapshotEnvelope snapshot = (EntitySnapshotEnvelope) envelope;
                List<EntitySnapshotEnvelope> stream =
                    snapshots.computeIfAbsent(StreamKey.of(snapshot), k -> new ArrayList<>());
                if (hasVersionAtOrAfter(stream, snapshot.version())) {
                    return conflict(snapshot);
                }
                stream.add(snapshot);
            } else {
                return CompletableFuture.failedFuture(new RegistryException(EventFoldErrorCodes.MALFORMED_RECORD,
                    "Unsupported envelope type: " + envelope.getClass().getName(), null));
            }
            logger.debug("Stored {} version {} for {} {}",
                envelope.kind().value(), envelope.version(), envelope.entityTypeName(), envelope.entityID());
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * @return The number of records of the given kind held for all entities
     */
    public int size(EnvelopeKind kind) {
        synchronized (lock) {
            if (kind == EnvelopeKind.EVENT) {
                return events.values().stream().mapToInt(List::size).sum();
            }
            return snapshots.values().stream().mapToInt(List::size).sum();
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
            events.clear();
            snapshots.clear();
        }
        logger.info("In-memory event registry closed");
    }

    private static boolean hasVersionAtOrAfter(List<? extends Envelope> stream, long version) {
        for (Envelope existing : stream) {
            if (existing.version() >= version) {
                return true;
            }
        }
        return false;
    }

    private static <T> CompletableFuture<T> conflict(Envelope envelope) {
        logger.debug("Version conflict storing {} version {} for {} {}",
            envelope.kind().value(), envelope.version(), envelope.entityTypeName(), envelope.entityID());
        return CompletableFuture.failedFuture(new UnexpectedVersionException(
            envelope.kind(), envelope.entityTypeName(), envelope.entityID(), envelope.version()));
    }

    private static <T> CompletableFuture<T> closedFailure() {
        return CompletableFuture.failedFuture(new RegistryException(EventFoldErrorCodes.REGISTRY_CLOSED,
            "Event registry is closed", null));
    }

    private static final class StreamKey {
        private final String entityTypeName;
        private final String entityID;

        private StreamKey(String entityTypeName, String entityID) {
            this.entityTypeName = entityTypeName;
            this.entityID = entityID;
        }

        static StreamKey of(Envelope envelope) {
            return new StreamKey(envelope.entityTypeName(), envelope.entityID());
        }

        static StreamKey of(RegistryQuery query) {
            return new StreamKey(query.getEntityTypeName(), query.getEntityID());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof StreamKey)) return false;
            StreamKey that = (StreamKey) o;
            return entityTypeName.equals(that.entityTypeName) && entityID.equals(that.entityID);
        }

        @Override
        public int hashCode() {
            return Objects.hash(entityTypeName, entityID);
        }
    }
}
