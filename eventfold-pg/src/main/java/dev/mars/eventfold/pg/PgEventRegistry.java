package dev.mars.eventfold.pg;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.eventfold.api.EntitySnapshotEnvelope;
import dev.mars.eventfold.api.EnvelopeKind;
import dev.mars.eventfold.api.EventEnvelope;
import dev.mars.eventfold.api.EventRegistry;
import dev.mars.eventfold.api.PersistableEnvelope;
import dev.mars.eventfold.api.RegistryQuery;
import dev.mars.eventfold.api.error.EventFoldErrorCodes;
import dev.mars.eventfold.api.error.EventStoreException;
import dev.mars.eventfold.api.error.RegistryException;
import dev.mars.eventfold.api.error.UnexpectedVersionException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgException;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Event registry on PostgreSQL, using the Vert.x 5 reactive client.
 *
 * Events and snapshots share one table, told apart by {@code kind}. A store takes a
 * transaction-scoped advisory lock on the entity stream and inserts only when no record of
 * the same kind has a version at or past the new one; otherwise it fails with
 * {@link UnexpectedVersionException}. The unique key on
 * {@code (entity_type_name, entity_id, kind, version)} backs this up.
 *
 * PostgreSQL keeps timestamps to the microsecond, so sub-microsecond precision of
 * {@code createdAt} and {@code persistedAt} is lost.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class PgEventRegistry implements EventRegistry, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgEventRegistry.class);

    private static final String SCHEMA_RESOURCE = "/db/eventfold-schema.sql";
    private static final String UNIQUE_VIOLATION = "23505";
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private static final String COLUMNS = "kind, entity_type_name, entity_id, version, type_name, "
        + "value::text AS value_json, request_id, metadata::text AS metadata_json, "
        + "created_at, persisted_at, snapshotted_event_created_at";

    private final Pool pool;
    private final Vertx ownedVertx;
    private final String tableName;
    private final ObjectMapper objectMapper;

    private final String insertSql;
    private final String lockSql;
    private final String eventsSql;
    private final String eventsAfterSql;
    private final String latestSnapshotSql;
    private final String latestSnapshotAfterSql;

    /**
     * Creates a registry with its own pool on the given Vert.x instance.
     */
    public PgEventRegistry(Vertx vertx, PgRegistryConfig config) {
        this(createPool(vertx, config), null, config.getTableName(), new ObjectMapper());
    }

    /**
     * Creates a registry on an existing pool. {@link #close()} closes the pool.
     */
    public PgEventRegistry(Pool pool, String tableName, ObjectMapper objectMapper) {
        this(pool, null, tableName, objectMapper);
    }

    private PgEventRegistry(Pool pool, Vertx ownedVertx, String tableName, ObjectMapper objectMapper) {
        this.pool = Objects.requireNonNull(pool, "Pool cannot be null");
        this.ownedVertx = ownedVertx;
        this.tableName = PgRegistryConfig.requireValidTableName(tableName);
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");

        this.lockSql = "SELECT count(*) FROM (SELECT pg_advisory_xact_lock("
            + "hashtext($1::text || '/' || $2::text || '/' || $3::text))) AS stream_lock";
        this.insertSql = "INSERT INTO " + this.tableName
            + " (kind, entity_type_name, entity_id, version, type_name, value, request_id, metadata,"
            + " created_at, persisted_at, snapshotted_event_created_at)"
            + " SELECT $1::varchar, $2::varchar, $3::varchar, $4::bigint, $5::varchar, $6::text::jsonb,"
            + " $7::varchar, $8::text::jsonb, $9::timestamptz, $10::timestamptz, $11::timestamptz"
            + " WHERE NOT EXISTS (SELECT 1 FROM " + this.tableName
            + " WHERE entity_type_name = $2 AND entity_id = $3 AND kind = $1 AND version >= $4)";
        String streamFilter = " FROM " + this.tableName
            + " WHERE entity_type_name = $1 AND entity_id = $2 AND kind = $3";
        this.eventsSql = "SELECT " + COLUMNS + streamFilter + " ORDER BY created_at ASC, version ASC";
        this.eventsAfterSql = "SELECT " + COLUMNS + streamFilter
            + " AND created_at > $4 ORDER BY created_at ASC, version ASC";
        this.latestSnapshotSql = "SELECT " + COLUMNS + streamFilter
            + " ORDER BY version DESC, created_at DESC LIMIT 1";
        this.latestSnapshotAfterSql = "SELECT " + COLUMNS + streamFilter
            + " AND created_at > $4 ORDER BY version DESC, created_at DESC LIMIT 1";
    }

    /**
     * Creates a registry on a Vert.x instance of its own, closed together with the registry.
     */
    public static PgEventRegistry create(PgRegistryConfig config) {
        Vertx vertx = Vertx.vertx();
        return new PgEventRegistry(createPool(vertx, config), vertx, config.getTableName(), new ObjectMapper());
    }

    private static Pool createPool(Vertx vertx, PgRegistryConfig config) {
        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(config.getHost())
            .setPort(config.getPort())
            .setDatabase(config.getDatabase())
            .setUser(config.getUsername())
            .setPassword(config.getPassword());

        PoolOptions poolOptions = new PoolOptions()
            .setMaxSize(config.getPoolSize())
            .setName("eventfold-registry-pool");

        logger.info("Creating PostgreSQL event registry pool: {}", config);
        return PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectOptions)
            .using(vertx)
            .build();
    }

    /**
     * Creates the envelope table and its index when they do not exist yet.
     */
    public CompletableFuture<Void> initializeSchema() {
        String sql;
        try {
            sql = loadSchema().replace("${table}", tableName);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                new RegistryException("Could not read schema resource " + SCHEMA_RESOURCE, e));
        }
        return ReactiveUtils.toCompletableFuture(pool.query(sql).execute())
            .handle((rows, throwable) -> {
                if (throwable != null) {
                    throw translate(throwable, "Schema initialization failed for table " + tableName);
                }
                logger.info("EventFold schema ready in table {}", tableName);
                return null;
            });
    }

    private String loadSchema() throws IOException {
        try (InputStream is = getClass().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (is == null) {
                throw new IOException("Resource not found: " + SCHEMA_RESOURCE);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Override
    public CompletableFuture<List<EventEnvelope>> query(RegistryQuery query) {
        Objects.requireNonNull(query, "Query cannot be null");
        if (query.getKind() != EnvelopeKind.EVENT) {
            return CompletableFuture.completedFuture(List.of());
        }

        Optional<Instant> createdAfter = query.getCreatedAfter();
        String sql = createdAfter.isPresent() ? eventsAfterSql : eventsSql;
        Tuple params = streamParams(query);
        createdAfter.ifPresent(bound -> params.addOffsetDateTime(toOffsetDateTime(bound)));

        Future<List<EventEnvelope>> rows = pool.preparedQuery(sql).execute(params).map(rowSet -> {
            List<EventEnvelope> events = new ArrayList<>(rowSet.rowCount());
            for (Row row : rowSet) {
                events.add(mapRowToEvent(row));
            }
            return events;
        });

        return ReactiveUtils.toCompletableFuture(rows).handle((events, throwable) -> {
            if (throwable != null) {
                throw translate(throwable, "Event query failed for " + describe(query));
            }
            logger.debug("Queried {} event(s) for {}", events.size(), describe(query));
            return events;
        });
    }

    @Override
    public CompletableFuture<Optional<EntitySnapshotEnvelope>> queryLatestSnapshot(RegistryQuery query) {
        Objects.requireNonNull(query, "Query cannot be null");

        Optional<Instant> createdAfter = query.getCreatedAfter();
        String sql = createdAfter.isPresent() ? latestSnapshotAfterSql : latestSnapshotSql;
        Tuple params = Tuple.of(query.getEntityTypeName(), query.getEntityID(), EnvelopeKind.SNAPSHOT.value());
        createdAfter.ifPresent(bound -> params.addOffsetDateTime(toOffsetDateTime(bound)));

        Future<Optional<EntitySnapshotEnvelope>> row = pool.preparedQuery(sql).execute(params).map(rowSet -> {
            if (rowSet.rowCount() == 0) {
                return Optional.<EntitySnapshotEnvelope>empty();
            }
            return Optional.of(mapRowToSnapshot(rowSet.iterator().next()));
        });

        return ReactiveUtils.toCompletableFuture(row).handle((snapshot, throwable) -> {
            if (throwable != null) {
                throw translate(throwable, "Snapshot query failed for " + describe(query));
            }
            return snapshot;
        });
    }

    @Override
    public CompletableFuture<Void> store(PersistableEnvelope envelope) {
        Objects.requireNonNull(envelope, "Envelope cannot be null");

        Tuple params;
        try {
            params = insertParams(envelope);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new RegistryException(EventFoldErrorCodes.MALFORMED_RECORD,
                "Could not serialize " + envelope.kind().value() + " of " + envelope.entityTypeName()
                    + " with ID " + envelope.entityID(), e));
        } catch (RegistryException e) {
            return CompletableFuture.failedFuture(e);
        }

        Future<Integer> inserted = pool.withTransaction(client -> client.preparedQuery(lockSql)
            .execute(Tuple.of(envelope.entityTypeName(), envelope.entityID(), envelope.kind().value()))
            .compose(locked -> client.preparedQuery(insertSql).execute(params))
            .map(rowSet -> rowSet.rowCount()));

        return ReactiveUtils.toCompletableFuture(inserted).handle((rowCount, throwable) -> {
            if (throwable != null) {
                if (isUniqueViolation(throwable)) {
                    throw conflict(envelope, throwable);
                }
                throw translate(throwable, "Store failed for " + envelope.kind().value() + " version "
                    + envelope.version() + " of " + envelope.entityTypeName() + " with ID " + envelope.entityID());
            }
            if (rowCount == 0) {
                throw conflict(envelope, null);
            }
            logger.debug("Stored {} version {} of {} with ID {}",
                envelope.kind().value(), envelope.version(), envelope.entityTypeName(), envelope.entityID());
            return null;
        });
    }

    private Tuple insertParams(PersistableEnvelope envelope) throws JsonProcessingException {
        Tuple params = Tuple.tuple()
            .addString(envelope.kind().value())
            .addString(envelope.entityTypeName())
            .addString(envelope.entityID())
            .addLong(envelope.version())
            .addString(envelope.typeName())
            .addString(objectMapper.writeValueAsString(envelope.value()));

        if (envelope instanceof EventEnvelope) {
            EventEnvelope event = (EventEnvelope) envelope;
            return params
                .addString(event.requestID())
                .addString(objectMapper.writeValueAsString(event.metadata()))
                .addOffsetDateTime(toOffsetDateTime(event.createdAt()))
                .addOffsetDateTime(toOffsetDateTime(event.persistedAt()))
                .addOffsetDateTime(null);
        }
        if (envelope instanceof EntitySnapshotEnvelope) {
            EntitySnapshotEnvelope snapshot = (EntitySnapshotEnvelope) envelope;
            return params
                .addString(null)
                .addString("{}")
                .addOffsetDateTime(toOffsetDateTime(snapshot.createdAt()))
                .addOffsetDateTime(null)
                .addOffsetDateTime(toOffsetDateTime(snapshot.snapshottedEventCreatedAt()));
        }
        throw new RegistryException(EventFoldErrorCodes.MALFORMED_RECORD,
            "Unsupported envelope type: " + envelope.getClass().getName(), null);
    }

    private EventEnvelope mapRowToEvent(Row row) {
        try {
            requireKind(row.getString("kind"), EnvelopeKind.EVENT);
            return new EventEnvelope(
                row.getString("entity_type_name"),
                row.getString("entity_id"),
                row.getString("type_name"),
                objectMapper.readTree(row.getString("value_json")),
                row.getOffsetDateTime("created_at").toInstant(),
                row.getLong("version"),
                row.getString("request_id"),
                objectMapper.readValue(row.getString("metadata_json"), METADATA_TYPE),
                row.getOffsetDateTime("persisted_at").toInstant());
        } catch (JsonProcessingException | RuntimeException e) {
            throw new RegistryException(EventFoldErrorCodes.MALFORMED_RECORD,
                "Malformed event record in " + tableName + ": " + e.getMessage(), e);
        }
    }

    private EntitySnapshotEnvelope mapRowToSnapshot(Row row) {
        try {
            requireKind(row.getString("kind"), EnvelopeKind.SNAPSHOT);
            return new EntitySnapshotEnvelope(
                row.getString("entity_type_name"),
                row.getString("entity_id"),
                row.getString("type_name"),
                objectMapper.readTree(row.getString("value_json")),
                row.getOffsetDateTime("created_at").toInstant(),
                row.getLong("version"),
                row.getOffsetDateTime("snapshotted_event_created_at").toInstant());
        } catch (JsonProcessingException | RuntimeException e) {
            throw new RegistryException(EventFoldErrorCodes.MALFORMED_RECORD,
                "Malformed snapshot record in " + tableName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks the stored discriminator of a row against the kind being mapped.
     *
     * @throws IllegalArgumentException if the stored kind is unknown or a different one
     */
    static EnvelopeKind requireKind(String storedKind, EnvelopeKind expected) {
        EnvelopeKind kind = EnvelopeKind.fromValue(storedKind);
        if (kind != expected) {
            throw new IllegalArgumentException("Expected kind " + expected.value() + " but row has " + storedKind);
        }
        return kind;
    }

    private static Tuple streamParams(RegistryQuery query) {
        return Tuple.tuple()
            .addString(query.getEntityTypeName())
            .addString(query.getEntityID())
            .addString(query.getKind().value());
    }

    private static OffsetDateTime toOffsetDateTime(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static String describe(RegistryQuery query) {
        return query.getEntityTypeName() + " with ID " + query.getEntityID();
    }

    private static UnexpectedVersionException conflict(PersistableEnvelope envelope, Throwable cause) {
        logger.debug("Version conflict storing {} version {} of {} with ID {}",
            envelope.kind().value(), envelope.version(), envelope.entityTypeName(), envelope.entityID());
        return new UnexpectedVersionException(envelope.kind(), envelope.entityTypeName(), envelope.entityID(),
            envelope.version(), cause);
    }

    private static boolean isUniqueViolation(Throwable throwable) {
        PgException pgException = findPgException(throwable);
        return pgException != null && UNIQUE_VIOLATION.equals(pgException.getSqlState());
    }

    private static PgException findPgException(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null && !(cause instanceof PgException)) {
            cause = cause.getCause();
        }
        return (PgException) cause;
    }

    /**
     * Maps a driver failure to the registry error hierarchy. Connection failures and server
     * shutdown are reported as unavailability.
     */
    static EventStoreException translate(Throwable throwable, String message) {
        Throwable cause = throwable;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof EventStoreException) {
            return (EventStoreException) cause;
        }

        PgException pgException = findPgException(cause);
        if (pgException != null) {
            String sqlState = pgException.getSqlState();
            if (sqlState != null && (sqlState.startsWith("08") || sqlState.startsWith("57P"))) {
                return new RegistryException(EventFoldErrorCodes.REGISTRY_UNAVAILABLE,
                    message + ": " + pgException.getMessage(), cause);
            }
            return new RegistryException(EventFoldErrorCodes.REGISTRY_FAILURE,
                message + " (SQLSTATE " + sqlState + "): " + pgException.getMessage(), cause);
        }

        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof IOException) {
                return new RegistryException(EventFoldErrorCodes.REGISTRY_UNAVAILABLE,
                    message + ": " + t.getMessage(), cause);
            }
        }
        return new RegistryException(EventFoldErrorCodes.REGISTRY_FAILURE, message + ": " + cause.getMessage(), cause);
    }

    public String getTableName() {
        return tableName;
    }

    @Override
    public void close() {
        logger.info("Closing PostgreSQL event registry on table {}", tableName);
        pool.close().onComplete(ar -> {
            if (ar.failed()) {
                logger.warn("Error closing registry pool: {}", ar.cause().getMessage(), ar.cause());
            }
            if (ownedVertx != null) {
                ownedVertx.close();
            }
        });
    }
}
