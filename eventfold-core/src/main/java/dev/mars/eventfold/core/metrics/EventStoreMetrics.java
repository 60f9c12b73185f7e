package dev.mars.eventfold.core.metrics;

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

import dev.mars.eventfold.api.EnvelopeKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Micrometer metrics for the event store.
 *
 * Until {@link #bindTo(MeterRegistry)} is called every record method is a no-op, so an
 * unbound instance doubles as the metrics sink for callers without a registry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class EventStoreMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(EventStoreMetrics.class);

    private final String instanceId;

    // Counters
    private volatile Counter eventsStored;
    private volatile Counter snapshotsStored;
    private volatile Counter storeConflicts;
    private volatile Counter storeFailures;
    private volatile Counter dispatchFailures;

    // Timers
    private volatile Timer batchStoreTime;

    public EventStoreMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    /**
     * @return A fresh instance that is never bound, so it records nothing
     */
    public static EventStoreMetrics noop() {
        return new EventStoreMetrics("noop");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        eventsStored = Counter.builder("eventfold.events.stored")
            .description("Total number of events durably stored")
            .tag("instance", instanceId)
            .register(registry);

        snapshotsStored = Counter.builder("eventfold.snapshots.stored")
            .description("Total number of snapshots durably stored")
            .tag("instance", instanceId)
            .register(registry);

        storeConflicts = Counter.builder("eventfold.store.conflicts")
            .description("Total number of store attempts rejected with a version conflict")
            .tag("instance", instanceId)
            .register(registry);

        storeFailures = Counter.builder("eventfold.store.failures")
            .description("Total number of store operations that failed for good")
            .tag("instance", instanceId)
            .register(registry);

        dispatchFailures = Counter.builder("eventfold.dispatch.failures")
            .description("Total number of stored batches whose dispatch failed")
            .tag("instance", instanceId)
            .register(registry);

        batchStoreTime = Timer.builder("eventfold.batch.store.time")
            .description("Time taken to store and dispatch an event batch")
            .tag("instance", instanceId)
            .register(registry);

        logger.info("EventFold metrics registered for instance: {}", instanceId);
    }

    public void recordStored(EnvelopeKind kind) {
        Counter counter = kind == EnvelopeKind.SNAPSHOT ? snapshotsStored : eventsStored;
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordConflict() {
        if (storeConflicts != null) {
            storeConflicts.increment();
        }
    }

    public void recordStoreFailure() {
        if (storeFailures != null) {
            storeFailures.increment();
        }
    }

    public void recordDispatchFailure() {
        if (dispatchFailures != null) {
            dispatchFailures.increment();
        }
    }

    public void recordBatchStoreTime(Duration duration) {
        if (batchStoreTime != null) {
            batchStoreTime.record(duration);
        }
    }

    public String getInstanceId() {
        return instanceId;
    }
}
