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
import dev.mars.eventfold.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Event Store Metrics Tests")
class EventStoreMetricsTest {

    @Test
    @DisplayName("Should register tagged meters and count by kind")
    void testBoundMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        EventStoreMetrics metrics = new EventStoreMetrics("node-1");
        metrics.bindTo(registry);

        metrics.recordStored(EnvelopeKind.EVENT);
        metrics.recordStored(EnvelopeKind.EVENT);
        metrics.recordStored(EnvelopeKind.SNAPSHOT);
        metrics.recordConflict();
        metrics.recordStoreFailure();
        metrics.recordDispatchFailure();
        metrics.recordBatchStoreTime(Duration.ofMillis(12));

        assertEquals(2.0, registry.get("eventfold.events.stored").tag("instance", "node-1").counter().count());
        assertEquals(1.0, registry.get("eventfold.snapshots.stored").counter().count());
        assertEquals(1.0, registry.get("eventfold.store.conflicts").counter().count());
        assertEquals(1.0, registry.get("eventfold.store.failures").counter().count());
        assertEquals(1.0, registry.get("eventfold.dispatch.failures").counter().count());
        assertEquals(1L, registry.get("eventfold.batch.store.time").timer().count());
    }

    @Test
    @DisplayName("Should ignore recordings when never bound")
    void testNoopMetrics() {
        EventStoreMetrics metrics = EventStoreMetrics.noop();

        assertDoesNotThrow(() -> {
            metrics.recordStored(EnvelopeKind.EVENT);
            metrics.recordConflict();
            metrics.recordStoreFailure();
            metrics.recordDispatchFailure();
            metrics.recordBatchStoreTime(Duration.ofMillis(1));
        });
        assertEquals("noop", metrics.getInstanceId());
    }
}
