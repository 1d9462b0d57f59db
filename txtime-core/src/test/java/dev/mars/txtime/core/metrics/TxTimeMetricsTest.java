package dev.mars.txtime.core.metrics;

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

import dev.mars.txtime.test.categories.TestCategories;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TxTimeMetrics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
@Tag(TestCategories.CORE)
class TxTimeMetricsTest {

    private MeterRegistry meterRegistry;
    private TxTimeMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new TxTimeMetrics("metrics-test");
    }

    @Test
    void testRecordingBeforeBindingIsIgnored() {
        metrics.recordVersionInserted("orders");
        metrics.recordVersionClosed("orders");
        metrics.recordMutation("orders", "update", Duration.ofMillis(5));

        assertFalse(metrics.isBound());
        assertEquals(0.0, metrics.getVersionsInserted());
        assertEquals(0.0, metrics.getVersionsClosed());
    }

    @Test
    void testCountersAfterBinding() {
        metrics.bindTo(meterRegistry);

        metrics.recordVersionInserted("orders");
        metrics.recordVersionInserted("invoices");
        metrics.recordVersionClosed("orders");
        metrics.recordOrphanedClose("orders");
        metrics.recordCompensation("orders");

        assertTrue(metrics.isBound());
        assertEquals(2.0, metrics.getVersionsInserted());
        assertEquals(1.0, metrics.getVersionsClosed());
        assertEquals(1.0, metrics.getMutationsOrphaned());
        assertEquals(1.0, metrics.getMutationsCompensated());

        // Per-collection counters
        assertEquals(1.0, meterRegistry.get("txtime.versions.inserted.by.collection")
            .tag("collection", "invoices").counter().count());
        assertEquals("metrics-test", meterRegistry.get("txtime.versions.inserted")
            .counter().getId().getTag("instance"));
    }

    @Test
    void testPurgeCounterIgnoresEmptySweeps() {
        metrics.bindTo(meterRegistry);

        metrics.recordPurged("orders", 0);
        metrics.recordPurged("orders", 3);

        assertEquals(3.0, metrics.getPurgeRemoved());
        assertEquals(3.0, meterRegistry.get("txtime.purge.removed.by.collection")
            .tag("collection", "orders").counter().count());
    }

    @Test
    void testMutationTimers() {
        metrics.bindTo(meterRegistry);

        metrics.recordMutation("orders", "update", Duration.ofMillis(10));
        metrics.recordMutation("orders", "delete", Duration.ofMillis(20));

        assertEquals(2L, meterRegistry.get("txtime.mutation.duration").timer().count());
        assertEquals(1L, meterRegistry.get("txtime.mutation.duration.by.operation")
            .tag("operation", "delete").timer().count());
    }
}
