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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Metrics for the versioning overlay.
 *
 * <p>Until {@link #bindTo(MeterRegistry)} is called every recording method is a no-op,
 * which is how metrics are switched off.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public class TxTimeMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(TxTimeMetrics.class);

    private final String instanceId;
    private MeterRegistry registry;

    // Counters
    private Counter versionsInserted;
    private Counter versionsClosed;
    private Counter mutationsOrphaned;
    private Counter mutationsCompensated;
    private Counter purgeRemoved;

    // Timers
    private Timer mutationDuration;

    public TxTimeMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        versionsInserted = Counter.builder("txtime.versions.inserted")
            .description("Total number of document versions inserted")
            .tag("instance", instanceId)
            .register(registry);

        versionsClosed = Counter.builder("txtime.versions.closed")
            .description("Total number of document versions closed")
            .tag("instance", instanceId)
            .register(registry);

        mutationsOrphaned = Counter.builder("txtime.mutations.orphaned")
            .description("Total number of closes whose successor insert failed")
            .tag("instance", instanceId)
            .register(registry);

        mutationsCompensated = Counter.builder("txtime.mutations.compensated")
            .description("Total number of orphaned closes that were re-opened")
            .tag("instance", instanceId)
            .register(registry);

        purgeRemoved = Counter.builder("txtime.purge.removed")
            .description("Total number of expired records removed by the purge sweep")
            .tag("instance", instanceId)
            .register(registry);

        mutationDuration = Timer.builder("txtime.mutation.duration")
            .description("Time taken by update and delete operations")
            .tag("instance", instanceId)
            .register(registry);

        logger.info("TxTime metrics registered for instance: {}", instanceId);
    }

    public void recordVersionInserted(String collection) {
        if (versionsInserted != null) {
            versionsInserted.increment();
        }
        if (registry != null) {
            Counter.builder("txtime.versions.inserted.by.collection")
                .tag("instance", instanceId)
                .tag("collection", collection)
                .register(registry)
                .increment();
        }
    }

    public void recordVersionClosed(String collection) {
        if (versionsClosed != null) {
            versionsClosed.increment();
        }
        if (registry != null) {
            Counter.builder("txtime.versions.closed.by.collection")
                .tag("instance", instanceId)
                .tag("collection", collection)
                .register(registry)
                .increment();
        }
    }

    public void recordOrphanedClose(String collection) {
        if (mutationsOrphaned != null) {
            mutationsOrphaned.increment();
        }
        logger.debug("Recorded orphaned close on {}", collection);
    }

    public void recordCompensation(String collection) {
        if (mutationsCompensated != null) {
            mutationsCompensated.increment();
        }
        logger.debug("Recorded compensation on {}", collection);
    }

    public void recordPurged(String collection, long removed) {
        if (purgeRemoved != null && removed > 0) {
            purgeRemoved.increment(removed);
        }
        if (registry != null && removed > 0) {
            Counter.builder("txtime.purge.removed.by.collection")
                .tag("instance", instanceId)
                .tag("collection", collection)
                .register(registry)
                .increment(removed);
        }
    }

    public void recordMutation(String collection, String operation, Duration duration) {
        if (mutationDuration != null) {
            mutationDuration.record(duration);
        }
        if (registry != null) {
            Timer.builder("txtime.mutation.duration.by.operation")
                .tag("instance", instanceId)
                .tag("collection", collection)
                .tag("operation", operation)
                .register(registry)
                .record(duration);
        }
    }

    public boolean isBound() {
        return registry != null;
    }

    public String getInstanceId() {
        return instanceId;
    }

    // Counter values for health reporting and tests
    public double getVersionsInserted() {
        return versionsInserted != null ? versionsInserted.count() : 0;
    }

    public double getVersionsClosed() {
        return versionsClosed != null ? versionsClosed.count() : 0;
    }

    public double getMutationsOrphaned() {
        return mutationsOrphaned != null ? mutationsOrphaned.count() : 0;
    }

    public double getMutationsCompensated() {
        return mutationsCompensated != null ? mutationsCompensated.count() : 0;
    }

    public double getPurgeRemoved() {
        return purgeRemoved != null ? purgeRemoved.count() : 0;
    }
}
