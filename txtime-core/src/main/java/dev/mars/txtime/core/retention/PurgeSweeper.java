package dev.mars.txtime.core.retention;

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

import dev.mars.txtime.api.TemporalFields;
import dev.mars.txtime.api.TransactionClock;
import dev.mars.txtime.api.store.CollectionNotFoundException;
import dev.mars.txtime.api.store.CollectionOptions;
import dev.mars.txtime.api.store.CursorOptions;
import dev.mars.txtime.api.store.DocumentStore;
import dev.mars.txtime.api.store.IndexDefinition;
import dev.mars.txtime.api.store.RecordLocation;
import dev.mars.txtime.api.store.StoreCursor;
import dev.mars.txtime.core.metrics.TxTimeMetrics;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Removes expired documents for every index that declares {@code expireAfterSeconds}.
 *
 * <p>On temporal collections expiry is always measured on the interval end, whatever
 * the index keys are, so only closed versions are removed and a chain loses its oldest
 * versions first. Plain collections expire on the first key of the index.</p>
 *
 * <p>The sweep can run once, on a Vert.x worker thread, or periodically on a Vert.x
 * timer.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public class PurgeSweeper {

    private static final Logger logger = LoggerFactory.getLogger(PurgeSweeper.class);

    private final DocumentStore store;
    private final TransactionClock clock;
    private final TxTimeMetrics metrics;
    private final AtomicBoolean sweeping = new AtomicBoolean(false);

    private Vertx vertx;
    private long timerId;

    public PurgeSweeper(DocumentStore store, TransactionClock clock, TxTimeMetrics metrics) {
        this.store = Objects.requireNonNull(store, "Document store cannot be null");
        this.clock = Objects.requireNonNull(clock, "Transaction clock cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
    }

    /**
     * Runs one sweep over all collections.
     *
     * @return the number of documents removed
     */
    public long sweep() {
        long total = 0;
        for (String collection : store.listCollections()) {
            try {
                total += sweepCollection(collection);
            } catch (CollectionNotFoundException e) {
                logger.debug("Collection {} was dropped during the purge sweep", collection);
            }
        }
        return total;
    }

    /**
     * Runs one sweep on a worker thread.
     */
    public Future<Long> sweepAsync(Vertx vertx) {
        return vertx.executeBlocking(this::sweep);
    }

    /**
     * Starts sweeping periodically. A tick is skipped while the previous sweep still runs.
     */
    public synchronized void start(Vertx vertx, Duration interval) {
        Objects.requireNonNull(vertx, "Vertx cannot be null");
        if (isRunning()) {
            throw new IllegalStateException("Purge sweeper is already running");
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Purge interval must be positive: " + interval);
        }
        this.vertx = vertx;
        timerId = vertx.setPeriodic(interval.toMillis(), id -> {
            if (!sweeping.compareAndSet(false, true)) {
                logger.debug("Previous purge sweep still running, skipping tick");
                return;
            }
            sweepAsync(vertx)
                .onSuccess(removed -> {
                    if (removed > 0) {
                        logger.info("Purge sweep removed {} expired document(s)", removed);
                    }
                })
                .onFailure(e -> logger.warn("Purge sweep failed", e))
                .onComplete(ar -> sweeping.set(false));
        });
        logger.info("Started purge sweeper every {}", interval);
    }

    public synchronized void stop() {
        if (vertx != null) {
            vertx.cancelTimer(timerId);
            vertx = null;
            timerId = 0;
            logger.info("Stopped purge sweeper");
        }
    }

    public synchronized boolean isRunning() {
        return vertx != null;
    }

    private long sweepCollection(String collection) {
        boolean temporal = store.getCollectionOptions(collection).map(CollectionOptions::temporal).orElse(false);
        long removed = 0;
        for (IndexDefinition index : store.listIndexes(collection)) {
            Optional<Long> expireAfter = index.getExpireAfterSeconds();
            if (expireAfter.isEmpty()) {
                continue;
            }
            String field = temporal
                ? TemporalFields.TRANSACTION_END_PATH
                : index.getKeys().fieldNames().iterator().next();
            if (TemporalFields.TRANSACTION_START_PATH.equals(field)) {
                logger.warn("Ignoring expiring index {} on {}: it expires on the interval start",
                    index.getName(), collection);
                continue;
            }
            JsonObject query = RetentionPredicateBuilder.purgeQuery(field, expireAfter.get(), clock.wallTime());
            removed += removeMatching(collection, query);
        }
        if (removed > 0) {
            metrics.recordPurged(collection, removed);
            logger.debug("Purged {} expired document(s) from {}", removed, collection);
        }
        return removed;
    }

    private long removeMatching(String collection, JsonObject query) {
        long removed = 0;
        try (StoreCursor cursor = store.openCursor(collection, query, CursorOptions.builder().noTimeout(true).build())) {
            while (cursor.ok()) {
                RecordLocation location = cursor.location();
                JsonObject document = cursor.current();
                cursor.advance();
                if (store.remove(collection, location, document)) {
                    removed++;
                }
            }
        }
        return removed;
    }
}
