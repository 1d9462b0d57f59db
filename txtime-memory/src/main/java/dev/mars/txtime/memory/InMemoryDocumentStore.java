package dev.mars.txtime.memory;

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

import dev.mars.txtime.api.store.CollectionNotFoundException;
import dev.mars.txtime.api.store.CollectionOptions;
import dev.mars.txtime.api.store.CursorOptions;
import dev.mars.txtime.api.store.DocumentStore;
import dev.mars.txtime.api.store.IndexDefinition;
import dev.mars.txtime.api.store.RecordLocation;
import dev.mars.txtime.api.store.StoreCursor;
import dev.mars.txtime.api.store.StoreException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-JVM {@link DocumentStore} keeping every collection in memory.
 *
 * <p>Records live in numbered slots. Removed slots are reused first-fit when slot reuse is
 * enabled, and records that outgrow their slot move to another one, so a scan can meet a
 * record again after it was updated. Cursors that are not opened in no-timeout mode expire
 * after the configured idle timeout.</p>
 *
 * <pre>{@code
 * InMemoryDocumentStore store = InMemoryDocumentStore.builder()
 *     .cursorTimeout(Duration.ofMinutes(10))
 *     .reuseSlots(true)
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    public static final Duration DEFAULT_CURSOR_TIMEOUT = Duration.ofMinutes(10);

    private final Map<String, MemoryCollection> collections = new ConcurrentHashMap<>();
    private final Map<Long, InMemoryCursor> openCursors = new ConcurrentHashMap<>();
    private final AtomicLong cursorIds = new AtomicLong();
    private final Duration cursorTimeout;
    private final boolean reuseSlots;
    private final double paddingFactor;
    private final Clock clock;

    private InMemoryDocumentStore(Builder builder) {
        this.cursorTimeout = builder.cursorTimeout;
        this.reuseSlots = builder.reuseSlots;
        this.paddingFactor = builder.paddingFactor;
        this.clock = builder.clock;
        logger.debug("Created in-memory store (cursorTimeout={}, reuseSlots={}, paddingFactor={})",
            cursorTimeout, reuseSlots, paddingFactor);
    }

    public static InMemoryDocumentStore create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void createCollection(String collection, CollectionOptions options) {
        Objects.requireNonNull(collection, "Collection name cannot be null");
        Objects.requireNonNull(options, "Collection options cannot be null");
        MemoryCollection created = new MemoryCollection(collection, options, reuseSlots, paddingFactor);
        if (collections.putIfAbsent(collection, created) != null) {
            throw new StoreException("Collection already exists: " + collection);
        }
        logger.info("Created collection {} (temporal={})", collection, options.temporal());
    }

    @Override
    public Optional<CollectionOptions> getCollectionOptions(String collection) {
        MemoryCollection found = collections.get(collection);
        return found == null ? Optional.empty() : Optional.of(found.options());
    }

    @Override
    public Set<String> listCollections() {
        return new TreeSet<>(collections.keySet());
    }

    @Override
    public boolean dropCollection(String collection) {
        MemoryCollection removed = collections.remove(collection);
        if (removed == null) {
            return false;
        }
        removed.markDropped();
        logger.info("Dropped collection {}", collection);
        return true;
    }

    @Override
    public Optional<JsonObject> findByLocation(String collection, RecordLocation location) {
        return require(collection).find(location);
    }

    @Override
    public RecordLocation insert(String collection, JsonObject document) {
        Objects.requireNonNull(document, "Document cannot be null");
        return require(collection).insert(document);
    }

    @Override
    public RecordLocation update(String collection, RecordLocation location, JsonObject expected,
                                 JsonObject replacement) {
        Objects.requireNonNull(location, "Location cannot be null");
        Objects.requireNonNull(replacement, "Replacement cannot be null");
        return require(collection).update(location, expected, replacement);
    }

    @Override
    public boolean remove(String collection, RecordLocation location, JsonObject expected) {
        Objects.requireNonNull(location, "Location cannot be null");
        return require(collection).remove(location, expected);
    }

    @Override
    public StoreCursor openCursor(String collection, JsonObject predicate, CursorOptions options) {
        MemoryCollection target = require(collection);
        reapIdleCursors();
        long id = cursorIds.incrementAndGet();
        InMemoryCursor cursor = new InMemoryCursor(id, this, target, predicate,
            options != null ? options : CursorOptions.defaults(), clock, cursorTimeout);
        openCursors.put(id, cursor);
        return cursor;
    }

    @Override
    public void createIndex(String collection, IndexDefinition definition) {
        Objects.requireNonNull(definition, "Index definition cannot be null");
        if (require(collection).createIndex(definition)) {
            logger.info("Created index {} on {}", definition.getName(), collection);
        }
    }

    @Override
    public List<IndexDefinition> listIndexes(String collection) {
        return require(collection).listIndexes();
    }

    /**
     * Expires every cursor idle for longer than the cursor timeout.
     *
     * @return the number of cursors expired
     */
    public int reapIdleCursors() {
        Instant now = clock.instant();
        int expired = 0;
        for (InMemoryCursor cursor : openCursors.values()) {
            if (cursor.expireIfIdle(now)) {
                expired++;
            }
        }
        if (expired > 0) {
            logger.warn("Expired {} idle cursor(s) after {}", expired, cursorTimeout);
        }
        return expired;
    }

    public int openCursorCount() {
        return openCursors.size();
    }

    /**
     * Number of records currently stored in a collection.
     */
    public int recordCount(String collection) {
        return require(collection).records().size();
    }

    /**
     * Number of times records of a collection moved to another slot.
     */
    public long relocationCount(String collection) {
        return require(collection).relocationCount();
    }

    void cursorClosed(long id) {
        openCursors.remove(id);
    }

    private MemoryCollection require(String collection) {
        MemoryCollection found = collections.get(collection);
        if (found == null) {
            throw new CollectionNotFoundException(collection);
        }
        return found;
    }

    /**
     * Builder for InMemoryDocumentStore.
     */
    public static class Builder {
        private Duration cursorTimeout = DEFAULT_CURSOR_TIMEOUT;
        private boolean reuseSlots = true;
        private double paddingFactor = 1.0;
        private Clock clock = Clock.systemUTC();

        public Builder cursorTimeout(Duration cursorTimeout) {
            Objects.requireNonNull(cursorTimeout, "Cursor timeout cannot be null");
            if (cursorTimeout.isNegative() || cursorTimeout.isZero()) {
                throw new IllegalArgumentException("Cursor timeout must be positive");
            }
            this.cursorTimeout = cursorTimeout;
            return this;
        }

        public Builder reuseSlots(boolean reuseSlots) {
            this.reuseSlots = reuseSlots;
            return this;
        }

        /**
         * Space reserved per record as a multiple of its encoded size; 1.0 reserves none,
         * so every growing update relocates the record.
         */
        public Builder paddingFactor(double paddingFactor) {
            if (paddingFactor < 1.0) {
                throw new IllegalArgumentException("Padding factor cannot be below 1.0");
            }
            this.paddingFactor = paddingFactor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
            return this;
        }

        public InMemoryDocumentStore build() {
            return new InMemoryDocumentStore(this);
        }
    }
}
