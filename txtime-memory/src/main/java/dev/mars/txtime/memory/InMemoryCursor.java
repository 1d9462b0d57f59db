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

import dev.mars.txtime.api.store.CursorOptions;
import dev.mars.txtime.api.store.CursorTimeoutException;
import dev.mars.txtime.api.store.RecordLocation;
import dev.mars.txtime.api.store.StoreCursor;
import io.vertx.core.json.JsonObject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Cursor over one in-memory collection.
 *
 * <p>Without a sort the cursor walks the live record map in slot order, so records written
 * ahead of its position during the scan are visible to it. With a sort the matching records
 * are materialized when the cursor opens.</p>
 */
final class InMemoryCursor implements StoreCursor {

    private final long id;
    private final InMemoryDocumentStore store;
    private final MemoryCollection collection;
    private final JsonObject predicate;
    private final CursorOptions options;
    private final Clock clock;
    private final Duration timeout;
    private final List<Map.Entry<Long, JsonObject>> sorted;

    private int sortedIndex;
    private Long position;
    private JsonObject current;
    private int skipped;
    private int returned;
    private long yields;
    private volatile Instant lastAccess;
    private volatile boolean closed;
    private volatile boolean timedOut;

    InMemoryCursor(long id, InMemoryDocumentStore store, MemoryCollection collection, JsonObject predicate,
                   CursorOptions options, Clock clock, Duration timeout) {
        this.id = id;
        this.store = store;
        this.collection = collection;
        this.predicate = predicate == null ? new JsonObject() : predicate.copy();
        this.options = options;
        this.clock = clock;
        this.timeout = timeout;
        this.lastAccess = clock.instant();
        if (options.getSort().isEmpty()) {
            this.sorted = null;
            seekLive(null);
        } else {
            this.sorted = materialize();
            seekSorted();
        }
    }

    private List<Map.Entry<Long, JsonObject>> materialize() {
        List<Map.Entry<Long, JsonObject>> matches = new ArrayList<>();
        for (Map.Entry<Long, StoredRecord> entry : collection.records().entrySet()) {
            JsonObject document = entry.getValue().document();
            if (DocumentMatcher.matches(document, predicate)) {
                matches.add(Map.entry(entry.getKey(), document));
            }
        }
        Comparator<JsonObject> order = DocumentSorter.comparator(options.getSort());
        matches.sort((a, b) -> order.compare(a.getValue(), b.getValue()));
        int from = Math.min(options.getSkip(), matches.size());
        int to = options.getLimit() > 0 ? Math.min(matches.size(), from + options.getLimit()) : matches.size();
        return new ArrayList<>(matches.subList(from, to));
    }

    private void seekSorted() {
        if (sortedIndex < sorted.size()) {
            Map.Entry<Long, JsonObject> entry = sorted.get(sortedIndex);
            position = entry.getKey();
            current = entry.getValue();
        } else {
            position = null;
            current = null;
        }
    }

    private void seekLive(Long after) {
        if (options.getLimit() > 0 && returned >= options.getLimit()) {
            position = null;
            current = null;
            return;
        }
        Map.Entry<Long, StoredRecord> entry = after == null
            ? collection.records().firstEntry()
            : collection.records().higherEntry(after);
        while (entry != null) {
            JsonObject document = entry.getValue().document();
            if (DocumentMatcher.matches(document, predicate)) {
                if (skipped < options.getSkip()) {
                    skipped++;
                } else {
                    position = entry.getKey();
                    current = document;
                    returned++;
                    return;
                }
            }
            entry = collection.records().higherEntry(entry.getKey());
        }
        position = null;
        current = null;
    }

    @Override
    public boolean ok() {
        checkAlive();
        return position != null;
    }

    @Override
    public RecordLocation location() {
        checkAlive();
        requirePositioned();
        return new RecordLocation(position);
    }

    @Override
    public JsonObject current() {
        checkAlive();
        requirePositioned();
        return current.copy();
    }

    @Override
    public void advance() {
        checkAlive();
        if (position == null) {
            return;
        }
        if (sorted != null) {
            sortedIndex++;
            seekSorted();
        } else {
            seekLive(position);
        }
    }

    @Override
    public boolean yieldPoint() {
        checkAlive();
        yields++;
        return !collection.isDropped();
    }

    @Override
    public long id() {
        return id;
    }

    long yieldCount() {
        return yields;
    }

    boolean isNoTimeout() {
        return options.isNoTimeout();
    }

    /**
     * Marks the cursor as timed out if it has been idle longer than the timeout.
     *
     * @return true if the cursor was expired by this call
     */
    boolean expireIfIdle(Instant now) {
        if (closed || options.isNoTimeout()) {
            return false;
        }
        if (Duration.between(lastAccess, now).compareTo(timeout) > 0) {
            timedOut = true;
            close();
            return true;
        }
        return false;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            store.cursorClosed(id);
        }
    }

    private void checkAlive() {
        Instant now = clock.instant();
        expireIfIdle(now);
        if (timedOut) {
            throw new CursorTimeoutException(collection.name(), id);
        }
        if (closed) {
            throw new IllegalStateException("Cursor " + id + " is closed");
        }
        lastAccess = now;
    }

    private void requirePositioned() {
        if (position == null) {
            throw new IllegalStateException("Cursor " + id + " is exhausted");
        }
    }
}
