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

import dev.mars.txtime.api.TemporalFields;
import dev.mars.txtime.api.store.CollectionOptions;
import dev.mars.txtime.api.store.IndexDefinition;
import dev.mars.txtime.api.store.RecordLocation;
import dev.mars.txtime.api.store.WriteConflictException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Records, free slots and indexes of one collection.
 *
 * <p>Writes are serialized on the collection's monitor. Reads go through the concurrent
 * record map and never block writers. Each record reserves {@code size * paddingFactor}
 * bytes; an update that no longer fits moves the record to another slot.</p>
 */
final class MemoryCollection {

    private static final Logger logger = LoggerFactory.getLogger(MemoryCollection.class);

    private final String name;
    private final CollectionOptions options;
    private final boolean reuseSlots;
    private final double paddingFactor;
    private final ConcurrentSkipListMap<Long, StoredRecord> records = new ConcurrentSkipListMap<>();
    private final TreeMap<Long, Integer> freeSlots = new TreeMap<>();
    private final IndexCatalog indexes;
    private long nextSlot = 1;
    private long relocations;
    private volatile boolean dropped;

    MemoryCollection(String name, CollectionOptions options, boolean reuseSlots, double paddingFactor) {
        this.name = name;
        this.options = options;
        this.reuseSlots = reuseSlots;
        this.paddingFactor = paddingFactor;
        this.indexes = new IndexCatalog(name);
    }

    String name() {
        return name;
    }

    CollectionOptions options() {
        return options;
    }

    NavigableMap<Long, StoredRecord> records() {
        return records;
    }

    boolean isDropped() {
        return dropped;
    }

    void markDropped() {
        dropped = true;
    }

    Optional<JsonObject> find(RecordLocation location) {
        StoredRecord record = records.get(location.slot());
        return record == null ? Optional.empty() : Optional.of(record.document().copy());
    }

    synchronized RecordLocation insert(JsonObject document) {
        JsonObject stored = withIdentifier(document);
        indexes.checkUnique(-1, stored);
        int size = encodedSize(stored);
        long slot = allocate(size);
        records.put(slot, new StoredRecord(stored, size, capacityFor(slot, size)));
        freeSlots.remove(slot);
        indexes.add(slot, stored);
        return new RecordLocation(slot);
    }

    synchronized RecordLocation update(RecordLocation location, JsonObject expected, JsonObject replacement) {
        StoredRecord existing = records.get(location.slot());
        if (existing == null || !existing.document().equals(expected)) {
            throw new WriteConflictException(name, location);
        }
        JsonObject stored = replacement.copy();
        indexes.checkUnique(location.slot(), stored);
        int size = encodedSize(stored);
        indexes.remove(location.slot(), existing.document());
        if (existing.fits(size)) {
            records.put(location.slot(), new StoredRecord(stored, size, existing.capacity()));
            indexes.add(location.slot(), stored);
            return location;
        }
        long slot = allocate(size);
        records.put(slot, new StoredRecord(stored, size, capacityFor(slot, size)));
        freeSlots.remove(slot);
        release(location.slot(), existing);
        indexes.add(slot, stored);
        relocations++;
        logger.debug("Relocated record in {} from {} to loc:{} ({} -> {} bytes)",
            name, location, slot, existing.size(), size);
        return new RecordLocation(slot);
    }

    synchronized boolean remove(RecordLocation location, JsonObject expected) {
        StoredRecord existing = records.get(location.slot());
        if (existing == null || (expected != null && !existing.document().equals(expected))) {
            return false;
        }
        release(location.slot(), existing);
        indexes.remove(location.slot(), existing.document());
        return true;
    }

    synchronized boolean createIndex(IndexDefinition definition) {
        return indexes.create(definition, records);
    }

    synchronized List<IndexDefinition> listIndexes() {
        return indexes.definitions();
    }

    synchronized long relocationCount() {
        return relocations;
    }

    synchronized int freeSlotCount() {
        return freeSlots.size();
    }

    private void release(long slot, StoredRecord record) {
        records.remove(slot);
        if (reuseSlots) {
            freeSlots.put(slot, record.capacity());
        }
    }

    /**
     * First free slot large enough, else a new slot at the end.
     */
    private long allocate(int size) {
        if (reuseSlots) {
            for (Map.Entry<Long, Integer> free : freeSlots.entrySet()) {
                if (free.getValue() >= size) {
                    return free.getKey();
                }
            }
        }
        return nextSlot++;
    }

    private int capacityFor(long slot, int size) {
        Integer reused = freeSlots.get(slot);
        if (reused != null) {
            return reused;
        }
        return Math.max(size, (int) Math.ceil(size * paddingFactor));
    }

    private static JsonObject withIdentifier(JsonObject document) {
        if (document.containsKey(TemporalFields.ID)) {
            return document.copy();
        }
        JsonObject stored = new JsonObject().put(TemporalFields.ID, UUID.randomUUID().toString());
        for (Map.Entry<String, Object> field : document.copy().getMap().entrySet()) {
            stored.put(field.getKey(), field.getValue());
        }
        return stored;
    }

    static int encodedSize(JsonObject document) {
        return document.encode().getBytes(StandardCharsets.UTF_8).length;
    }
}
