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
import dev.mars.txtime.api.query.ValueOrdering;
import dev.mars.txtime.api.store.DuplicateKeyException;
import dev.mars.txtime.api.store.IndexDefinition;
import dev.mars.txtime.api.store.StoreException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Index definitions of one collection, with key-tuple maps for the unique ones.
 *
 * <p>Missing key fields index as {@code null}. Non-unique indexes are kept as metadata
 * only; scans do not use them.</p>
 */
final class IndexCatalog {

    private static final Logger logger = LoggerFactory.getLogger(IndexCatalog.class);

    static final String ID_INDEX_NAME = "_id_";

    private static final Comparator<List<Object>> TUPLE_ORDER = (a, b) -> {
        for (int i = 0; i < a.size(); i++) {
            int result = ValueOrdering.compare(a.get(i), b.get(i));
            if (result != 0) {
                return result;
            }
        }
        return 0;
    };

    private final String collection;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    IndexCatalog(String collection) {
        this.collection = collection;
        IndexDefinition idIndex = IndexDefinition.builder(new JsonObject().put(TemporalFields.ID, 1))
            .name(ID_INDEX_NAME)
            .unique(true)
            .build();
        entries.put(ID_INDEX_NAME, new Entry(idIndex));
    }

    private static final class Entry {
        private final IndexDefinition definition;
        private final List<String> paths;
        private final TreeMap<List<Object>, Long> keys;

        private Entry(IndexDefinition definition) {
            this.definition = definition;
            this.paths = new ArrayList<>(definition.getKeys().fieldNames());
            this.keys = definition.isUnique() ? new TreeMap<>(TUPLE_ORDER) : null;
        }

        private List<Object> tuple(JsonObject document) {
            List<Object> tuple = new ArrayList<>(paths.size());
            for (String path : paths) {
                tuple.add(FieldPaths.resolve(document, path).value());
            }
            return tuple;
        }
    }

    /**
     * Adds an index, building its key map from {@code existing} records.
     *
     * @return false if an identical index already existed
     * @throws StoreException if an index with the same name but different options exists
     * @throws DuplicateKeyException if existing records violate a new unique index
     */
    boolean create(IndexDefinition definition, Map<Long, StoredRecord> existing) {
        Entry current = entries.get(definition.getName());
        if (current != null) {
            if (current.definition.equals(definition)) {
                return false;
            }
            throw new StoreException("Index '" + definition.getName() + "' already exists on "
                + collection + " with different options");
        }
        Entry entry = new Entry(definition);
        if (entry.keys != null) {
            for (Map.Entry<Long, StoredRecord> record : existing.entrySet()) {
                List<Object> tuple = entry.tuple(record.getValue().document());
                if (entry.keys.putIfAbsent(tuple, record.getKey()) != null) {
                    throw new DuplicateKeyException(collection, definition.getName(), tuple);
                }
            }
        }
        entries.put(definition.getName(), entry);
        logger.debug("Created index {} on {}", definition, collection);
        return true;
    }

    List<IndexDefinition> definitions() {
        List<IndexDefinition> result = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            result.add(entry.definition);
        }
        return result;
    }

    /**
     * Checks that {@code document} can be stored at {@code slot} without a duplicate key.
     * Keys already held by {@code slot} itself do not conflict.
     */
    void checkUnique(long slot, JsonObject document) {
        for (Entry entry : entries.values()) {
            if (entry.keys == null) {
                continue;
            }
            List<Object> tuple = entry.tuple(document);
            Long holder = entry.keys.get(tuple);
            if (holder != null && holder != slot) {
                throw new DuplicateKeyException(collection, entry.definition.getName(), tuple);
            }
        }
    }

    void add(long slot, JsonObject document) {
        for (Entry entry : entries.values()) {
            if (entry.keys != null) {
                entry.keys.put(entry.tuple(document), slot);
            }
        }
    }

    void remove(long slot, JsonObject document) {
        for (Entry entry : entries.values()) {
            if (entry.keys != null) {
                entry.keys.remove(entry.tuple(document), slot);
            }
        }
    }
}
