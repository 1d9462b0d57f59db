package dev.mars.txtime.api.store;

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

import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The primitive document store underneath the versioning overlay.
 *
 * <p>Implementations provide per-record atomicity: each primitive either applies completely
 * or not at all. {@link #update} and {@link #remove} compare the record at the given location
 * against the expected document before writing, so two writers cannot both transition the
 * same version.</p>
 */
public interface DocumentStore {

    /**
     * Creates a collection.
     *
     * @throws StoreException if the collection already exists
     */
    void createCollection(String collection, CollectionOptions options);

    Optional<CollectionOptions> getCollectionOptions(String collection);

    Set<String> listCollections();

    boolean dropCollection(String collection);

    /**
     * Point lookup by location.
     */
    Optional<JsonObject> findByLocation(String collection, RecordLocation location);

    /**
     * Inserts a record.
     *
     * @return the location of the new record
     * @throws DuplicateKeyException if a unique index would be violated
     */
    RecordLocation insert(String collection, JsonObject document);

    /**
     * Replaces the record at {@code location} if it still equals {@code expected}.
     *
     * @return the record's location after the update; differs from {@code location} when the
     *         store had to move the record
     * @throws WriteConflictException if the record is gone or differs from {@code expected}
     * @throws DuplicateKeyException if a unique index would be violated
     */
    RecordLocation update(String collection, RecordLocation location, JsonObject expected, JsonObject replacement);

    /**
     * Removes the record at {@code location} if it still equals {@code expected}.
     *
     * @return true if a record was removed
     */
    boolean remove(String collection, RecordLocation location, JsonObject expected);

    /**
     * Opens a cursor over the records matching {@code predicate}.
     */
    StoreCursor openCursor(String collection, JsonObject predicate, CursorOptions options);

    /**
     * Persists an index definition and builds the index.
     *
     * @throws DuplicateKeyException if existing records violate a unique index
     */
    void createIndex(String collection, IndexDefinition definition);

    List<IndexDefinition> listIndexes(String collection);
}
