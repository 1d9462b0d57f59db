package dev.mars.txtime.api;

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

import dev.mars.txtime.api.error.OrphanedCloseException;
import dev.mars.txtime.api.store.IndexDefinition;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Optional;

/**
 * A collection seen through the versioning overlay.
 *
 * <p>On a temporal collection, updates and deletes never overwrite or remove a document:
 * the current version is closed and, for updates, a successor version is inserted. Finds
 * return current versions unless the query carries a temporal selector under the reserved
 * {@code transaction} field:</p>
 * <pre>{@code
 * collection.find(new JsonObject().put("sku", "A-1")
 *     .put("transaction", new JsonObject().put("at", Timestamp.ofSeconds(2500).toDocument())));
 * }</pre>
 *
 * <p>Plain (non-temporal) collections behave like the underlying store.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public interface VersionedCollection {

    String getName();

    boolean isTemporal();

    /**
     * Inserts a document, starting a new version chain on temporal collections.
     *
     * @return the stored document
     */
    JsonObject insert(JsonObject document);

    List<JsonObject> insertMany(List<JsonObject> documents);

    List<JsonObject> find(JsonObject query, FindOptions options);

    default List<JsonObject> find(JsonObject query) {
        return find(query, FindOptions.defaults());
    }

    Optional<JsonObject> findOne(JsonObject query);

    long count(JsonObject query);

    UpdateResult update(JsonObject query, JsonObject update, UpdateOptions options, OperationContext context);

    default UpdateResult update(JsonObject query, JsonObject update, UpdateOptions options) {
        return update(query, update, options, OperationContext.create());
    }

    DeleteResult delete(JsonObject query, DeleteOptions options, OperationContext context);

    default DeleteResult delete(JsonObject query, DeleteOptions options) {
        return delete(query, options, OperationContext.create());
    }

    /**
     * Creates an index, shaping the key spec on temporal collections.
     *
     * @return the definition as persisted
     */
    IndexDefinition createIndex(IndexDefinition definition);

    /**
     * All retained versions of one logical document, oldest first.
     */
    List<DocumentVersion> history(Object stableId);

    /**
     * Completes a transition that was left without a current version.
     *
     * @return the inserted successor
     */
    JsonObject reconcile(OrphanedCloseException orphaned);
}
