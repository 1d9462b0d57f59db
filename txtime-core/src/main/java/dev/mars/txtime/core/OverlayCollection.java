package dev.mars.txtime.core;

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

import dev.mars.txtime.api.DeleteOptions;
import dev.mars.txtime.api.DeleteResult;
import dev.mars.txtime.api.DocumentVersion;
import dev.mars.txtime.api.FindOptions;
import dev.mars.txtime.api.OperationContext;
import dev.mars.txtime.api.TemporalFields;
import dev.mars.txtime.api.UpdateOptions;
import dev.mars.txtime.api.UpdateResult;
import dev.mars.txtime.api.VersionedCollection;
import dev.mars.txtime.api.error.OrphanedCloseException;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.api.store.CursorOptions;
import dev.mars.txtime.api.store.DocumentStore;
import dev.mars.txtime.api.store.IndexDefinition;
import dev.mars.txtime.api.store.StoreCursor;
import dev.mars.txtime.core.codec.VersionCodec;
import dev.mars.txtime.core.index.IndexShaper;
import dev.mars.txtime.core.mutation.MutationProtocol;
import dev.mars.txtime.core.query.CompiledQuery;
import dev.mars.txtime.core.query.TemporalPredicateCompiler;
import dev.mars.txtime.core.update.UpdateSpec;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link VersionedCollection} backed by a {@link DocumentStore}. Instances are obtained
 * from {@link TemporalOverlay}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public class OverlayCollection implements VersionedCollection {

    private static final Logger logger = LoggerFactory.getLogger(OverlayCollection.class);

    private final String name;
    private final boolean temporal;
    private final DocumentStore store;
    private final MutationProtocol protocol;

    OverlayCollection(String name, boolean temporal, DocumentStore store, MutationProtocol protocol) {
        this.name = Objects.requireNonNull(name, "Collection name cannot be null");
        this.temporal = temporal;
        this.store = Objects.requireNonNull(store, "Document store cannot be null");
        this.protocol = Objects.requireNonNull(protocol, "Mutation protocol cannot be null");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isTemporal() {
        return temporal;
    }

    @Override
    public JsonObject insert(JsonObject document) {
        return protocol.insert(name, temporal, document);
    }

    @Override
    public List<JsonObject> insertMany(List<JsonObject> documents) {
        List<JsonObject> stored = new ArrayList<>(documents.size());
        for (JsonObject document : documents) {
            stored.add(insert(document));
        }
        return stored;
    }

    @Override
    public List<JsonObject> find(JsonObject query, FindOptions options) {
        CompiledQuery compiled = TemporalPredicateCompiler.compileQuery(query, temporal);
        JsonObject sort = temporal ? TemporalPredicateCompiler.rewriteSort(options.getSort()) : options.getSort();
        CursorOptions cursorOptions = CursorOptions.builder()
            .sort(sort)
            .skip(options.getSkip())
            .limit(options.getLimit())
            .build();
        logger.trace("find on {}: {} ({})", name, compiled.predicate().encode(), compiled.selector());
        List<JsonObject> results = new ArrayList<>();
        try (StoreCursor cursor = store.openCursor(name, compiled.predicate(), cursorOptions)) {
            while (cursor.ok()) {
                results.add(cursor.current());
                cursor.advance();
            }
        }
        return results;
    }

    @Override
    public Optional<JsonObject> findOne(JsonObject query) {
        List<JsonObject> results = find(query, FindOptions.defaults().withLimit(1));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public long count(JsonObject query) {
        CompiledQuery compiled = TemporalPredicateCompiler.compileQuery(query, temporal);
        long count = 0;
        try (StoreCursor cursor = store.openCursor(name, compiled.predicate(), CursorOptions.defaults())) {
            while (cursor.ok()) {
                count++;
                cursor.advance();
            }
        }
        return count;
    }

    @Override
    public UpdateResult update(JsonObject query, JsonObject update, UpdateOptions options, OperationContext context) {
        UpdateSpec spec = UpdateSpec.parse(update, options.multi());
        JsonObject predicate = mutationPredicate(query);
        UpdateResult result = protocol.update(name, temporal, predicate, spec, options, context);
        if (result.matched() == 0 && options.upsert() && !result.interrupted()) {
            JsonObject stored = protocol.insert(name, temporal, spec.upsertSeed(query));
            Object upsertedId = temporal ? VersionCodec.stableId(stored) : stored.getValue(TemporalFields.ID);
            logger.debug("Upserted {} into {}", upsertedId, name);
            return new UpdateResult(0, 0, upsertedId, false);
        }
        return result;
    }

    @Override
    public DeleteResult delete(JsonObject query, DeleteOptions options, OperationContext context) {
        return protocol.delete(name, temporal, mutationPredicate(query), options, context);
    }

    @Override
    public IndexDefinition createIndex(IndexDefinition definition) {
        IndexDefinition persisted = temporal ? IndexShaper.shape(definition) : definition;
        store.createIndex(name, persisted);
        return persisted;
    }

    @Override
    public List<DocumentVersion> history(Object stableId) {
        if (!temporal) {
            throw new TemporalValidationException(TxTimeErrorCodes.NOT_TEMPORAL_COLLECTION,
                "Collection " + name + " keeps no version history");
        }
        JsonObject predicate = new JsonObject().put(TemporalFields.STABLE_ID_PATH, stableId);
        CursorOptions options = CursorOptions.builder()
            .sort(new JsonObject().put(TemporalFields.TRANSACTION_START_PATH, 1))
            .build();
        List<DocumentVersion> versions = new ArrayList<>();
        try (StoreCursor cursor = store.openCursor(name, predicate, options)) {
            while (cursor.ok()) {
                versions.add(DocumentVersion.of(cursor.current()));
                cursor.advance();
            }
        }
        return versions;
    }

    @Override
    public JsonObject reconcile(OrphanedCloseException orphaned) {
        if (!name.equals(orphaned.getCollection())) {
            throw new IllegalArgumentException("Orphaned close belongs to collection "
                + orphaned.getCollection() + ", not " + name);
        }
        return protocol.completeOrphaned(orphaned);
    }

    private JsonObject mutationPredicate(JsonObject query) {
        return temporal
            ? TemporalPredicateCompiler.compileMutationQuery(query)
            : TemporalPredicateCompiler.compileQuery(query, false).predicate();
    }

    @Override
    public String toString() {
        return "OverlayCollection{name='" + name + "', temporal=" + temporal + "}";
    }
}
