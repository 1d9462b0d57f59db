package dev.mars.txtime.core.mutation;

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
import dev.mars.txtime.api.OperationContext;
import dev.mars.txtime.api.TemporalFields;
import dev.mars.txtime.api.UpdateOptions;
import dev.mars.txtime.api.UpdateResult;
import dev.mars.txtime.api.error.DocumentTooLargeException;
import dev.mars.txtime.api.error.OrphanedCloseException;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.api.error.VersionInvariantException;
import dev.mars.txtime.api.query.ValueOrdering;
import dev.mars.txtime.api.store.CursorOptions;
import dev.mars.txtime.api.store.DocumentStore;
import dev.mars.txtime.api.store.RecordLocation;
import dev.mars.txtime.api.store.StoreCursor;
import dev.mars.txtime.api.store.StoreException;
import dev.mars.txtime.core.codec.VersionCodec;
import dev.mars.txtime.core.config.TxTimeConfiguration.MutationConfig;
import dev.mars.txtime.core.metrics.TxTimeMetrics;
import dev.mars.txtime.core.update.UpdateSpec;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Executes inserts, updates and deletes against the store.
 *
 * <p>On temporal collections an update closes the current version with a
 * compare-on-location write and inserts its successor; a delete only closes. Plain
 * collections are updated in place and removed physically.</p>
 *
 * <p>Multi-document operations scan with a no-timeout cursor. The cursor is moved past a
 * candidate before anything is written, and every location written by the scan is
 * remembered so that a relocated or newly inserted record is never transitioned twice.
 * Every {@code yieldInterval} scanned documents the scan yields, which is where a
 * cancelled {@link OperationContext} takes effect.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public class MutationProtocol {

    private static final Logger logger = LoggerFactory.getLogger(MutationProtocol.class);

    private final DocumentStore store;
    private final VersionCodec codec;
    private final MutationConfig config;
    private final TxTimeMetrics metrics;

    public MutationProtocol(DocumentStore store, VersionCodec codec, MutationConfig config, TxTimeMetrics metrics) {
        this.store = Objects.requireNonNull(store, "Document store cannot be null");
        this.codec = Objects.requireNonNull(codec, "Version codec cannot be null");
        this.config = Objects.requireNonNull(config, "Mutation config cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
    }

    /**
     * Inserts a document, wrapping it into the first version of a chain on temporal
     * collections.
     *
     * @return the stored document
     */
    public JsonObject insert(String collection, boolean temporal, JsonObject document) {
        Objects.requireNonNull(document, "Document cannot be null");
        JsonObject stored = temporal ? codec.wrap(document) : withIdentifier(document);
        checkSize(stored);
        store.insert(collection, stored);
        if (temporal) {
            metrics.recordVersionInserted(collection);
        }
        logger.debug("Inserted document {} into {}", stored.getValue(TemporalFields.ID), collection);
        return stored;
    }

    /**
     * Updates the documents matching a compiled predicate.
     *
     * @param predicate store-level predicate, already restricted to current versions on
     *                  temporal collections
     */
    public UpdateResult update(String collection, boolean temporal, JsonObject predicate, UpdateSpec spec,
                               UpdateOptions options, OperationContext context) {
        long started = System.nanoTime();
        try {
            ScanResult result = scan(collection, predicate, !options.multi(), context,
                (location, document, seen) -> temporal
                    ? transition(collection, location, document, spec, seen)
                    : updateInPlace(collection, location, document, spec, seen));
            logger.debug("Update of {} matched {} and modified {} document(s){}", collection, result.matched,
                result.modified, result.interrupted ? " before being interrupted" : "");
            return new UpdateResult(result.matched, result.modified, null, result.interrupted);
        } catch (VersionInvariantException e) {
            logger.error("Version invariant violated while updating {}: [{}] {}", collection, e.getCode(), e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordMutation(collection, "update", Duration.ofNanos(System.nanoTime() - started));
        }
    }

    /**
     * Deletes the documents matching a compiled predicate: closes them on temporal
     * collections, removes them otherwise.
     */
    public DeleteResult delete(String collection, boolean temporal, JsonObject predicate, DeleteOptions options,
                               OperationContext context) {
        long started = System.nanoTime();
        try {
            ScanResult result = scan(collection, predicate, options.justOne(), context,
                (location, document, seen) -> temporal
                    ? closeOnly(collection, location, document, seen)
                    : store.remove(collection, location, document));
            logger.debug("Delete on {} removed {} document(s){}", collection, result.modified,
                result.interrupted ? " before being interrupted" : "");
            return new DeleteResult(result.modified, result.interrupted);
        } catch (VersionInvariantException e) {
            logger.error("Version invariant violated while deleting from {}: [{}] {}", collection, e.getCode(), e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordMutation(collection, "delete", Duration.ofNanos(System.nanoTime() - started));
        }
    }

    /**
     * Inserts the successor carried by an orphaned close, restoring a current version
     * to the chain.
     *
     * @throws VersionInvariantException with {@code ORPHANED_CLOSE} if the chain already
     *         has a current version again
     */
    public JsonObject completeOrphaned(OrphanedCloseException orphaned) {
        String collection = orphaned.getCollection();
        JsonObject successor = orphaned.getSuccessor();
        JsonObject currentOfChain = new JsonObject()
            .put(TemporalFields.STABLE_ID_PATH, orphaned.getStableId())
            .putNull(TemporalFields.TRANSACTION_END_PATH);
        try (StoreCursor cursor = store.openCursor(collection, currentOfChain, CursorOptions.defaults())) {
            if (cursor.ok()) {
                throw new VersionInvariantException(TxTimeErrorCodes.ORPHANED_CLOSE,
                    "Chain " + orphaned.getStableId() + " in " + collection + " already has a current version");
            }
        }
        insertSuccessor(collection, successor);
        metrics.recordVersionInserted(collection);
        logger.info("Reconciled orphaned close of {} in {}", orphaned.getStableId(), collection);
        return successor;
    }

    @FunctionalInterface
    private interface DocumentAction {
        boolean apply(RecordLocation location, JsonObject document, Set<RecordLocation> seen);
    }

    private static final class ScanResult {
        long matched;
        long modified;
        boolean interrupted;
    }

    private ScanResult scan(String collection, JsonObject predicate, boolean justOne, OperationContext context,
                            DocumentAction action) {
        ScanResult result = new ScanResult();
        Set<RecordLocation> seen = new HashSet<>();
        int yieldInterval = config.getYieldInterval();
        long scanned = 0;
        CursorOptions cursorOptions = CursorOptions.builder().noTimeout(true).build();
        try (StoreCursor cursor = store.openCursor(collection, predicate, cursorOptions)) {
            while (cursor.ok()) {
                if (scanned > 0 && scanned % yieldInterval == 0) {
                    boolean canContinue = cursor.yieldPoint();
                    context.yielded(scanned);
                    if (context.isCancelled() || !canContinue || !cursor.ok()) {
                        logger.debug("Scan of {} stopped at yield point after {} document(s)", collection, scanned);
                        result.interrupted = context.isCancelled() || !canContinue;
                        break;
                    }
                }
                RecordLocation location = cursor.location();
                JsonObject document = cursor.current();
                cursor.advance();
                scanned++;
                if (!seen.add(location)) {
                    continue;
                }
                result.matched++;
                if (action.apply(location, document, seen)) {
                    result.modified++;
                }
                if (justOne) {
                    break;
                }
            }
        }
        return result;
    }

    private boolean transition(String collection, RecordLocation location, JsonObject current, UpdateSpec spec,
                               Set<RecordLocation> seen) {
        Object stableId = VersionCodec.stableId(current);
        MutationState state = MutationState.MATCH;
        JsonObject newFields = spec.apply(VersionCodec.fieldsOf(current));

        state = trace(stableId, state, MutationState.CLOSE);
        JsonObject closed = codec.close(current);
        state = trace(stableId, state, MutationState.ADVANCE);
        JsonObject successor = codec.advance(newFields, closed);
        checkSize(closed);
        checkSize(successor);

        RecordLocation closedLocation = store.update(collection, location, current, closed);
        seen.add(closedLocation);
        metrics.recordVersionClosed(collection);

        state = trace(stableId, state, MutationState.INSERT);
        RecordLocation successorLocation;
        try {
            successorLocation = insertSuccessor(collection, successor);
        } catch (StoreException e) {
            trace(stableId, state, MutationState.ORPHANED_CLOSE);
            throw recover(collection, stableId, current, closed, closedLocation, successor, e);
        }
        seen.add(successorLocation);
        metrics.recordVersionInserted(collection);
        trace(stableId, state, MutationState.DONE);
        return true;
    }

    private boolean closeOnly(String collection, RecordLocation location, JsonObject current, Set<RecordLocation> seen) {
        JsonObject closed = codec.close(current);
        checkSize(closed);
        seen.add(store.update(collection, location, current, closed));
        metrics.recordVersionClosed(collection);
        logger.trace("Closed {} in {}", VersionCodec.stableId(current), collection);
        return true;
    }

    private boolean updateInPlace(String collection, RecordLocation location, JsonObject current, UpdateSpec spec,
                                  Set<RecordLocation> seen) {
        Object id = current.getValue(TemporalFields.ID);
        JsonObject newFields = spec.apply(VersionCodec.fieldsOf(current));
        if (newFields.containsKey(TemporalFields.ID)
                && !ValueOrdering.valueEquals(newFields.getValue(TemporalFields.ID), id)) {
            throw new TemporalValidationException(TxTimeErrorCodes.IDENTIFIER_CHANGED,
                "Update cannot change the identifier of " + id + " to " + newFields.getValue(TemporalFields.ID));
        }
        JsonObject replacement = new JsonObject().put(TemporalFields.ID, id);
        for (Map.Entry<String, Object> field : newFields.getMap().entrySet()) {
            if (!TemporalFields.ID.equals(field.getKey())) {
                replacement.put(field.getKey(), field.getValue());
            }
        }
        if (replacement.equals(current)) {
            return false;
        }
        checkSize(replacement);
        seen.add(store.update(collection, location, current, replacement));
        return true;
    }

    private RecordLocation insertSuccessor(String collection, JsonObject successor) {
        int retries = config.getInsertRetries();
        for (int attempt = 0; ; attempt++) {
            try {
                return store.insert(collection, successor);
            } catch (StoreException e) {
                if (!e.isRetryable() || attempt >= retries) {
                    throw e;
                }
                logger.warn("Successor insert into {} failed (attempt {}/{}), retrying: {}",
                    collection, attempt + 1, retries + 1, e.getMessage());
            }
        }
    }

    private RuntimeException recover(String collection, Object stableId, JsonObject original, JsonObject closed,
                                     RecordLocation closedLocation, JsonObject successor, StoreException insertError) {
        metrics.recordOrphanedClose(collection);
        logger.warn("Successor of {} in {} could not be inserted after closing its previous version: {}",
            stableId, collection, insertError.getMessage());
        if (config.getRecoveryPolicy() == RecoveryPolicy.COMPENSATE) {
            try {
                store.update(collection, closedLocation, closed, original);
                metrics.recordCompensation(collection);
                logger.warn("Re-opened version of {} in {} after failed successor insert", stableId, collection);
                return insertError;
            } catch (StoreException compensationError) {
                logger.error("Could not re-open version of {} in {}: {}", stableId, collection,
                    compensationError.getMessage(), compensationError);
                OrphanedCloseException orphaned =
                    new OrphanedCloseException(collection, stableId, closed, successor, insertError);
                orphaned.addSuppressed(compensationError);
                return orphaned;
            }
        }
        return new OrphanedCloseException(collection, stableId, closed, successor, insertError);
    }

    private MutationState trace(Object stableId, MutationState from, MutationState to) {
        logger.trace("{}: {} -> {}", stableId, from, to);
        return to;
    }

    private void checkSize(JsonObject document) {
        int size = document.encode().getBytes(StandardCharsets.UTF_8).length;
        if (size > config.getMaxDocumentSize()) {
            throw new DocumentTooLargeException(size, config.getMaxDocumentSize());
        }
    }

    private static JsonObject withIdentifier(JsonObject document) {
        if (document.containsKey(TemporalFields.ID)) {
            return document.copy();
        }
        JsonObject withId = new JsonObject().put(TemporalFields.ID, UUID.randomUUID().toString());
        for (Map.Entry<String, Object> field : document.copy().getMap().entrySet()) {
            withId.put(field.getKey(), field.getValue());
        }
        return withId;
    }
}
