package dev.mars.txtime.core.codec;

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
import dev.mars.txtime.api.Timestamp;
import dev.mars.txtime.api.TransactionClock;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.api.error.VersionInvariantException;
import dev.mars.txtime.api.query.ValueOrdering;
import io.vertx.core.json.JsonObject;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Encodes document versions: wraps plain documents into the first version of a chain,
 * closes current versions and builds successors.
 *
 * <p>A version carries its interval inside the identifier:</p>
 * <pre>{@code
 * {"_id": {"_id": "A-1", "transaction_start": {"$timestamp": {...}}, "transaction_end": null}, "qty": 5}
 * }</pre>
 *
 * <p>All operations return new documents and leave their arguments untouched. The only
 * side effect is drawing timestamps from the injected clock.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public class VersionCodec {

    private final TransactionClock clock;

    public VersionCodec(TransactionClock clock) {
        this.clock = Objects.requireNonNull(clock, "Transaction clock cannot be null");
    }

    public TransactionClock getClock() {
        return clock;
    }

    /**
     * Wraps a document into a current version starting now. Already wrapped documents are
     * returned unchanged and do not consume a timestamp.
     */
    public JsonObject wrap(JsonObject document) {
        Objects.requireNonNull(document, "Document cannot be null");
        if (isWrapped(document)) {
            return document;
        }
        return wrap(document, clock.next());
    }

    /**
     * Wraps a document into a current version starting at {@code start}. Idempotent: a
     * document whose identifier already carries an interval start is returned unchanged.
     * A missing identifier is replaced by a random UUID string.
     */
    public JsonObject wrap(JsonObject document, Timestamp start) {
        Objects.requireNonNull(document, "Document cannot be null");
        Objects.requireNonNull(start, "Start timestamp cannot be null");
        if (isWrapped(document)) {
            return document;
        }
        Object stableId = document.containsKey(TemporalFields.ID)
            ? document.getValue(TemporalFields.ID)
            : UUID.randomUUID().toString();
        JsonObject key = new JsonObject()
            .put(TemporalFields.ID, stableId)
            .put(TemporalFields.TRANSACTION_START, start.toDocument())
            .putNull(TemporalFields.TRANSACTION_END);
        JsonObject wrapped = new JsonObject().put(TemporalFields.ID, key);
        for (Map.Entry<String, Object> field : document.copy().getMap().entrySet()) {
            if (!TemporalFields.ID.equals(field.getKey())) {
                wrapped.put(field.getKey(), field.getValue());
            }
        }
        return wrapped;
    }

    /**
     * Closes a current version at the next clock value.
     *
     * @throws VersionInvariantException if the version is malformed or already closed,
     *         or the clock did not move past the version's start
     */
    public JsonObject close(JsonObject version) {
        JsonObject key = compositeKey(version);
        requireOpen(version, key);
        return close(version, clock.next());
    }

    /**
     * Closes a current version at {@code end}.
     */
    public JsonObject close(JsonObject version, Timestamp end) {
        Objects.requireNonNull(end, "End timestamp cannot be null");
        JsonObject key = compositeKey(version);
        requireOpen(version, key);
        Timestamp start = startOf(version, key);
        if (!end.isAfter(start)) {
            throw new VersionInvariantException(TxTimeErrorCodes.NON_MONOTONIC_CLOCK,
                "Cannot close version " + key.getValue(TemporalFields.ID) + " at " + end
                    + ": not after its start " + start);
        }
        JsonObject closedKey = new JsonObject();
        for (Map.Entry<String, Object> entry : key.getMap().entrySet()) {
            if (TemporalFields.TRANSACTION_END.equals(entry.getKey())) {
                closedKey.put(TemporalFields.TRANSACTION_END, end.toDocument());
            } else {
                closedKey.put(entry.getKey(), entry.getValue());
            }
        }
        JsonObject closed = version.copy();
        closed.put(TemporalFields.ID, closedKey);
        return closed;
    }

    /**
     * Builds the successor of a closed version: the stable identifier plus {@code newFields},
     * starting where the closed version ended.
     *
     * @throws VersionInvariantException if {@code closedPrevious} is still current
     * @throws TemporalValidationException if {@code newFields} names another identifier
     */
    public JsonObject advance(JsonObject newFields, JsonObject closedPrevious) {
        Objects.requireNonNull(newFields, "New fields cannot be null");
        JsonObject key = compositeKey(closedPrevious);
        Object end = key.getValue(TemporalFields.TRANSACTION_END);
        if (end == null) {
            throw new VersionInvariantException(TxTimeErrorCodes.ADVANCE_FROM_OPEN_VERSION,
                "Cannot advance from current version " + key.getValue(TemporalFields.ID));
        }
        Object stableId = key.getValue(TemporalFields.ID);
        if (newFields.containsKey(TemporalFields.ID)
                && !ValueOrdering.valueEquals(newFields.getValue(TemporalFields.ID), stableId)) {
            throw new TemporalValidationException(TxTimeErrorCodes.IDENTIFIER_CHANGED,
                "Successor of " + stableId + " cannot change its identifier to "
                    + newFields.getValue(TemporalFields.ID));
        }
        JsonObject successor = new JsonObject().put(TemporalFields.ID, stableId);
        for (Map.Entry<String, Object> field : newFields.copy().getMap().entrySet()) {
            if (!TemporalFields.ID.equals(field.getKey())) {
                successor.put(field.getKey(), field.getValue());
            }
        }
        return wrap(successor, Timestamp.fromDocument(end));
    }

    /**
     * Whether the document's identifier already carries an interval start.
     */
    public static boolean isWrapped(JsonObject document) {
        Object id = document.getValue(TemporalFields.ID);
        return id instanceof JsonObject && ((JsonObject) id).containsKey(TemporalFields.TRANSACTION_START);
    }

    /**
     * The stable identifier of a wrapped version.
     */
    public static Object stableId(JsonObject version) {
        return compositeKey(version).getValue(TemporalFields.ID);
    }

    /**
     * The document's fields without its identifier.
     */
    public static JsonObject fieldsOf(JsonObject document) {
        JsonObject fields = document.copy();
        fields.remove(TemporalFields.ID);
        return fields;
    }

    private static JsonObject compositeKey(JsonObject version) {
        Objects.requireNonNull(version, "Version cannot be null");
        Object id = version.getValue(TemporalFields.ID);
        if (!(id instanceof JsonObject) || !((JsonObject) id).containsKey(TemporalFields.TRANSACTION_END)) {
            throw new VersionInvariantException(TxTimeErrorCodes.MALFORMED_VERSION,
                "Document is not a version (no interval end in its identifier): " + version.encode());
        }
        return (JsonObject) id;
    }

    private static void requireOpen(JsonObject version, JsonObject key) {
        if (key.getValue(TemporalFields.TRANSACTION_END) != null) {
            throw new VersionInvariantException(TxTimeErrorCodes.CLOSE_HISTORIC_VERSION,
                "Version of " + key.getValue(TemporalFields.ID) + " is already closed: " + version.encode());
        }
    }

    private static Timestamp startOf(JsonObject version, JsonObject key) {
        Object start = key.getValue(TemporalFields.TRANSACTION_START);
        if (!Timestamp.isLiteral(start)) {
            throw new VersionInvariantException(TxTimeErrorCodes.MALFORMED_VERSION,
                "Version has no valid interval start: " + version.encode());
        }
        return Timestamp.fromDocument(start);
    }
}
