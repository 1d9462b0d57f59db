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

import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.api.error.VersionInvariantException;
import io.vertx.core.json.JsonObject;

import java.util.Objects;

/**
 * Read-only view of one physical version: the stable identifier, the transaction-time
 * interval and the document's own fields.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public final class DocumentVersion {

    private final Object stableId;
    private final Interval interval;
    private final JsonObject fields;
    private final JsonObject document;

    private DocumentVersion(Object stableId, Interval interval, JsonObject fields, JsonObject document) {
        this.stableId = stableId;
        this.interval = interval;
        this.fields = fields;
        this.document = document;
    }

    /**
     * Reads a stored version document.
     *
     * @throws VersionInvariantException if the document does not carry a composite key
     */
    public static DocumentVersion of(JsonObject document) {
        Objects.requireNonNull(document, "Version document cannot be null");
        Object id = document.getValue(TemporalFields.ID);
        if (!(id instanceof JsonObject)) {
            throw malformed(document, "identifier is not a composite key");
        }
        JsonObject key = (JsonObject) id;
        if (!key.containsKey(TemporalFields.TRANSACTION_START) || !key.containsKey(TemporalFields.TRANSACTION_END)) {
            throw malformed(document, "composite key lacks interval fields");
        }
        Object start = key.getValue(TemporalFields.TRANSACTION_START);
        Object end = key.getValue(TemporalFields.TRANSACTION_END);
        if (!Timestamp.isLiteral(start) || (end != null && !Timestamp.isLiteral(end))) {
            throw malformed(document, "interval fields are not timestamps");
        }
        Interval interval;
        try {
            interval = new Interval(Timestamp.fromDocument(start), end == null ? null : Timestamp.fromDocument(end));
        } catch (IllegalArgumentException e) {
            throw malformed(document, e.getMessage());
        }
        JsonObject fields = document.copy();
        fields.remove(TemporalFields.ID);
        return new DocumentVersion(key.getValue(TemporalFields.ID), interval, fields, document.copy());
    }

    private static VersionInvariantException malformed(JsonObject document, String reason) {
        return new VersionInvariantException(TxTimeErrorCodes.MALFORMED_VERSION,
            "Malformed version (" + reason + "): " + document.encode());
    }

    public Object getStableId() {
        return stableId;
    }

    public Interval getInterval() {
        return interval;
    }

    public boolean isCurrent() {
        return interval.isOpen();
    }

    /**
     * The version's fields without the composite key.
     */
    public JsonObject getFields() {
        return fields.copy();
    }

    /**
     * The full stored document.
     */
    public JsonObject toDocument() {
        return document.copy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return document.equals(((DocumentVersion) o).document);
    }

    @Override
    public int hashCode() {
        return document.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentVersion{id=" + stableId + ", interval=" + interval + ", fields=" + fields.encode() + "}";
    }
}
