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

import dev.mars.txtime.api.Timestamp;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.test.categories.TestCategories;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("Query predicate evaluation")
class DocumentMatcherTest {

    private static final JsonObject DOC = new JsonObject()
        .put("_id", "a")
        .put("sku", "A-1")
        .put("qty", 5)
        .put("tags", new JsonArray().add("x").add("y"))
        .put("nested", new JsonObject().put("level", 2))
        .putNull("end");

    private static JsonObject version(Timestamp start, Timestamp end) {
        return new JsonObject().put("_id", new JsonObject()
            .put("_id", "a")
            .put("transaction_start", start.toDocument())
            .put("transaction_end", end == null ? null : end.toDocument()));
    }

    private static JsonObject op(String operator, Object operand) {
        return new JsonObject().put(operator, operand);
    }

    @Test
    @DisplayName("Should match equality on values, arrays and dotted paths")
    void testEquality() {
        assertTrue(DocumentMatcher.matches(DOC, new JsonObject().put("sku", "A-1")));
        assertTrue(DocumentMatcher.matches(DOC, new JsonObject().put("qty", 5L)));
        assertTrue(DocumentMatcher.matches(DOC, new JsonObject().put("tags", "x")));
        assertTrue(DocumentMatcher.matches(DOC, new JsonObject().put("nested.level", 2)));
        assertFalse(DocumentMatcher.matches(DOC, new JsonObject().put("sku", "B-2")));
        assertTrue(DocumentMatcher.matches(DOC, new JsonObject()));
    }

    @Test
    @DisplayName("Should match null against stored null and missing fields")
    void testNullEquality() {
        assertTrue(DocumentMatcher.matches(DOC, new JsonObject().putNull("end")));
        assertTrue(DocumentMatcher.matches(DOC, new JsonObject().putNull("missing")));
        assertFalse(DocumentMatcher.matches(DOC, new JsonObject().putNull("sku")));
    }

    @Test
    @DisplayName("Should evaluate comparison, membership and existence operators")
    void testOperators() {
        assertTrue(DocumentMatcher.matches(DOC, new JsonObject().put("qty", op("$gt", 4))));
        assertFalse(DocumentMatcher.matches(DOC, new JsonObject().put("qty", op("$gt", "4"))));
        assertTrue(DocumentMatcher.matches(DOC, new JsonObject().put("qty", op("$lte", 5.0))));
        assertFalse(DocumentMatcher.matches(DOC, new JsonObject().put("qty", op("$ne", 5))));
        assertTrue(DocumentMatcher.matches(DOC,
            new JsonObject().put("nested.level", op("$in", new JsonArray().add(1).add(2)))));
        assertFalse(DocumentMatcher.matches(DOC, new JsonObject().put("qty", op("$nin", new JsonArray().add(5)))));
        assertTrue(DocumentMatcher.matches(DOC, new JsonObject().put("missing", op("$exists", false))));
        assertTrue(DocumentMatcher.matches(DOC, new JsonObject().put("end", op("$exists", true))));
    }

    @Test
    @DisplayName("Should combine clauses with $and, $or and $nor")
    void testLogicalOperators() {
        JsonObject or = new JsonObject().put("$or", new JsonArray()
            .add(new JsonObject().put("sku", "B-2"))
            .add(new JsonObject().put("qty", 5)));
        JsonObject nor = new JsonObject().put("$nor", new JsonArray().add(new JsonObject().put("qty", 5)));
        JsonObject and = new JsonObject().put("$and", new JsonArray()
            .add(new JsonObject().put("qty", op("$gte", 5)))
            .add(new JsonObject().put("qty", op("$lte", 5))));

        assertTrue(DocumentMatcher.matches(DOC, or));
        assertFalse(DocumentMatcher.matches(DOC, nor));
        assertTrue(DocumentMatcher.matches(DOC, and));
    }

    @Test
    @DisplayName("Should treat an Open interval end as greater than any timestamp")
    void testOpenAwareOperators() {
        JsonObject current = version(Timestamp.ofSeconds(1000), null);
        JsonObject closed = version(Timestamp.ofSeconds(1000), Timestamp.ofSeconds(2000));
        JsonObject afterT2 = new JsonObject().put("_id.transaction_end",
            op("$tgt", Timestamp.ofSeconds(2000).toDocument()));

        assertTrue(DocumentMatcher.matches(current, afterT2));
        assertFalse(DocumentMatcher.matches(closed, afterT2));
        assertTrue(DocumentMatcher.matches(closed, new JsonObject().put("_id.transaction_end",
            op("$tgte", Timestamp.ofSeconds(2000).toDocument()))));
        assertFalse(DocumentMatcher.matches(closed, new JsonObject().put("_id.missing",
            op("$tlt", Timestamp.ofSeconds(5000).toDocument()))));
        assertFalse(DocumentMatcher.matches(current, new JsonObject().put("_id.transaction_end",
            op("$gt", Timestamp.ofSeconds(2000).toDocument()))));
    }

    @Test
    @DisplayName("Should treat timestamp literals as values, not operator documents")
    void testTimestampLiteralEquality() {
        JsonObject current = version(Timestamp.ofSeconds(1000), null);

        assertTrue(DocumentMatcher.matches(current,
            new JsonObject().put("_id.transaction_start", Timestamp.ofSeconds(1000).toDocument())));
        assertFalse(DocumentMatcher.matches(current,
            new JsonObject().put("_id.transaction_start", new Timestamp(1000, 1).toDocument())));
    }

    @Test
    @DisplayName("Should compare stored instants with instant operands")
    void testInstantComparison() {
        Instant created = Instant.parse("2025-06-01T10:00:00Z");
        JsonObject document = new JsonObject().put("created", created);

        assertTrue(DocumentMatcher.matches(document,
            new JsonObject().put("created", op("$lt", created.plusSeconds(1)))));
        assertFalse(DocumentMatcher.matches(document,
            new JsonObject().put("created", op("$lt", created))));
    }

    @Test
    @DisplayName("Should reject unknown operators")
    void testUnknownOperator() {
        assertThrows(TemporalValidationException.class,
            () -> DocumentMatcher.matches(DOC, new JsonObject().put("sku", op("$regex", "A.*"))));
        assertThrows(TemporalValidationException.class,
            () -> DocumentMatcher.matches(DOC, new JsonObject().put("$where", "true")));
    }
}
