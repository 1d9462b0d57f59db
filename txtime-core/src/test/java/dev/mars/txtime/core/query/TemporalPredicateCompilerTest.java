package dev.mars.txtime.core.query;

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

import dev.mars.txtime.api.TemporalSelector;
import dev.mars.txtime.api.Timestamp;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.test.categories.TestCategories;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for selector compilation and query rewriting.
 */
@Tag(TestCategories.CORE)
class TemporalPredicateCompilerTest {

    private static final Timestamp T1 = Timestamp.ofSeconds(1500);
    private static final Timestamp T2 = Timestamp.ofSeconds(2500);

    private static JsonObject op(String operator, Timestamp operand) {
        return new JsonObject().put(operator, operand.toDocument());
    }

    @Test
    @DisplayName("Should compile current and default selectors to an open interval end")
    void testCompileCurrent() {
        JsonObject expected = new JsonObject().putNull("_id.transaction_end");

        assertEquals(expected, TemporalPredicateCompiler.compile(TemporalSelector.defaultSelector()));
        assertEquals(expected, TemporalPredicateCompiler.compile(TemporalSelector.current()));
        assertTrue(TemporalPredicateCompiler.compile(TemporalSelector.all()).isEmpty());
    }

    @Test
    @DisplayName("Should compile a point in time to start <= T < end")
    void testCompileAt() {
        JsonObject expected = new JsonObject()
            .put("_id.transaction_start", op("$tlte", T1))
            .put("_id.transaction_end", op("$tgt", T1));

        assertEquals(expected, TemporalPredicateCompiler.compile(TemporalSelector.at(T1)));
    }

    @Test
    @DisplayName("Should compile only the concrete bounds of a range")
    void testCompileRange() {
        assertEquals(new JsonObject()
                .put("_id.transaction_end", op("$tgt", T1))
                .put("_id.transaction_start", op("$tlte", T2)),
            TemporalPredicateCompiler.compile(TemporalSelector.inRange(T1, T2)));
        assertEquals(new JsonObject().put("_id.transaction_end", op("$tgt", T1)),
            TemporalPredicateCompiler.compile(TemporalSelector.inRange(T1, null)));
        assertEquals(new JsonObject().put("_id.transaction_start", op("$tlte", T2)),
            TemporalPredicateCompiler.compile(TemporalSelector.inRange(null, T2)));
    }

    @Test
    @DisplayName("Should replace the selector field and rewrite a bare identifier")
    void testCompileQuery() {
        CompiledQuery compiled = TemporalPredicateCompiler.compileQuery(
            new JsonObject().put("_id", "A-1").put("sku", "S1"), true);

        assertEquals(TemporalSelector.Kind.DEFAULT, compiled.selector().getKind());
        assertEquals(new JsonObject().putNull("_id.transaction_end").put("_id._id", "A-1").put("sku", "S1"),
            compiled.predicate());

        CompiledQuery all = TemporalPredicateCompiler.compileQuery(
            new JsonObject().put("sku", "S1").put("transaction", new JsonObject().put("all", true)), true);
        assertEquals(new JsonObject().put("sku", "S1"), all.predicate());
    }

    @Test
    @DisplayName("Should leave operator and composite identifier criteria alone")
    void testIdentifierNotRewritten() {
        JsonObject in = new JsonObject().put("_id", new JsonObject().put("$in", new JsonArray().add("A-1")));
        JsonObject composite = new JsonObject().put("_id", new JsonObject().put("_id", "A-1")
            .put("transaction_start", T1.toDocument()).putNull("transaction_end"));
        JsonObject all = new JsonObject().put("all", true);

        assertEquals(in.copy(), TemporalPredicateCompiler.compileQuery(in.copy().put("transaction", all), true).predicate());
        assertEquals(composite.copy(),
            TemporalPredicateCompiler.compileQuery(composite.copy().put("transaction", all), true).predicate());
    }

    @Test
    @DisplayName("Should use $and when caller criteria collide with the compiled clause")
    void testCollidingCriteria() {
        JsonObject query = new JsonObject()
            .put("_id.transaction_start", op("$tgte", T1))
            .put("transaction", new JsonObject().put("at", T2.toDocument()));

        JsonObject predicate = TemporalPredicateCompiler.compileQuery(query, true).predicate();

        assertEquals(List.of("$and"), new ArrayList<>(predicate.fieldNames()));
        JsonArray branches = predicate.getJsonArray("$and");
        assertEquals(TemporalPredicateCompiler.compile(TemporalSelector.at(T2)), branches.getJsonObject(0));
        assertEquals(new JsonObject().put("_id.transaction_start", op("$tgte", T1)), branches.getJsonObject(1));
    }

    @Test
    @DisplayName("Should reject selectors on plain collections and pass other queries through")
    void testPlainCollection() {
        TemporalValidationException e = assertThrows(TemporalValidationException.class,
            () -> TemporalPredicateCompiler.compileQuery(
                new JsonObject().put("transaction", new JsonObject().put("all", true)), false));
        assertEquals(TxTimeErrorCodes.NOT_TEMPORAL_COLLECTION, e.getCode());

        JsonObject query = new JsonObject().put("_id", "A-1");
        assertEquals(query, TemporalPredicateCompiler.compileQuery(query, false).predicate());
    }

    @Test
    @DisplayName("Should restrict mutation queries to current versions")
    void testMutationQuery() {
        assertEquals(new JsonObject().putNull("_id.transaction_end").put("qty", 5),
            TemporalPredicateCompiler.compileMutationQuery(new JsonObject().put("qty", 5)
                .put("transaction", new JsonObject().put("current", true))));
        assertEquals(new JsonObject().putNull("_id.transaction_end").put("_id._id", "A-1"),
            TemporalPredicateCompiler.compileMutationQuery(new JsonObject().put("_id", "A-1")
                .putNull("_id.transaction_end")));
        assertEquals(new JsonObject().putNull("_id.transaction_end"),
            TemporalPredicateCompiler.compileMutationQuery(null));
    }

    @Test
    @DisplayName("Should reject mutation queries that target historic versions")
    void testNonCurrentMutation() {
        JsonObject allVersions = new JsonObject().put("transaction", new JsonObject().put("all", true));
        JsonObject atPoint = new JsonObject().put("transaction", new JsonObject().put("at", 2000));
        JsonObject closedOnly = new JsonObject().put("_id.transaction_end", op("$tlt", T2));

        for (JsonObject query : List.of(allVersions, atPoint, closedOnly)) {
            TemporalValidationException e = assertThrows(TemporalValidationException.class,
                () -> TemporalPredicateCompiler.compileMutationQuery(query));
            assertEquals(TxTimeErrorCodes.NON_CURRENT_MUTATION, e.getCode());
        }
    }

    @Test
    @DisplayName("Should rewrite the chronological sort key to the interval end")
    void testRewriteSort() {
        JsonObject sort = TemporalPredicateCompiler.rewriteSort(new JsonObject().put("transaction", -1).put("sku", 1));

        assertEquals(List.of("_id.transaction_end", "sku"), new ArrayList<>(sort.fieldNames()));
        assertEquals(-1, sort.getInteger("_id.transaction_end"));
        assertTrue(TemporalPredicateCompiler.rewriteSort(null).isEmpty());
    }
}
