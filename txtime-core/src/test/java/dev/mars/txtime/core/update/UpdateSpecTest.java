package dev.mars.txtime.core.update;

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

import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.test.categories.TestCategories;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for update document validation and application.
 */
@Tag(TestCategories.CORE)
class UpdateSpecTest {

    private static void assertRejected(String expectedCode, JsonObject update, boolean multi) {
        TemporalValidationException e = assertThrows(TemporalValidationException.class,
            () -> UpdateSpec.parse(update, multi));
        assertEquals(expectedCode, e.getCode());
    }

    @Test
    @DisplayName("Should apply $set, $unset and $inc over dotted paths")
    void testOperators() {
        UpdateSpec spec = UpdateSpec.parse(new JsonObject()
            .put("$set", new JsonObject().put("status", "SHIPPED").put("address.city", "Leeds"))
            .put("$unset", new JsonObject().put("hold", ""))
            .put("$inc", new JsonObject().put("qty", -1).put("stats.views", 1)), true);
        JsonObject fields = new JsonObject().put("status", "NEW").put("qty", 5).put("hold", true);

        JsonObject updated = spec.apply(fields);

        assertEquals(UpdateSpec.Style.OPERATORS, spec.getStyle());
        assertEquals("SHIPPED", updated.getString("status"));
        assertEquals("Leeds", updated.getJsonObject("address").getString("city"));
        assertFalse(updated.containsKey("hold"));
        assertEquals(4, updated.getInteger("qty"));
        assertEquals(1, updated.getJsonObject("stats").getInteger("views"));
        assertEquals(new JsonObject().put("status", "NEW").put("qty", 5).put("hold", true), fields,
            "argument must not be modified");
    }

    @Test
    @DisplayName("Should widen integer increments only when they overflow")
    void testIncrementWidening() {
        JsonObject fields = new JsonObject().put("small", 1).put("big", Integer.MAX_VALUE).put("ratio", 1.5);
        JsonObject updated = UpdateSpec.parse(new JsonObject().put("$inc",
            new JsonObject().put("small", 2).put("big", 1).put("ratio", 1)), false).apply(fields);

        assertEquals(Integer.valueOf(3), updated.getValue("small"));
        assertEquals(Long.valueOf(Integer.MAX_VALUE + 1L), updated.getValue("big"));
        assertEquals(2.5, updated.getDouble("ratio"));
    }

    @Test
    @DisplayName("Should reject $inc on a non-numeric field when applied")
    void testIncOnNonNumber() {
        UpdateSpec spec = UpdateSpec.parse(new JsonObject().put("$inc", new JsonObject().put("status", 1)), false);

        TemporalValidationException e = assertThrows(TemporalValidationException.class,
            () -> spec.apply(new JsonObject().put("status", "NEW")));
        assertEquals(TxTimeErrorCodes.INVALID_FIELD_VALUE, e.getCode());
    }

    @Test
    @DisplayName("Should treat a document without operators as a replacement")
    void testReplacement() {
        JsonObject replacement = new JsonObject().put("status", "CANCELLED");
        UpdateSpec spec = UpdateSpec.parse(replacement, false);

        assertEquals(UpdateSpec.Style.REPLACEMENT, spec.getStyle());
        assertEquals(replacement, spec.apply(new JsonObject().put("status", "NEW").put("qty", 5)));
        assertEquals(replacement, spec.getReplacement());
    }

    @Test
    @DisplayName("Should reject invalid update documents")
    void testValidation() {
        assertRejected(TxTimeErrorCodes.MIXED_UPDATE_STYLES,
            new JsonObject().put("$set", new JsonObject().put("a", 1)).put("b", 2), false);
        assertRejected(TxTimeErrorCodes.MULTI_REQUIRES_OPERATORS, new JsonObject().put("b", 2), true);
        assertRejected(TxTimeErrorCodes.UNKNOWN_UPDATE_OPERATOR,
            new JsonObject().put("$push", new JsonObject().put("tags", "x")), false);
        assertRejected(TxTimeErrorCodes.IDENTIFIER_CHANGED,
            new JsonObject().put("$set", new JsonObject().put("_id", "B-2")), false);
        assertRejected(TxTimeErrorCodes.IDENTIFIER_CHANGED,
            new JsonObject().put("$unset", new JsonObject().put("_id.transaction_end", "")), false);
        assertRejected(TxTimeErrorCodes.INVALID_FIELD_VALUE,
            new JsonObject().put("$inc", new JsonObject().put("qty", "one")), false);
        assertRejected(TxTimeErrorCodes.VALIDATION_FAILED,
            new JsonObject().put("$set", new JsonArray().add("qty")), false);
        assertRejected(TxTimeErrorCodes.VALIDATION_FAILED, new JsonObject()
            .put("$set", new JsonObject().put("address", new JsonObject()))
            .put("$unset", new JsonObject().put("address.city", "")), false);
    }

    @Test
    @DisplayName("Should seed an upsert from the query's equality fields")
    void testUpsertSeed() {
        UpdateSpec spec = UpdateSpec.parse(new JsonObject().put("$inc", new JsonObject().put("qty", 2)), false);
        JsonObject query = new JsonObject()
            .put("_id", "A-9")
            .put("sku", "S9")
            .put("price", new JsonObject().put("$gt", 10))
            .put("transaction", new JsonObject().put("current", true));

        JsonObject seed = spec.upsertSeed(query);

        assertEquals(new JsonObject().put("_id", "A-9").put("sku", "S9").put("qty", 2), seed);
        assertEquals("_id", seed.fieldNames().iterator().next());
    }

    @Test
    @DisplayName("Should seed a replacement upsert with the query's identifier")
    void testReplacementUpsertSeed() {
        UpdateSpec spec = UpdateSpec.parse(new JsonObject().put("status", "NEW"), false);

        assertEquals(new JsonObject().put("_id", "A-9").put("status", "NEW"),
            spec.upsertSeed(new JsonObject().put("_id", "A-9").put("sku", "ignored")));
    }
}
