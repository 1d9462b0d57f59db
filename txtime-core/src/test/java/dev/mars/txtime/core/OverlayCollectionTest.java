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
import dev.mars.txtime.api.Interval;
import dev.mars.txtime.api.OperationContext;
import dev.mars.txtime.api.Timestamp;
import dev.mars.txtime.api.UpdateOptions;
import dev.mars.txtime.api.UpdateResult;
import dev.mars.txtime.api.VersionedCollection;
import dev.mars.txtime.api.error.DocumentTooLargeException;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.api.store.DuplicateKeyException;
import dev.mars.txtime.api.store.IndexDefinition;
import dev.mars.txtime.core.config.TxTimeConfiguration;
import dev.mars.txtime.memory.InMemoryDocumentStore;
import dev.mars.txtime.test.categories.TestCategories;
import dev.mars.txtime.test.clock.SequenceClock;
import dev.mars.txtime.test.fixtures.DocumentFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static dev.mars.txtime.test.assertions.VersionChainAssertions.assertChainShape;
import static dev.mars.txtime.test.assertions.VersionChainAssertions.assertChainWellFormed;
import static dev.mars.txtime.test.assertions.VersionChainAssertions.assertChainsWellFormed;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of versioned collections over the in-memory store.
 */
@Tag(TestCategories.CORE)
class OverlayCollectionTest {

    private static final JsonObject ALL = new JsonObject().put("all", true);

    private SequenceClock clock;
    private InMemoryDocumentStore store;
    private TemporalOverlay overlay;
    private VersionedCollection orders;

    @BeforeEach
    void setUp() {
        clock = SequenceClock.ofSeconds(1000, 2000, 3000);
        TxTimeConfiguration configuration = OverlayFixtures.configuration();
        store = OverlayFixtures.store(configuration);
        overlay = new TemporalOverlay(store, clock, configuration, new SimpleMeterRegistry());
        orders = overlay.createCollection("orders", true);
    }

    @AfterEach
    void tearDown() {
        overlay.close();
    }

    private static JsonObject byId(Object id) {
        return new JsonObject().put("_id", id);
    }

    private static JsonObject selector(String kind, Object value) {
        return new JsonObject().put("transaction", new JsonObject().put(kind, value));
    }

    private static JsonObject set(String field, Object value) {
        return new JsonObject().put("$set", new JsonObject().put(field, value));
    }

    private static Interval interval(long start, Long end) {
        return new Interval(Timestamp.ofSeconds(start), end == null ? null : Timestamp.ofSeconds(end));
    }

    private List<DocumentVersion> versions(JsonObject query, FindOptions options) {
        return orders.find(query, options).stream().map(DocumentVersion::of).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should keep both versions after insert at 1000, update at 2000 and delete at 3000")
    void testInsertUpdateDeleteScenario() {
        orders.insert(new JsonObject().put("_id", "X").put("a", 1));
        UpdateResult updated = orders.update(new JsonObject().put("a", 1), set("a", 2), UpdateOptions.single());
        DeleteResult deleted = orders.delete(byId("X"), DeleteOptions.one());

        assertEquals(1, updated.matched());
        assertEquals(1, updated.modified());
        assertEquals(1, deleted.deleted());

        List<DocumentVersion> all = versions(selector("all", true), FindOptions.sortedBy(new JsonObject().put("transaction", 1)));
        assertEquals(2, all.size());
        assertEquals(interval(1000, 2000L), all.get(0).getInterval());
        assertEquals(1, all.get(0).getFields().getInteger("a"));
        assertEquals(interval(2000, 3000L), all.get(1).getInterval());
        assertEquals(2, all.get(1).getFields().getInteger("a"));

        List<DocumentVersion> at2500 = versions(selector("at", 2500), FindOptions.defaults());
        assertEquals(List.of(all.get(1)), at2500);

        assertTrue(orders.find(new JsonObject()).isEmpty());
        assertEquals(0, orders.count(new JsonObject()));
        assertEquals(2, orders.count(selector("all", true)));
        assertChainWellFormed("X", orders.history("X"));
    }

    @Test
    @DisplayName("Should select versions by half-open ranges")
    void testRangeSelection() {
        orders.insert(new JsonObject().put("_id", "X").put("a", 1));
        orders.update(byId("X"), set("a", 2), UpdateOptions.single());
        orders.delete(byId("X"), DeleteOptions.one());

        assertEquals(2, orders.count(selector("inrange", new JsonArray().add(1500).add(2500))));
        assertEquals(1, orders.count(selector("inrange", new JsonArray().add(2000).addNull())),
            "a version ending at 2000 is not alive at 2000");
        assertEquals(1, orders.count(selector("inrange", new JsonArray().addNull().add(1999))));
        assertEquals(0, orders.count(selector("inrange", new JsonArray().add(3000).addNull())));
        List<DocumentVersion> at2000 = versions(selector("at", 2000), FindOptions.defaults());
        assertEquals(1, at2000.size(), "the version closed at 2000 is not selected at 2000");
        assertEquals(2, at2000.get(0).getFields().getInteger("a"));
        assertEquals(0, orders.count(selector("at", 999)));
    }

    @Test
    @DisplayName("Should keep a contiguous chain over many updates")
    void testChainContinuity() {
        orders.insert(new JsonObject().put("_id", "C-1").put("n", 0));
        for (int i = 0; i < 10; i++) {
            orders.update(byId("C-1"), new JsonObject().put("$inc", new JsonObject().put("n", 1)), UpdateOptions.single());
        }

        List<DocumentVersion> history = orders.history("C-1");
        assertChainShape(history, 11, true);
        assertChainWellFormed("C-1", history);
        assertEquals(10, history.get(10).getFields().getInteger("n"));
        assertEquals(10, orders.findOne(byId("C-1")).map(doc -> doc.getInteger("n")).orElseThrow());
    }

    @Test
    @DisplayName("Should close on delete without inserting a successor")
    void testDeleteClosesOnly() {
        orders.insert(new JsonObject().put("_id", "D-1").put("a", 1));
        long before = orders.count(selector("all", true));

        orders.delete(byId("D-1"), DeleteOptions.one());

        assertEquals(before, orders.count(selector("all", true)));
        assertChainShape(orders.history("D-1"), 1, false);
        assertEquals(0, orders.delete(byId("D-1"), DeleteOptions.one()).deleted(), "deleting twice is a no-op");
    }

    @Test
    @DisplayName("Should transition every matching document exactly once in a multi update")
    void testMultiUpdate() {
        List<JsonObject> fixtures = DocumentFixtures.loadDocuments("orders.json");
        orders.insertMany(fixtures);

        UpdateResult result = orders.update(new JsonObject().put("sku", "S1"),
            new JsonObject().put("$inc", new JsonObject().put("qty", 10)), UpdateOptions.multiple());

        assertEquals(3, result.matched());
        assertEquals(3, result.modified());
        assertFalse(result.interrupted());
        assertEquals(List.of(11, 12, 13), orders.find(new JsonObject().put("sku", "S1"),
                FindOptions.sortedBy(new JsonObject().put("qty", 1))).stream()
            .map(doc -> doc.getInteger("qty")).collect(Collectors.toList()));
        assertEquals(fixtures.size() + 3, orders.count(selector("all", true)));
        assertChainsWellFormed(orders.find(selector("all", true)));
    }

    @Test
    @DisplayName("Should stop a multi update at a yield point once cancelled")
    void testCancellationAtYieldPoint() {
        for (int i = 0; i < 10; i++) {
            orders.insert(new JsonObject().put("_id", "Y-" + i).put("batch", "b").put("v", 0));
        }
        OperationContext context = OperationContext.withObserver((ctx, scanned) -> ctx.cancel());

        UpdateResult result = orders.update(new JsonObject().put("batch", "b"), set("v", 1),
            UpdateOptions.multiple(), context);

        assertTrue(result.interrupted());
        assertEquals(4, result.modified(), "yield interval of the test profile is 4");
        assertEquals(4, orders.count(new JsonObject().put("v", 1)));
        assertEquals(6, orders.count(new JsonObject().put("v", 0)));
        assertChainsWellFormed(orders.find(selector("all", true)));
    }

    @Test
    @DisplayName("Should leave unmatched mutations as silent no-ops")
    void testUnmatchedMutation() {
        UpdateResult updated = orders.update(byId("missing"), set("a", 1), UpdateOptions.single());
        DeleteResult deleted = orders.delete(byId("missing"), DeleteOptions.many());

        assertEquals(UpdateResult.none(), updated);
        assertEquals(0, deleted.deleted());
        assertEquals(0, orders.count(selector("all", true)));
    }

    @Test
    @DisplayName("Should version an update that leaves the fields as they were")
    void testUnchangedFieldsStillVersioned() {
        orders.insert(new JsonObject().put("_id", "N-1").put("a", 1));

        UpdateResult result = orders.update(byId("N-1"), set("a", 1), UpdateOptions.single());
        UpdateResult replaced = orders.update(byId("N-1"), new JsonObject().put("a", 1), UpdateOptions.single());

        assertEquals(1, result.matched());
        assertEquals(1, result.modified());
        assertEquals(1, replaced.modified());
        List<DocumentVersion> history = orders.history("N-1");
        assertChainShape(history, 3, true);
        assertChainWellFormed("N-1", history);
        assertEquals(Timestamp.ofSeconds(2000), history.get(0).getInterval().getEnd().orElseThrow());
        assertEquals(Timestamp.ofSeconds(2000), history.get(1).getInterval().getStart());
        history.forEach(version -> assertEquals(new JsonObject().put("a", 1), version.getFields()));
    }

    @Test
    @DisplayName("Should start a new chain when an upsert matches nothing")
    void testUpsert() {
        UpdateResult result = orders.update(new JsonObject().put("_id", "U-1").put("sku", "S7"),
            new JsonObject().put("$inc", new JsonObject().put("qty", 3)), UpdateOptions.upsertSingle());

        assertTrue(result.isUpsert());
        assertEquals("U-1", result.upsertedId());
        JsonObject current = orders.findOne(byId("U-1")).orElseThrow();
        assertEquals("S7", current.getString("sku"));
        assertEquals(3, current.getInteger("qty"));
        assertChainShape(orders.history("U-1"), 1, true);
    }

    @Test
    @DisplayName("Should replace the fields of the current version")
    void testReplacement() {
        orders.insert(new JsonObject().put("_id", "R-1").put("status", "NEW").put("qty", 5));

        orders.update(byId("R-1"), new JsonObject().put("status", "CANCELLED"), UpdateOptions.single());

        assertEquals(new JsonObject().put("status", "CANCELLED"), orders.history("R-1").get(1).getFields());
        TemporalValidationException e = assertThrows(TemporalValidationException.class,
            () -> orders.update(byId("R-1"), new JsonObject().put("_id", "R-2"), UpdateOptions.single()));
        assertEquals(TxTimeErrorCodes.IDENTIFIER_CHANGED, e.getCode());
    }

    @Test
    @DisplayName("Should reject mutations that target historic versions")
    void testHistoricMutationRejected() {
        orders.insert(new JsonObject().put("_id", "H-1").put("a", 1));

        TemporalValidationException e = assertThrows(TemporalValidationException.class,
            () -> orders.update(byId("H-1").put("transaction", ALL), set("a", 2), UpdateOptions.single()));
        assertEquals(TxTimeErrorCodes.NON_CURRENT_MUTATION, e.getCode());
        assertChainShape(orders.history("H-1"), 1, true);
    }

    @Test
    @DisplayName("Should refuse oversized versions before writing anything")
    void testOversizedUpdate() {
        TxTimeConfiguration small = OverlayFixtures.configuration(TxTimeConfiguration.MAX_DOCUMENT_SIZE, "1024");
        TemporalOverlay limited = new TemporalOverlay(store, clock, small, new SimpleMeterRegistry());
        VersionedCollection collection = limited.getCollection("orders");
        collection.insert(new JsonObject().put("_id", "B-1").put("note", "short"));

        assertThrows(DocumentTooLargeException.class,
            () -> collection.update(byId("B-1"), set("note", "x".repeat(2000)), UpdateOptions.single()));

        List<DocumentVersion> history = collection.history("B-1");
        assertChainShape(history, 1, true);
        assertEquals("short", history.get(0).getFields().getString("note"));
    }

    @Test
    @DisplayName("Should make unique indexes constrain current versions only")
    void testUniqueIndexIsCurrentOnly() {
        IndexDefinition persisted = orders.createIndex(IndexDefinition.builder(new JsonObject().put("sku", 1))
            .unique(true).build());
        assertEquals(List.of("_id.transaction_end", "sku"), List.copyOf(persisted.getKeys().fieldNames()));

        orders.insert(new JsonObject().put("_id", "A-1").put("sku", "S1").put("qty", 1));
        orders.update(byId("A-1"), set("qty", 2), UpdateOptions.single());
        assertThrows(DuplicateKeyException.class,
            () -> orders.insert(new JsonObject().put("_id", "B-1").put("sku", "S1")));

        orders.delete(byId("A-1"), DeleteOptions.one());
        orders.insert(new JsonObject().put("_id", "B-1").put("sku", "S1"));
        assertEquals(3, orders.count(new JsonObject().put("sku", "S1").put("transaction", ALL)));
    }

    @Test
    @DisplayName("Should sort, skip and limit across all versions")
    void testSortSkipLimit() {
        orders.insert(new JsonObject().put("_id", "S-1").put("a", 1));
        orders.update(byId("S-1"), set("a", 2), UpdateOptions.single());
        orders.update(byId("S-1"), set("a", 3), UpdateOptions.single());

        FindOptions newestFirst = FindOptions.sortedBy(new JsonObject().put("transaction", -1));
        List<Integer> values = orders.find(selector("all", true), newestFirst).stream()
            .map(doc -> doc.getInteger("a")).collect(Collectors.toList());
        assertEquals(List.of(3, 2, 1), values, "the open version sorts first when descending");

        List<JsonObject> page = orders.find(selector("all", true), newestFirst.withSkip(1).withLimit(1));
        assertEquals(1, page.size());
        assertEquals(2, page.get(0).getInteger("a"));
    }

    @Test
    @DisplayName("Should pass plain collections straight through to the store")
    void testPlainCollection() {
        VersionedCollection plain = overlay.createCollection("settings", false);
        JsonObject stored = plain.insert(new JsonObject().put("key", "mode").put("value", "A"));
        Object id = stored.getValue("_id");
        assertInstanceOf(String.class, id);

        UpdateResult updated = plain.update(new JsonObject().put("key", "mode"), set("value", "B"), UpdateOptions.single());
        assertEquals(1, updated.modified());
        assertEquals(1, plain.count(new JsonObject()));
        assertEquals("B", plain.findOne(byId(id)).orElseThrow().getString("value"));

        assertEquals(TxTimeErrorCodes.NOT_TEMPORAL_COLLECTION, assertThrows(TemporalValidationException.class,
            () -> plain.find(selector("all", true))).getCode());
        assertEquals(TxTimeErrorCodes.NOT_TEMPORAL_COLLECTION, assertThrows(TemporalValidationException.class,
            () -> plain.history(id)).getCode());

        assertEquals(1, plain.delete(byId(id), DeleteOptions.one()).deleted());
        assertEquals(0, store.recordCount("settings"));
        assertFalse(plain.isTemporal());
    }
}
