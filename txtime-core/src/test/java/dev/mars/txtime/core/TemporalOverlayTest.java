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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.txtime.api.UpdateOptions;
import dev.mars.txtime.api.VersionedCollection;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.api.store.CollectionNotFoundException;
import dev.mars.txtime.core.config.TxTimeConfiguration;
import dev.mars.txtime.memory.InMemoryDocumentStore;
import dev.mars.txtime.test.categories.TestCategories;
import dev.mars.txtime.test.clock.SequenceClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class TemporalOverlayTest {

    private InMemoryDocumentStore store;
    private MeterRegistry registry;
    private TemporalOverlay overlay;

    @BeforeEach
    void setUp() {
        TxTimeConfiguration configuration = OverlayFixtures.configuration();
        store = OverlayFixtures.store(configuration);
        registry = new SimpleMeterRegistry();
        overlay = new TemporalOverlay(store, SequenceClock.ofSeconds(10, 20, 30), configuration, registry);
    }

    @AfterEach
    void tearDown() {
        overlay.close();
    }

    @Test
    @DisplayName("Should return the existing collection when created again with the same flag")
    void testCreateCollectionIsIdempotent() {
        VersionedCollection first = overlay.createCollection("orders", true);
        first.insert(new JsonObject().put("_id", "o-1"));

        VersionedCollection second = overlay.createCollection("orders", true);

        assertTrue(second.isTemporal());
        assertEquals(1, second.count(new JsonObject()));
    }

    @Test
    @DisplayName("Should reject re-creating a collection with the other temporal flag")
    void testCreateCollectionConflict() {
        overlay.createCollection("orders", true);

        TemporalValidationException e = assertThrows(TemporalValidationException.class,
            () -> overlay.createCollection("orders", false));
        assertEquals(TxTimeErrorCodes.COLLECTION_OPTIONS_CONFLICT, e.getCode());
    }

    @Test
    @DisplayName("Should look up and drop collections")
    void testGetAndDropCollection() {
        overlay.createCollection("settings", false);

        assertFalse(overlay.getCollection("settings").isTemporal());
        assertThrows(CollectionNotFoundException.class, () -> overlay.getCollection("missing"));

        assertTrue(overlay.dropCollection("settings"));
        assertFalse(overlay.dropCollection("settings"));
        assertThrows(CollectionNotFoundException.class, () -> overlay.getCollection("settings"));
    }

    @Test
    @DisplayName("Should register metrics on the supplied registry")
    void testMetricsBinding() {
        VersionedCollection orders = overlay.createCollection("orders", true);
        orders.insert(new JsonObject().put("_id", "o-1").put("n", 1));
        orders.update(new JsonObject().put("_id", "o-1"),
            new JsonObject().put("$inc", new JsonObject().put("n", 1)),
            UpdateOptions.single());

        assertTrue(overlay.getMetrics().isBound());
        assertEquals("txtime-test", overlay.getMetrics().getInstanceId());
        assertEquals(2.0, registry.get("txtime.versions.inserted").counter().count());
        assertEquals(1.0, registry.get("txtime.versions.closed").counter().count());
        assertEquals(1L, registry.get("txtime.mutation.duration").timer().count());
    }

    @Test
    @DisplayName("Should leave metrics unbound when disabled")
    void testMetricsDisabled() {
        MeterRegistry unused = new SimpleMeterRegistry();
        TemporalOverlay quiet = new TemporalOverlay(store, SequenceClock.ofSeconds(10),
            OverlayFixtures.configuration(TxTimeConfiguration.METRICS_ENABLED, "false"), unused);

        quiet.createCollection("orders", true).insert(new JsonObject().put("_id", "o-1"));

        assertFalse(quiet.getMetrics().isBound());
        assertTrue(unused.getMeters().isEmpty());
        quiet.close();
    }

    @Test
    @DisplayName("Should configure the object mapper for java.time values")
    void testObjectMapper() {
        assertFalse(overlay.getObjectMapper().isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        assertFalse(overlay.getObjectMapper().isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        assertSame(store, overlay.getStore());
        assertSame(registry, overlay.getMeterRegistry());
    }
}
