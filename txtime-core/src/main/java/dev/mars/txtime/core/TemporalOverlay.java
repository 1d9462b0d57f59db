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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.txtime.api.TransactionClock;
import dev.mars.txtime.api.VersionedCollection;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.api.store.CollectionNotFoundException;
import dev.mars.txtime.api.store.CollectionOptions;
import dev.mars.txtime.api.store.DocumentStore;
import dev.mars.txtime.core.clock.HybridTransactionClock;
import dev.mars.txtime.core.codec.VersionCodec;
import dev.mars.txtime.core.config.TxTimeConfiguration;
import dev.mars.txtime.core.metrics.TxTimeMetrics;
import dev.mars.txtime.core.mutation.MutationProtocol;
import dev.mars.txtime.core.repository.VersionedRepository;
import dev.mars.txtime.core.retention.PurgeSweeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the versioning overlay. Wires the clock, codec, mutation protocol,
 * metrics and purge sweeper around a {@link DocumentStore} and hands out
 * {@link VersionedCollection}s.
 *
 * <pre>{@code
 * TemporalOverlay overlay = new TemporalOverlay(InMemoryDocumentStore.create(), new TxTimeConfiguration());
 * VersionedCollection orders = overlay.createCollection("orders", true);
 * orders.insert(new JsonObject().put("_id", "order-1").put("status", "NEW"));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public class TemporalOverlay implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TemporalOverlay.class);

    private final DocumentStore store;
    private final TransactionClock clock;
    private final TxTimeConfiguration configuration;
    private final MeterRegistry meterRegistry;
    private final TxTimeMetrics metrics;
    private final VersionCodec codec;
    private final MutationProtocol protocol;
    private final PurgeSweeper purgeSweeper;
    private final ObjectMapper objectMapper;

    public TemporalOverlay(DocumentStore store, TransactionClock clock, TxTimeConfiguration configuration,
                           MeterRegistry meterRegistry) {
        this.store = Objects.requireNonNull(store, "Document store cannot be null");
        this.clock = Objects.requireNonNull(clock, "Transaction clock cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "Meter registry cannot be null");

        this.metrics = new TxTimeMetrics(configuration.getMetricsConfig().getInstanceId());
        if (configuration.getMetricsConfig().isEnabled()) {
            metrics.bindTo(meterRegistry);
        } else {
            logger.debug("Metrics disabled by configuration");
        }
        this.codec = new VersionCodec(clock);
        this.protocol = new MutationProtocol(store, codec, configuration.getMutationConfig(), metrics);
        this.purgeSweeper = new PurgeSweeper(store, clock, metrics);
        this.objectMapper = createDefaultObjectMapper();

        logger.info("TemporalOverlay initialized (profile: {}, recovery policy: {})",
            configuration.getProfile(), configuration.getMutationConfig().getRecoveryPolicy());
    }

    public TemporalOverlay(DocumentStore store, TxTimeConfiguration configuration) {
        this(store, new HybridTransactionClock(), configuration, new SimpleMeterRegistry());
    }

    /**
     * Creates a collection, or returns the existing one if it was created with the same
     * temporal flag.
     *
     * @throws TemporalValidationException with {@code COLLECTION_OPTIONS_CONFLICT} if the
     *         collection exists with the other flag
     */
    public VersionedCollection createCollection(String name, boolean temporal) {
        Objects.requireNonNull(name, "Collection name cannot be null");
        Optional<CollectionOptions> existing = store.getCollectionOptions(name);
        if (existing.isPresent()) {
            if (existing.get().temporal() != temporal) {
                throw new TemporalValidationException(TxTimeErrorCodes.COLLECTION_OPTIONS_CONFLICT,
                    "Collection " + name + " already exists with temporal=" + existing.get().temporal());
            }
            return new OverlayCollection(name, temporal, store, protocol);
        }
        store.createCollection(name, new CollectionOptions(temporal));
        logger.info("Created {} collection {}", temporal ? "temporal" : "plain", name);
        return new OverlayCollection(name, temporal, store, protocol);
    }

    /**
     * @throws CollectionNotFoundException if the collection does not exist
     */
    public VersionedCollection getCollection(String name) {
        CollectionOptions options = store.getCollectionOptions(name)
            .orElseThrow(() -> new CollectionNotFoundException(name));
        return new OverlayCollection(name, options.temporal(), store, protocol);
    }

    public boolean dropCollection(String name) {
        boolean dropped = store.dropCollection(name);
        if (dropped) {
            logger.info("Dropped collection {}", name);
        }
        return dropped;
    }

    /**
     * Creates a typed repository over a temporal collection.
     *
     * @param <T> the value type
     * @throws TemporalValidationException with {@code NOT_TEMPORAL_COLLECTION} if the
     *         collection is plain
     */
    public <T> VersionedRepository<T> repository(String collection, Class<T> valueType) {
        Objects.requireNonNull(valueType, "Value type cannot be null");
        VersionedCollection target = getCollection(collection);
        logger.debug("Creating versioned repository for {} on {}", valueType.getSimpleName(), collection);
        return new VersionedRepository<>(target, valueType, objectMapper);
    }

    /**
     * Starts the periodic purge sweep if enabled by configuration.
     *
     * @return whether the sweeper was started
     */
    public boolean startPurge(Vertx vertx) {
        TxTimeConfiguration.PurgeConfig purgeConfig = configuration.getPurgeConfig();
        if (!purgeConfig.isEnabled()) {
            logger.debug("Purge sweep disabled by configuration");
            return false;
        }
        purgeSweeper.start(vertx, purgeConfig.getInterval());
        return true;
    }

    public PurgeSweeper getPurgeSweeper() {
        return purgeSweeper;
    }

    public TxTimeMetrics getMetrics() {
        return metrics;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    public TransactionClock getClock() {
        return clock;
    }

    public DocumentStore getStore() {
        return store;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public void close() {
        purgeSweeper.stop();
        logger.info("TemporalOverlay closed");
    }

    private static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
