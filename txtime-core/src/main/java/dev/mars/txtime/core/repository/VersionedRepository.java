package dev.mars.txtime.core.repository;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.txtime.api.DeleteOptions;
import dev.mars.txtime.api.DocumentVersion;
import dev.mars.txtime.api.TemporalFields;
import dev.mars.txtime.api.Timestamp;
import dev.mars.txtime.api.UpdateOptions;
import dev.mars.txtime.api.VersionedCollection;
import dev.mars.txtime.api.error.TemporalException;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Typed access to the version chains of a temporal collection. Values are mapped to and
 * from documents with Jackson; the stable identifier is kept outside the value.
 *
 * @param <T> the value type, which must map to a JSON object
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public class VersionedRepository<T> {

    private static final Logger logger = LoggerFactory.getLogger(VersionedRepository.class);

    private final VersionedCollection collection;
    private final Class<T> valueType;
    private final ObjectMapper objectMapper;

    public VersionedRepository(VersionedCollection collection, Class<T> valueType, ObjectMapper objectMapper) {
        this.collection = Objects.requireNonNull(collection, "Collection cannot be null");
        this.valueType = Objects.requireNonNull(valueType, "Value type cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
        if (!collection.isTemporal()) {
            throw new TemporalValidationException(TxTimeErrorCodes.NOT_TEMPORAL_COLLECTION,
                "Versioned repository requires a temporal collection, " + collection.getName() + " is plain");
        }
    }

    /**
     * Starts a new chain.
     */
    public VersionedValue<T> insert(Object id, T value) {
        Objects.requireNonNull(id, "Identifier cannot be null");
        JsonObject document = new JsonObject().put(TemporalFields.ID, id);
        for (Map.Entry<String, Object> field : toDocument(value).getMap().entrySet()) {
            document.put(field.getKey(), field.getValue());
        }
        JsonObject stored = collection.insert(document);
        logger.debug("Inserted {} {} into {}", valueType.getSimpleName(), id, collection.getName());
        return toVersionedValue(DocumentVersion.of(stored));
    }

    /**
     * Replaces the current value, closing the current version.
     *
     * @return whether a current version was replaced
     */
    public boolean replace(Object id, T value) {
        return collection.update(byId(id), toDocument(value), UpdateOptions.single()).modified() > 0;
    }

    /**
     * Closes the current version without a successor.
     *
     * @return whether a current version was closed
     */
    public boolean delete(Object id) {
        return collection.delete(byId(id), DeleteOptions.one()).deleted() > 0;
    }

    public Optional<VersionedValue<T>> current(Object id) {
        return collection.findOne(byId(id)).map(DocumentVersion::of).map(this::toVersionedValue);
    }

    /**
     * The version that was current at {@code time}.
     */
    public Optional<VersionedValue<T>> asOf(Object id, Timestamp time) {
        JsonObject query = byId(id).put(TemporalFields.SELECTOR,
            new JsonObject().put(TemporalFields.SELECTOR_AT, time.toDocument()));
        return collection.findOne(query).map(DocumentVersion::of).map(this::toVersionedValue);
    }

    /**
     * All retained versions, oldest first.
     */
    public List<VersionedValue<T>> history(Object id) {
        return collection.history(id).stream().map(this::toVersionedValue).collect(Collectors.toList());
    }

    private static JsonObject byId(Object id) {
        return new JsonObject().put(TemporalFields.ID, Objects.requireNonNull(id, "Identifier cannot be null"));
    }

    private JsonObject toDocument(T value) {
        Objects.requireNonNull(value, "Value cannot be null");
        JsonNode node = objectMapper.valueToTree(value);
        if (!node.isObject()) {
            throw new TemporalValidationException(TxTimeErrorCodes.INVALID_FIELD_VALUE,
                valueType.getSimpleName() + " does not map to a JSON object");
        }
        try {
            return new JsonObject(objectMapper.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new TemporalException(TxTimeErrorCodes.INTERNAL_ERROR,
                "Failed to serialize " + valueType.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private VersionedValue<T> toVersionedValue(DocumentVersion version) {
        try {
            T value = objectMapper.readValue(version.getFields().encode(), valueType);
            return new VersionedValue<>(version.getStableId(), value, version.getInterval());
        } catch (JsonProcessingException e) {
            throw new TemporalException(TxTimeErrorCodes.INTERNAL_ERROR,
                "Failed to deserialize " + valueType.getSimpleName() + " " + version.getStableId()
                    + ": " + e.getMessage(), e);
        }
    }
}
