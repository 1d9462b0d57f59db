package dev.mars.txtime.core.index;

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
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.api.store.IndexDefinition;
import io.vertx.core.json.JsonObject;

import java.util.Map;

/**
 * Shapes index key specs for temporal collections so that every index includes the
 * interval end. A unique index on a shaped spec therefore only constrains current
 * versions, since closed versions differ in their interval end.
 *
 * <ul>
 *   <li>{@code _id.transaction_end} already named: unchanged</li>
 *   <li>{@code transaction: 0}: placeholder removed</li>
 *   <li>{@code transaction: d}, d nonzero: renamed in place, direction kept</li>
 *   <li>no placeholder: {@code _id.transaction_end: 1} prepended</li>
 * </ul>
 */
public final class IndexShaper {

    private IndexShaper() {
    }

    /**
     * @throws TemporalValidationException with {@code INVALID_INDEX_SPEC} when the shaped
     *         spec is empty
     */
    public static JsonObject shapeIndexSpec(JsonObject keys) {
        if (keys == null || keys.isEmpty()) {
            throw new TemporalValidationException(TxTimeErrorCodes.INVALID_INDEX_SPEC, "Index key spec cannot be empty");
        }
        if (keys.containsKey(TemporalFields.TRANSACTION_END_PATH)) {
            return keys.copy();
        }
        JsonObject shaped = new JsonObject();
        if (keys.containsKey(TemporalFields.SELECTOR)) {
            for (Map.Entry<String, Object> entry : keys.copy().getMap().entrySet()) {
                if (!TemporalFields.SELECTOR.equals(entry.getKey())) {
                    shaped.put(entry.getKey(), entry.getValue());
                } else if (!isZero(entry.getValue())) {
                    shaped.put(TemporalFields.TRANSACTION_END_PATH, entry.getValue());
                }
            }
        } else {
            shaped.put(TemporalFields.TRANSACTION_END_PATH, 1);
            for (Map.Entry<String, Object> entry : keys.copy().getMap().entrySet()) {
                shaped.put(entry.getKey(), entry.getValue());
            }
        }
        if (shaped.isEmpty()) {
            throw new TemporalValidationException(TxTimeErrorCodes.INVALID_INDEX_SPEC,
                "Index key spec is empty once the placeholder is removed", keys.encode());
        }
        return shaped;
    }

    /**
     * Shapes a full definition. A generated name follows the shaped keys, an explicit
     * name is kept.
     */
    public static IndexDefinition shape(IndexDefinition definition) {
        JsonObject keys = definition.getKeys();
        boolean explicitName = !definition.getName().equals(IndexDefinition.defaultName(keys));
        return definition.withKeys(shapeIndexSpec(keys), explicitName);
    }

    private static boolean isZero(Object direction) {
        return direction instanceof Number && ((Number) direction).doubleValue() == 0.0;
    }
}
