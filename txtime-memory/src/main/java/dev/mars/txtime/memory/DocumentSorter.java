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

import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import dev.mars.txtime.api.query.ValueOrdering;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Builds comparators from sort specs such as {@code {"qty": -1, "sku": 1}}.
 *
 * <p>Missing and {@code null} values sort last in ascending order and first in descending
 * order, so a chronological sort on an interval end places Open versions after every
 * closed one.</p>
 */
final class DocumentSorter {

    private DocumentSorter() {
    }

    static Comparator<JsonObject> comparator(JsonObject sort) {
        List<Comparator<JsonObject>> keys = new ArrayList<>();
        for (Map.Entry<String, Object> entry : sort.getMap().entrySet()) {
            String path = entry.getKey();
            int direction = direction(path, entry.getValue());
            Comparator<JsonObject> byKey = (a, b) -> compareNullsLast(
                FieldPaths.resolve(a, path).value(), FieldPaths.resolve(b, path).value());
            keys.add(direction < 0 ? byKey.reversed() : byKey);
        }
        return (a, b) -> {
            for (Comparator<JsonObject> key : keys) {
                int result = key.compare(a, b);
                if (result != 0) {
                    return result;
                }
            }
            return 0;
        };
    }

    static int compareNullsLast(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        return ValueOrdering.compare(a, b);
    }

    private static int direction(String path, Object value) {
        if (value instanceof Number) {
            int direction = Integer.signum(((Number) value).intValue());
            if (direction != 0) {
                return direction;
            }
        }
        throw new TemporalValidationException(TxTimeErrorCodes.VALIDATION_FAILED,
            "Sort direction for '" + path + "' must be 1 or -1, got " + value);
    }
}
