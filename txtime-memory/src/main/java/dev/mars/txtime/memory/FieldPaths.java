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

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Map;

/**
 * Resolves dotted field paths against raw document values.
 *
 * <p>Values are read from the backing maps rather than through {@link JsonObject#getValue(String)}
 * so that stored {@code Instant}s keep their type.</p>
 */
final class FieldPaths {

    private FieldPaths() {
    }

    /**
     * A resolved field: {@code present} distinguishes a stored {@code null} from a missing field.
     */
    record FieldValue(boolean present, Object value) {

        static final FieldValue MISSING = new FieldValue(false, null);
    }

    static FieldValue resolve(JsonObject document, String path) {
        Object current = document;
        int from = 0;
        while (true) {
            int dot = path.indexOf('.', from);
            String segment = dot < 0 ? path.substring(from) : path.substring(from, dot);
            Map<String, Object> map = asMap(current);
            if (map != null) {
                if (!map.containsKey(segment)) {
                    return FieldValue.MISSING;
                }
                current = map.get(segment);
            } else {
                List<Object> list = asList(current);
                if (list == null || !isIndex(segment)) {
                    return FieldValue.MISSING;
                }
                int index = Integer.parseInt(segment);
                if (index >= list.size()) {
                    return FieldValue.MISSING;
                }
                current = list.get(index);
            }
            if (dot < 0) {
                return new FieldValue(true, current);
            }
            from = dot + 1;
        }
    }

    /**
     * Raw entries of a document-like value, or {@code null} if the value is not a document.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value) {
        if (value instanceof JsonObject) {
            return ((JsonObject) value).getMap();
        }
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    static List<Object> asList(Object value) {
        if (value instanceof JsonArray) {
            return ((JsonArray) value).getList();
        }
        if (value instanceof List) {
            return (List<Object>) value;
        }
        return null;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
