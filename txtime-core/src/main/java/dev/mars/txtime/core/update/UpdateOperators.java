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
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.Map;

/**
 * Field-level update operators over dotted paths. All operators modify the given
 * document in place.
 */
final class UpdateOperators {

    private UpdateOperators() {
    }

    static void set(JsonObject document, String path, Object value) {
        String[] segments = path.split("\\.");
        Map<String, Object> parent = parentOf(document, segments, path, true);
        parent.put(segments[segments.length - 1], copyValue(value));
    }

    static void unset(JsonObject document, String path) {
        String[] segments = path.split("\\.");
        Map<String, Object> parent = parentOf(document, segments, path, false);
        if (parent != null) {
            parent.remove(segments[segments.length - 1]);
        }
    }

    static void inc(JsonObject document, String path, Number amount) {
        String[] segments = path.split("\\.");
        Map<String, Object> parent = parentOf(document, segments, path, true);
        String leaf = segments[segments.length - 1];
        if (!parent.containsKey(leaf)) {
            parent.put(leaf, amount);
            return;
        }
        Object current = parent.get(leaf);
        if (!(current instanceof Number)) {
            throw new TemporalValidationException(TxTimeErrorCodes.INVALID_FIELD_VALUE,
                "Cannot apply $inc to non-numeric field '" + path + "'", String.valueOf(current));
        }
        parent.put(leaf, add((Number) current, amount, path));
    }

    static Number add(Number a, Number b, String path) {
        if (isIntegral(a) && isIntegral(b)) {
            if (a instanceof Integer && b instanceof Integer) {
                long sum = (long) a.intValue() + b.intValue();
                return sum == (int) sum ? (Number) (int) sum : (Number) sum;
            }
            try {
                return Math.addExact(a.longValue(), b.longValue());
            } catch (ArithmeticException e) {
                throw new TemporalValidationException(TxTimeErrorCodes.INVALID_FIELD_VALUE,
                    "$inc overflows field '" + path + "'", a + " + " + b);
            }
        }
        return a.doubleValue() + b.doubleValue();
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Integer || number instanceof Long
            || number instanceof Short || number instanceof Byte;
    }

    private static Map<String, Object> parentOf(JsonObject document, String[] segments, String path, boolean create) {
        Map<String, Object> current = document.getMap();
        for (int i = 0; i < segments.length - 1; i++) {
            Object next = current.get(segments[i]);
            if (next == null && !current.containsKey(segments[i])) {
                if (!create) {
                    return null;
                }
                JsonObject created = new JsonObject();
                current.put(segments[i], created);
                current = created.getMap();
            } else if (next instanceof JsonObject) {
                current = ((JsonObject) next).getMap();
            } else if (next instanceof Map) {
                current = castMap(next);
            } else {
                if (!create) {
                    return null;
                }
                throw new TemporalValidationException(TxTimeErrorCodes.INVALID_FIELD_VALUE,
                    "Cannot traverse non-document field '" + segments[i] + "' of path '" + path + "'");
            }
        }
        return current;
    }

    private static Object copyValue(Object value) {
        if (value instanceof JsonObject) {
            return ((JsonObject) value).copy();
        }
        if (value instanceof Map) {
            return new JsonObject(castMap(value)).copy();
        }
        if (value instanceof JsonArray) {
            return ((JsonArray) value).copy();
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object value) {
        return (Map<String, Object>) value;
    }
}
