package dev.mars.txtime.api.query;

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

import dev.mars.txtime.api.Timestamp;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Total ordering over document values.
 *
 * <p>Values are first grouped into type brackets (null, number, string, object, array,
 * boolean, timestamp, instant). Range comparisons such as {@code $lt} only match
 * within one bracket, while sorting uses the bracket rank across types.</p>
 */
public final class ValueOrdering {

    private ValueOrdering() {
    }

    /**
     * Type bracket of a document value, in sort rank order.
     */
    public enum Bracket {
        NULL, NUMBER, STRING, OBJECT, ARRAY, BOOLEAN, TIMESTAMP, INSTANT, OTHER
    }

    /** Ascending ordering with nulls ranked below every other value. */
    public static final Comparator<Object> NATURAL = ValueOrdering::compare;

    public static Bracket bracketOf(Object value) {
        if (value == null) {
            return Bracket.NULL;
        }
        if (value instanceof Number) {
            return Bracket.NUMBER;
        }
        if (value instanceof CharSequence) {
            return Bracket.STRING;
        }
        if (Timestamp.isLiteral(value)) {
            return Bracket.TIMESTAMP;
        }
        if (value instanceof JsonObject || value instanceof Map) {
            return Bracket.OBJECT;
        }
        if (value instanceof JsonArray || value instanceof List) {
            return Bracket.ARRAY;
        }
        if (value instanceof Boolean) {
            return Bracket.BOOLEAN;
        }
        if (value instanceof Instant) {
            return Bracket.INSTANT;
        }
        return Bracket.OTHER;
    }

    /**
     * Checks whether two values can be range-compared.
     */
    public static boolean comparable(Object a, Object b) {
        Bracket left = bracketOf(a);
        return left != Bracket.NULL && left != Bracket.OTHER && left == bracketOf(b);
    }

    /**
     * Compares two values; nulls first, then by bracket, then by value.
     */
    public static int compare(Object a, Object b) {
        Bracket left = bracketOf(a);
        Bracket right = bracketOf(b);
        if (left != right) {
            return left.compareTo(right);
        }
        switch (left) {
            case NULL:
                return 0;
            case NUMBER:
                if (!isFinite((Number) a) || !isFinite((Number) b)) {
                    return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
                }
                return toBigDecimal((Number) a).compareTo(toBigDecimal((Number) b));
            case STRING:
                return a.toString().compareTo(b.toString());
            case BOOLEAN:
                return Boolean.compare((Boolean) a, (Boolean) b);
            case TIMESTAMP:
                return Timestamp.fromDocument(a).compareTo(Timestamp.fromDocument(b));
            case INSTANT:
                return ((Instant) a).compareTo((Instant) b);
            case OBJECT:
                return compareObjects(asObject(a), asObject(b));
            case ARRAY:
                return compareArrays(asArray(a), asArray(b));
            default:
                return a.toString().compareTo(b.toString());
        }
    }

    /**
     * Value equality consistent with {@link #compare(Object, Object)}.
     */
    public static boolean valueEquals(Object a, Object b) {
        return bracketOf(a) == bracketOf(b) && compare(a, b) == 0;
    }

    private static int compareObjects(JsonObject a, JsonObject b) {
        Iterator<Map.Entry<String, Object>> left = a.iterator();
        Iterator<Map.Entry<String, Object>> right = b.iterator();
        while (left.hasNext() && right.hasNext()) {
            Map.Entry<String, Object> l = left.next();
            Map.Entry<String, Object> r = right.next();
            int byName = l.getKey().compareTo(r.getKey());
            if (byName != 0) {
                return byName;
            }
            int byValue = compare(l.getValue(), r.getValue());
            if (byValue != 0) {
                return byValue;
            }
        }
        return Boolean.compare(left.hasNext(), right.hasNext());
    }

    private static int compareArrays(JsonArray a, JsonArray b) {
        int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            int byValue = compare(a.getValue(i), b.getValue(i));
            if (byValue != 0) {
                return byValue;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    @SuppressWarnings("unchecked")
    private static JsonObject asObject(Object value) {
        return value instanceof JsonObject ? (JsonObject) value : new JsonObject((Map<String, Object>) value);
    }

    @SuppressWarnings("unchecked")
    private static JsonArray asArray(Object value) {
        return value instanceof JsonArray ? (JsonArray) value : new JsonArray((List<Object>) value);
    }

    private static boolean isFinite(Number number) {
        return !(number instanceof Double || number instanceof Float) || Double.isFinite(number.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
