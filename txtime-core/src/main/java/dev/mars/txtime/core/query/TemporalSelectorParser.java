package dev.mars.txtime.core.query;

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
import dev.mars.txtime.api.TemporalSelector;
import dev.mars.txtime.api.Timestamp;
import dev.mars.txtime.api.error.TemporalValidationException;
import dev.mars.txtime.api.error.TxTimeErrorCodes;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Parses the value of the reserved {@code transaction} query field.
 *
 * <p>Accepted forms are {@code {current: true}}, {@code {all: true}}, {@code {at: T}} and
 * {@code {inrange: [T1, T2]}}. A point in time may be a {@code $timestamp} literal, an
 * {@link Instant}, an ISO-8601 string or a number of seconds.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public final class TemporalSelectorParser {

    private TemporalSelectorParser() {
    }

    /**
     * Parses a selector value. A {@code null} value yields the default selector.
     *
     * @throws TemporalValidationException with {@code UNKNOWN_TEMPORAL_SELECTOR} or
     *         {@code INVALID_RANGE}
     */
    public static TemporalSelector parse(Object value) {
        if (value == null) {
            return TemporalSelector.defaultSelector();
        }
        Map<String, Object> selector = asMap(value);
        if (selector == null || selector.size() != 1) {
            throw unknown(value);
        }
        Map.Entry<String, Object> entry = selector.entrySet().iterator().next();
        switch (entry.getKey()) {
            case TemporalFields.SELECTOR_CURRENT:
                requireTrue(entry.getValue(), value);
                return TemporalSelector.current();
            case TemporalFields.SELECTOR_ALL:
                requireTrue(entry.getValue(), value);
                return TemporalSelector.all();
            case TemporalFields.SELECTOR_AT:
                Timestamp at = toTimestamp(entry.getValue());
                if (at == null) {
                    throw new TemporalValidationException(TxTimeErrorCodes.UNKNOWN_TEMPORAL_SELECTOR,
                        "'at' selector requires a point in time: " + describe(value));
                }
                return TemporalSelector.at(at);
            case TemporalFields.SELECTOR_IN_RANGE:
                return parseRange(entry.getValue(), value);
            default:
                throw unknown(value);
        }
    }

    private static TemporalSelector parseRange(Object bounds, Object original) {
        List<Object> range = asList(bounds);
        if (range == null || range.size() != 2) {
            throw new TemporalValidationException(TxTimeErrorCodes.INVALID_RANGE,
                "'inrange' selector requires a two-element array: " + describe(original));
        }
        Timestamp from = range.get(0) == null ? null : toRangeBound(range.get(0), original);
        Timestamp to = range.get(1) == null ? null : toRangeBound(range.get(1), original);
        if (from == null && to == null) {
            throw new TemporalValidationException(TxTimeErrorCodes.INVALID_RANGE,
                "'inrange' selector requires at least one concrete bound: " + describe(original));
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new TemporalValidationException(TxTimeErrorCodes.INVALID_RANGE,
                "'inrange' start " + from + " is after its end " + to);
        }
        return TemporalSelector.inRange(from, to);
    }

    private static Timestamp toRangeBound(Object bound, Object original) {
        Timestamp timestamp = toTimestamp(bound);
        if (timestamp == null) {
            throw new TemporalValidationException(TxTimeErrorCodes.INVALID_RANGE,
                "'inrange' bound is not a point in time: " + describe(original));
        }
        return timestamp;
    }

    /**
     * Converts a point-in-time value, or returns {@code null} when the value is not one.
     */
    static Timestamp toTimestamp(Object value) {
        if (value instanceof Timestamp) {
            return (Timestamp) value;
        }
        if (Timestamp.isLiteral(value)) {
            return Timestamp.fromDocument(value);
        }
        if (value instanceof Instant) {
            Instant instant = (Instant) value;
            return instant.getEpochSecond() < 0 ? null : Timestamp.of(instant);
        }
        if (value instanceof Number) {
            long seconds = ((Number) value).longValue();
            return seconds < 0 ? null : Timestamp.ofSeconds(seconds);
        }
        if (value instanceof CharSequence) {
            try {
                return toTimestamp(Instant.parse(value.toString()));
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    private static void requireTrue(Object flag, Object original) {
        if (!Boolean.TRUE.equals(flag)) {
            throw unknown(original);
        }
    }

    private static TemporalValidationException unknown(Object value) {
        return new TemporalValidationException(TxTimeErrorCodes.UNKNOWN_TEMPORAL_SELECTOR,
            "Unknown temporal selector: " + describe(value));
    }

    private static String describe(Object value) {
        if (value instanceof Map) {
            return new JsonObject(castMap(value)).encode();
        }
        return String.valueOf(value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object value) {
        return (Map<String, Object>) value;
    }

    static Map<String, Object> asMap(Object value) {
        if (value instanceof JsonObject) {
            return ((JsonObject) value).getMap();
        }
        if (value instanceof Map) {
            return castMap(value);
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
}
